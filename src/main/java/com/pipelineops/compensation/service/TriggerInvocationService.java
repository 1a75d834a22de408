package com.pipelineops.compensation.service;

import com.pipelineops.compensation.entity.Pipeline;
import com.pipelineops.compensation.exception.PipelineTriggerException;

/**
 * Starts pipeline executions.
 * <p>
 * Implementations:
 * - PipelineInitiator: records a running execution in the local execution store
 */
public interface TriggerInvocationService {

    /**
     * Starts a new execution of the given pipeline.
     *
     * @throws PipelineTriggerException if the execution could not be started
     */
    void start(Pipeline pipeline) throws PipelineTriggerException;
}
