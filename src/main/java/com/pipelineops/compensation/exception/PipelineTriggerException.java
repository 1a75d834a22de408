package com.pipelineops.compensation.exception;

/**
 * Thrown when a pipeline execution could not be started.
 */
public class PipelineTriggerException extends CompensationException {

    private final String pipelineConfigId;

    public PipelineTriggerException(String message, String pipelineConfigId) {
        super(message);
        this.pipelineConfigId = pipelineConfigId;
    }

    public PipelineTriggerException(String message, String pipelineConfigId, Throwable cause) {
        super(message, cause);
        this.pipelineConfigId = pipelineConfigId;
    }

    public String getPipelineConfigId() {
        return pipelineConfigId;
    }
}
