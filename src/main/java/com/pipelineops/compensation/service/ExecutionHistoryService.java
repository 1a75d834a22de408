package com.pipelineops.compensation.service;

import com.pipelineops.compensation.dto.ExecutionRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Looks up the most recent executions of pipeline configs.
 */
public interface ExecutionHistoryService {

    /**
     * Fetches the latest executions for all given pipeline configs in one call.
     * <p>
     * Each config may contribute zero or more records; records of the same config
     * are ordered most recent first. The call either succeeds or fails as a whole.
     *
     * @param pipelineConfigIds ids of the pipeline definitions to look up
     * @return the records, or an error signal carrying an
     *         {@link com.pipelineops.compensation.exception.ExecutionHistoryException}
     */
    Mono<List<ExecutionRecord>> getLatestPipelineExecutions(List<String> pipelineConfigIds);
}
