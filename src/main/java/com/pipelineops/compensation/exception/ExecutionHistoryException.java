package com.pipelineops.compensation.exception;

import java.util.List;

/**
 * Thrown when the latest executions for a batch of pipeline configs cannot be fetched.
 */
public class ExecutionHistoryException extends CompensationException {

    private final List<String> pipelineConfigIds;

    public ExecutionHistoryException(String message, List<String> pipelineConfigIds, Throwable cause) {
        super(message, cause);
        this.pipelineConfigIds = pipelineConfigIds == null ? List.of() : List.copyOf(pipelineConfigIds);
    }

    public List<String> getPipelineConfigIds() {
        return pipelineConfigIds;
    }
}
