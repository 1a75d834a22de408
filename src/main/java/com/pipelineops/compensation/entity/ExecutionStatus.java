package com.pipelineops.compensation.entity;

/**
 * Lifecycle status of a pipeline execution.
 */
public enum ExecutionStatus {
    /**
     * Created but not picked up yet. Such executions have no start time.
     */
    NOT_STARTED,

    RUNNING,

    SUCCEEDED,

    FAILED,

    CANCELED
}
