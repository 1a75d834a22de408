package com.pipelineops.compensation.scheduler;

/**
 * Lifecycle of the compensation job. Moves forward only.
 */
public enum CompensationState {
    /**
     * Polling the pipeline cache until it returns pipelines. Cache errors keep the job here.
     */
    AWAITING_CACHE,

    /**
     * Looking up latest executions and re-firing missed triggers.
     */
    EVALUATING,

    /**
     * The single pass is over, successfully or not. Nothing else will run.
     */
    DONE
}
