package com.pipelineops.compensation.entity;

/**
 * Kinds of triggers a pipeline can declare.
 * Only {@link #CRON} triggers are considered by the compensation job.
 */
public enum TriggerType {
    /**
     * Time based trigger driven by a Quartz cron expression.
     */
    CRON,

    GIT,

    JENKINS,

    /**
     * Fired when another pipeline completes.
     */
    PIPELINE,

    WEBHOOK
}
