package com.pipelineops.compensation.exception;

/**
 * A trigger's cron expression could not be parsed.
 * Only the offending trigger is skipped.
 */
public class InvalidCronExpressionException extends CompensationException {

    private final String cronExpression;

    public InvalidCronExpressionException(String cronExpression, Throwable cause) {
        super("Invalid cron expression '" + cronExpression + "': " + cause.getMessage(), cause);
        this.cronExpression = cronExpression;
    }

    public InvalidCronExpressionException(String cronExpression, String reason) {
        super("Invalid cron expression '" + cronExpression + "': " + reason);
        this.cronExpression = cronExpression;
    }

    public String getCronExpression() {
        return cronExpression;
    }
}
