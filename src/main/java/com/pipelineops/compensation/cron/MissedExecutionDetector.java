package com.pipelineops.compensation.cron;

import com.pipelineops.compensation.exception.InvalidCronExpressionException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.TimeZone;

/**
 * Decides whether a cron trigger missed a run inside the compensation window.
 * <p>
 * A trigger is missed when, counting from its last execution, the first scheduled
 * fire time after the window floor is still before now. Executions older than the
 * floor are never compensated, no matter how many runs were skipped since.
 */
public final class MissedExecutionDetector {

    /**
     * Upper bound on consecutive valid seconds when looking for the next invalid time.
     * An expression that matches every second of a whole day is rejected.
     */
    static final int MAX_CONSECUTIVE_VALID_SECONDS = 24 * 60 * 60;

    private MissedExecutionDetector() {
    }

    /**
     * Parses a Quartz cron expression bound to the given time zone.
     *
     * @throws InvalidCronExpressionException if the expression is blank or malformed
     */
    public static CronExpression parse(String cronExpression, TimeZone timeZone) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidCronExpressionException(cronExpression, "expression is empty");
        }
        try {
            CronExpression expr = new CronExpression(cronExpression);
            expr.setTimeZone(timeZone);
            return expr;
        } catch (ParseException e) {
            throw new InvalidCronExpressionException(cronExpression, e);
        }
    }

    public static boolean missedExecution(String cronExpression, Instant lastExecution, WindowContext window) {
        CronExpression expr = parse(cronExpression, window.getQuartzTimeZone());
        return missedExecution(expr, lastExecution, window.getWindowFloor(), window.getNow());
    }

    /**
     * @param expr          expression with its time zone already set
     * @param lastExecution start time of the most recent execution, null if it never ran
     * @param windowFloor   oldest instant still eligible for compensation
     * @param now           end of the window
     * @return true if a scheduled run between the floor and now has no execution
     */
    public static boolean missedExecution(CronExpression expr, Instant lastExecution,
                                          Instant windowFloor, Instant now) {
        if (lastExecution == null) {
            return false;
        }

        // Quartz works per second, so for 12:00:00 the next "valid" time of a minute schedule
        // can be 12:00:01. Count from the next invalid time or on-time runs get re-triggered.
        Date last = nextInvalidTimeAfter(expr, Date.from(lastExecution));
        Date floor = Date.from(windowFloor);

        if (last.before(floor)) {
            return false;
        }

        Date nextExecution = expr.getNextValidTimeAfter(last);
        while (nextExecution != null && !nextExecution.after(floor)) {
            nextExecution = expr.getNextValidTimeAfter(nextExecution);
        }

        // no further fire times, e.g. a year field in the past
        if (nextExecution == null) {
            return false;
        }
        return nextExecution.before(Date.from(now));
    }

    /**
     * First whole second after {@code date} at which the expression does not fire.
     * Same contract as {@link CronExpression#getNextInvalidTimeAfter(Date)}, but bounded.
     */
    static Date nextInvalidTimeAfter(CronExpression expr, Date date) {
        long lastMillis = date.getTime() - Math.floorMod(date.getTime(), 1000L);
        for (int i = 0; i < MAX_CONSECUTIVE_VALID_SECONDS; i++) {
            Date next = expr.getNextValidTimeAfter(new Date(lastMillis));
            if (next == null || next.getTime() - lastMillis != 1000L) {
                return new Date(lastMillis + 1000L);
            }
            lastMillis = next.getTime();
        }
        throw new InvalidCronExpressionException(expr.getCronExpression(),
                "fires every second for more than a day");
    }
}
