package com.pipelineops.compensation.cron;

import com.pipelineops.compensation.exception.InvalidCompensationConfigException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.TimeZone;

/**
 * The lookback window of a compensation pass: {@code [windowFloor, now]} in a cron time zone.
 * <p>
 * Computed once when the job is built and never re-read, so every trigger in a pass
 * is judged against the same window.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class WindowContext {

    private final ZoneId timeZone;
    private final Instant windowFloor;
    private final Instant now;

    public WindowContext(ZoneId timeZone, Instant windowFloor, Instant now) {
        if (timeZone == null || windowFloor == null || now == null) {
            throw new InvalidCompensationConfigException("Time zone, window floor and now are all required");
        }
        if (!windowFloor.isBefore(now)) {
            throw new InvalidCompensationConfigException(
                    "Window floor " + windowFloor + " must be before " + now);
        }
        this.timeZone = timeZone;
        this.windowFloor = windowFloor;
        this.now = now;
    }

    /**
     * Builds the window ending at the clock's current instant.
     *
     * @param timeZoneId           zone the cron expressions are evaluated in, e.g. {@code America/Los_Angeles}
     * @param compensationWindowMs how far back to look, must be positive
     * @param clock                source of "now"
     * @throws InvalidCompensationConfigException for an unknown zone id or a non-positive window
     */
    public static WindowContext fromCompensationWindow(String timeZoneId, long compensationWindowMs, Clock clock) {
        if (timeZoneId == null || timeZoneId.isBlank()) {
            throw new InvalidCompensationConfigException("Cron time zone must be configured");
        }
        if (compensationWindowMs <= 0) {
            throw new InvalidCompensationConfigException(
                    "Compensation window must be positive, got " + compensationWindowMs + "ms");
        }

        ZoneId zone;
        try {
            zone = ZoneId.of(timeZoneId);
        } catch (DateTimeException e) {
            throw new InvalidCompensationConfigException("Unknown cron time zone: " + timeZoneId, e);
        }

        Instant now = clock.instant();
        return new WindowContext(zone, now.minusMillis(compensationWindowMs), now);
    }

    /**
     * The zone as a {@link TimeZone}, which is what Quartz expects.
     */
    public TimeZone getQuartzTimeZone() {
        return TimeZone.getTimeZone(timeZone);
    }
}
