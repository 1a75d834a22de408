package com.pipelineops.compensation.cron;

import com.pipelineops.compensation.exception.InvalidCronExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for MissedExecutionDetector.
 * <p>
 * Tests cover:
 * - Window boundaries around the last execution
 * - Executions too old to compensate
 * - Time zone handling
 * - Cron parsing failures
 */
class MissedExecutionDetectorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final ZoneId LOS_ANGELES = ZoneId.of("America/Los_Angeles");

    private static final String HOURLY = "0 0 * * * ?";
    private static final String EVERY_FIVE_MINUTES = "0 0/5 * * * ?";

    @Nested
    @DisplayName("Hourly Schedule Tests")
    class HourlyScheduleTests {

        @Test
        @DisplayName("Should not compensate when the last execution is before the window floor")
        void shouldNotCompensateExecutionBeforeFloor() {
            // Given: bumped to 09:00:01, which is before the 10:00 floor
            CronExpression expr = cron(HOURLY, UTC);

            // When
            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T09:00:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:45:00", UTC));

            // Then
            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should not compensate when the next run is still in the future")
        void shouldNotCompensateWhenNextRunIsAfterNow() {
            CronExpression expr = cron(HOURLY, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:45:00", UTC));

            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should compensate when the next run after the last execution has passed")
        void shouldCompensateWhenNextRunHasPassed() {
            // Given: next fire after 10:00:01 is 11:00, before now
            CronExpression expr = cron(HOURLY, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T11:05:00", UTC));

            assertThat(missed).isTrue();
        }

        @Test
        @DisplayName("Should not compensate when the next run is exactly now")
        void shouldNotCompensateWhenNextRunIsNow() {
            CronExpression expr = cron(HOURLY, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T11:00:00", UTC));

            assertThat(missed).isFalse();
        }
    }

    @Nested
    @DisplayName("Frequent Schedule Tests")
    class FrequentScheduleTests {

        @Test
        @DisplayName("Should compensate a run skipped inside the window")
        void shouldCompensateSkippedRunInsideWindow() {
            // Given: ran at 10:05, 10:10 should have fired before 10:30
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T10:05:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:30:00", UTC));

            assertThat(missed).isTrue();
        }

        @Test
        @DisplayName("Should not re-trigger a run that fired on schedule")
        void shouldNotRetriggerOnScheduleRun() {
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T10:25:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:29:00", UTC));

            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should ignore sub-second offsets of the last execution")
        void shouldIgnoreMillisecondsOfLastExecution() {
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);
            Instant lastExecution = at("2024-03-12T10:25:00", UTC).plusMillis(750);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    lastExecution, at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:29:59", UTC));

            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should not compensate old executions no matter how many runs were skipped")
        void shouldNotCompensateOldExecutions() {
            // Given: last ran at 08:00, two dozen runs skipped since
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    at("2024-03-12T08:00:00", UTC), at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:30:00", UTC));

            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should never compensate a trigger that has not executed")
        void shouldNotCompensateWithoutLastExecution() {
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);

            boolean missed = MissedExecutionDetector.missedExecution(expr,
                    null, at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:30:00", UTC));

            assertThat(missed).isFalse();
        }
    }

    @Nested
    @DisplayName("Time Zone Tests")
    class TimeZoneTests {

        private final WindowContext window = new WindowContext(LOS_ANGELES,
                at("2024-01-15T09:05:00", LOS_ANGELES), at("2024-01-15T09:35:00", LOS_ANGELES));

        @Test
        @DisplayName("Should evaluate the expression in the window's time zone")
        void shouldEvaluateInWindowTimeZone() {
            // every 10 minutes during the 9am hour, Los Angeles time
            boolean missed = MissedExecutionDetector.missedExecution("0 0/10 9 * * ?",
                    at("2024-01-15T09:10:00", LOS_ANGELES), window);

            assertThat(missed).isTrue();
        }

        @Test
        @DisplayName("Should not match the same wall clock hour in another zone")
        void shouldNotMatchOtherZone() {
            CronExpression utcExpr = cron("0 0/10 9 * * ?", UTC);

            boolean missed = MissedExecutionDetector.missedExecution(utcExpr,
                    at("2024-01-15T09:10:00", LOS_ANGELES), window.getWindowFloor(), window.getNow());

            assertThat(missed).isFalse();
        }
    }

    @Nested
    @DisplayName("Invalid Expression Tests")
    class InvalidExpressionTests {

        private final WindowContext window = new WindowContext(UTC,
                at("2024-03-12T10:00:00", UTC), at("2024-03-12T10:30:00", UTC));

        @Test
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformedExpression() {
            assertThatThrownBy(() -> MissedExecutionDetector.missedExecution("every tuesday",
                    at("2024-03-12T10:05:00", UTC), window))
                    .isInstanceOf(InvalidCronExpressionException.class)
                    .hasMessageContaining("every tuesday");
        }

        @Test
        @DisplayName("Should reject blank expressions")
        void shouldRejectBlankExpression() {
            assertThatThrownBy(() -> MissedExecutionDetector.parse("  ", TimeZone.getTimeZone(UTC)))
                    .isInstanceOf(InvalidCronExpressionException.class);
        }

        @Test
        @DisplayName("Should treat an expression without future fire times as not missed")
        void shouldHandleExpressionWithoutFutureFireTimes() {
            boolean missed = MissedExecutionDetector.missedExecution("0 0 10 1 1 ? 2020",
                    at("2024-03-12T10:05:00", UTC), window);

            assertThat(missed).isFalse();
        }

        @Test
        @DisplayName("Should reject expressions that never stop firing")
        void shouldRejectExpressionFiringEverySecond() {
            CronExpression expr = cron("* * * * * ?", UTC);

            assertThatThrownBy(() -> MissedExecutionDetector.nextInvalidTimeAfter(expr,
                    Date.from(at("2024-03-12T10:05:00", UTC))))
                    .isInstanceOf(InvalidCronExpressionException.class);
        }
    }

    @Nested
    @DisplayName("Next Invalid Time Tests")
    class NextInvalidTimeTests {

        @Test
        @DisplayName("Should move one second past a minute-level fire time")
        void shouldMoveOneSecondPastFireTime() {
            Date next = MissedExecutionDetector.nextInvalidTimeAfter(cron(HOURLY, UTC),
                    Date.from(at("2024-03-12T10:00:00", UTC)));

            assertThat(next.toInstant()).isEqualTo(at("2024-03-12T10:00:01", UTC));
        }

        @Test
        @DisplayName("Should skip over consecutive valid seconds")
        void shouldSkipConsecutiveValidSeconds() {
            // fires every second during minute 0 of each hour
            Date next = MissedExecutionDetector.nextInvalidTimeAfter(cron("* 0 * * * ?", UTC),
                    Date.from(at("2024-03-12T10:00:00", UTC)));

            assertThat(next.toInstant()).isEqualTo(at("2024-03-12T10:01:00", UTC));
        }

        @Test
        @DisplayName("Should agree with Quartz for ordinary expressions")
        void shouldAgreeWithQuartz() {
            CronExpression expr = cron(EVERY_FIVE_MINUTES, UTC);
            Date date = Date.from(at("2024-03-12T10:25:00", UTC).plusMillis(300));

            assertThat(MissedExecutionDetector.nextInvalidTimeAfter(expr, date))
                    .isEqualTo(expr.getNextInvalidTimeAfter(date));
        }
    }

    @Nested
    @DisplayName("Window Boundary Properties")
    class WindowBoundaryProperties {

        private final List<Instant> floors = List.of(
                at("2024-03-11T00:00:00", LOS_ANGELES),
                at("2024-03-12T09:17:00", LOS_ANGELES),
                at("2024-03-13T12:00:00", LOS_ANGELES),
                at("2024-03-15T23:59:00", LOS_ANGELES),
                at("2024-03-17T06:45:00", LOS_ANGELES));

        @ParameterizedTest
        @ValueSource(strings = {
                "0 0 * * * ?",
                "0 0/15 * * * ?",
                "0 30 9 * * ?",
                "0 0 12 ? * MON",
                "0 0/5 9-17 ? * MON-FRI"
        })
        @DisplayName("Should not compensate when the last run was the last fire time at or before the floor")
        void shouldNotCompensatePrematurely(String expression) {
            CronExpression expr = cron(expression, LOS_ANGELES);

            for (Instant floor : floors) {
                Instant lastExecution = lastFireTimeAtOrBefore(expr, floor);
                Instant now = expr.getNextValidTimeAfter(Date.from(floor)).toInstant();

                assertThat(MissedExecutionDetector.missedExecution(expr, lastExecution, floor, now))
                        .as("%s with last run %s, floor %s, now %s", expression, lastExecution, floor, now)
                        .isFalse();
            }
        }
    }

    // Helper methods

    private static CronExpression cron(String expression, ZoneId zone) {
        return MissedExecutionDetector.parse(expression, TimeZone.getTimeZone(zone));
    }

    private static Instant at(String localDateTime, ZoneId zone) {
        return LocalDateTime.parse(localDateTime).atZone(zone).toInstant();
    }

    private static Instant lastFireTimeAtOrBefore(CronExpression expr, Instant instant) {
        Date candidate = expr.getNextValidTimeAfter(Date.from(instant.minus(Duration.ofDays(8))));
        Date last = null;
        while (candidate != null && !candidate.toInstant().isAfter(instant)) {
            last = candidate;
            candidate = expr.getNextValidTimeAfter(candidate);
        }
        return last.toInstant();
    }
}
