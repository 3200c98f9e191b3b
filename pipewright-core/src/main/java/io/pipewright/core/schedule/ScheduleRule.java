package io.pipewright.core.schedule;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;

/// When a scheduled job fires.
///
/// Exactly one representation is active: a fixed {@link Interval} or a
/// {@link Cron} recurrence. Both are validated at construction, so a rule
/// that exists is always usable.
///
/// ### Permitted Subtypes
/// - {@link Interval} - every fixed duration
/// - {@link Cron} - at each time matching a cron expression
///
/// @see ScheduledJob
public sealed interface ScheduleRule {

    /// Fires every `period`.
    ///
    /// The first fire happens one full period after the job starts, or
    /// right away when `fireImmediately` is set.
    ///
    /// @param period time between fires, positive and at most {@link #MAX_PERIOD}
    /// @param fireImmediately whether to fire once at start
    record Interval(Duration period, boolean fireImmediately) implements ScheduleRule {

        /// Longest supported period, the range of a nanosecond timer (about 292 years).
        public static final Duration MAX_PERIOD = Duration.ofNanos(Long.MAX_VALUE);

        public Interval {
            if (period == null) {
                throw new ScheduleConfigException("Interval period must not be null");
            }
            if (period.isZero() || period.isNegative()) {
                throw new ScheduleConfigException("Interval must be positive, got " + period);
            }
            if (period.compareTo(MAX_PERIOD) > 0) {
                throw new ScheduleConfigException(
                        "Interval must not exceed " + MAX_PERIOD + ", got " + period);
            }
        }

        /// Returns a copy that fires once at start.
        ///
        /// @return immediate-firing interval, never null
        public Interval firingImmediately() {
            return new Interval(period, true);
        }
    }

    /// Fires at each minute matching a cron expression.
    ///
    /// @param expression parsed expression, not null
    record Cron(CronExpression expression) implements ScheduleRule {
        public Cron {
            if (expression == null) {
                throw new ScheduleConfigException("Cron expression must not be null");
            }
        }

        /// Returns the next fire time strictly after a reference time.
        ///
        /// @param after reference time, not null
        /// @return next fire time, empty if the expression never matches again
        public Optional<ZonedDateTime> nextFire(ZonedDateTime after) {
            return expression.next(after);
        }
    }

    /// Creates an interval rule.
    ///
    /// @param period time between fires, positive
    /// @return interval rule, never null
    /// @throws ScheduleConfigException if the period is null, not positive or too long
    static Interval interval(Duration period) {
        return new Interval(period, false);
    }

    /// Creates an interval rule from an ISO-8601 duration such as `PT15M` or `P1W`.
    ///
    /// @param isoDuration duration string, not null
    /// @return interval rule, never null
    /// @throws ScheduleConfigException if the duration is malformed
    /// @see IsoDurations#parse(String)
    static Interval interval(String isoDuration) {
        return new Interval(IsoDurations.parse(isoDuration), false);
    }

    /// Creates a cron rule.
    ///
    /// @param expression five-field expression or shorthand, not null
    /// @return cron rule, never null
    /// @throws ScheduleConfigException if the expression is malformed
    static Cron cron(String expression) {
        return new Cron(CronExpression.parse(expression));
    }

    /// Creates a rule from optional settings of which exactly one must be present.
    ///
    /// @param interval interval, may be null
    /// @param cronExpression cron expression, may be null or blank
    /// @return the rule, never null
    /// @throws ScheduleConfigException if both or neither are given, or the
    ///         given one is invalid
    static ScheduleRule of(Duration interval, String cronExpression) {
        boolean hasCron = cronExpression != null && !cronExpression.isBlank();
        if (interval != null && hasCron) {
            throw new ScheduleConfigException(
                    "Schedule must define either an interval or a cron expression, not both");
        }
        if (interval == null && !hasCron) {
            throw new ScheduleConfigException(
                    "Schedule must define either an interval or a cron expression");
        }
        return interval != null ? interval(interval) : cron(cronExpression);
    }
}
