package io.pipewright.core.schedule;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Configuration options for scheduled jobs.
///
/// ### Default Values
/// - `backlogPolicy`: {@link BacklogPolicy#COLLAPSE}
/// - `maxPendingFires`: `16` (only used with {@link BacklogPolicy#QUEUE_ALL})
/// - `shutdownPolicy`: {@link ShutdownPolicy#DISCARD}
/// - `zone`: the system default zone, used to evaluate cron rules
/// - `clock`: the system clock
///
/// ### Property Keys
/// - `pipewright.scheduler.backlog-policy` (`collapse` or `queue-all`)
/// - `pipewright.scheduler.max-pending-fires`
/// - `pipewright.scheduler.shutdown-policy` (`drain` or `discard`)
/// - `pipewright.scheduler.zone`
///
/// @implNote **Not thread-safe**. Configure before building a job; a job
/// reads the values once at construction.
public class SchedulerConfig {

    public static final String BACKLOG_POLICY_KEY = "pipewright.scheduler.backlog-policy";
    public static final String MAX_PENDING_FIRES_KEY = "pipewright.scheduler.max-pending-fires";
    public static final String SHUTDOWN_POLICY_KEY = "pipewright.scheduler.shutdown-policy";
    public static final String ZONE_KEY = "pipewright.scheduler.zone";

    private BacklogPolicy backlogPolicy = BacklogPolicy.COLLAPSE;
    private int maxPendingFires = 16;
    private ShutdownPolicy shutdownPolicy = ShutdownPolicy.DISCARD;
    private ZoneId zone = ZoneId.systemDefault();
    private Clock clock = Clock.systemUTC();

    /// Creates a configuration with default values.
    public SchedulerConfig() {}

    public BacklogPolicy getBacklogPolicy() {
        return backlogPolicy;
    }

    public void setBacklogPolicy(BacklogPolicy backlogPolicy) {
        this.backlogPolicy = Objects.requireNonNull(backlogPolicy, "backlogPolicy");
    }

    public int getMaxPendingFires() {
        return maxPendingFires;
    }

    /// Sets the pending fire bound for {@link BacklogPolicy#QUEUE_ALL}.
    ///
    /// @param maxPendingFires the bound, must be positive
    /// @throws ScheduleConfigException if the bound is not positive
    public void setMaxPendingFires(int maxPendingFires) {
        if (maxPendingFires < 1) {
            throw new ScheduleConfigException(
                    "maxPendingFires must be positive, got " + maxPendingFires);
        }
        this.maxPendingFires = maxPendingFires;
    }

    public ShutdownPolicy getShutdownPolicy() {
        return shutdownPolicy;
    }

    public void setShutdownPolicy(ShutdownPolicy shutdownPolicy) {
        this.shutdownPolicy = Objects.requireNonNull(shutdownPolicy, "shutdownPolicy");
    }

    /// Returns the zone cron rules are evaluated in.
    ///
    /// @return zone, never null
    public ZoneId getZone() {
        return zone;
    }

    public void setZone(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /// Returns the clock used for fire timestamps and cron evaluation.
    ///
    /// @return clock, never null
    public Clock getClock() {
        return clock;
    }

    public void setClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /// Reads a configuration from `pipewright.scheduler.*` properties.
    ///
    /// Unknown keys are ignored and absent keys keep their default.
    ///
    /// @param properties flat key/value settings, not null
    /// @return the configuration, never null
    /// @throws ScheduleConfigException if a value cannot be parsed
    public static SchedulerConfig fromProperties(Map<String, String> properties) {
        SchedulerConfig config = new SchedulerConfig();
        String backlog = properties.get(BACKLOG_POLICY_KEY);
        if (backlog != null) {
            config.setBacklogPolicy(parseEnum(BacklogPolicy.class, BACKLOG_POLICY_KEY, backlog));
        }
        String maxPending = properties.get(MAX_PENDING_FIRES_KEY);
        if (maxPending != null) {
            try {
                config.setMaxPendingFires(Integer.parseInt(maxPending.trim()));
            } catch (NumberFormatException e) {
                throw new ScheduleConfigException(
                        "Invalid " + MAX_PENDING_FIRES_KEY + ": '" + maxPending + "'", e);
            }
        }
        String shutdown = properties.get(SHUTDOWN_POLICY_KEY);
        if (shutdown != null) {
            config.setShutdownPolicy(
                    parseEnum(ShutdownPolicy.class, SHUTDOWN_POLICY_KEY, shutdown));
        }
        String zone = properties.get(ZONE_KEY);
        if (zone != null) {
            try {
                config.setZone(ZoneId.of(zone.trim()));
            } catch (RuntimeException e) {
                throw new ScheduleConfigException("Invalid " + ZONE_KEY + ": '" + zone + "'", e);
            }
        }
        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ScheduleConfigException("Invalid " + key + ": '" + value + "'", e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link SchedulerConfig} instances.
    public static class Builder {
        private final SchedulerConfig config = new SchedulerConfig();

        public Builder backlogPolicy(BacklogPolicy backlogPolicy) {
            config.setBacklogPolicy(backlogPolicy);
            return this;
        }

        public Builder maxPendingFires(int maxPendingFires) {
            config.setMaxPendingFires(maxPendingFires);
            return this;
        }

        public Builder shutdownPolicy(ShutdownPolicy shutdownPolicy) {
            config.setShutdownPolicy(shutdownPolicy);
            return this;
        }

        public Builder zone(ZoneId zone) {
            config.setZone(zone);
            return this;
        }

        public Builder clock(Clock clock) {
            config.setClock(clock);
            return this;
        }

        public SchedulerConfig build() {
            return config;
        }
    }
}
