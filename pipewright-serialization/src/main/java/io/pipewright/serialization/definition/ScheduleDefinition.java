package io.pipewright.serialization.definition;

import io.pipewright.core.schedule.IsoDurations;
import io.pipewright.core.schedule.ScheduleConfigException;
import io.pipewright.core.schedule.ScheduleRule;
import java.time.Duration;

/// Schedule entry of a pipeline definition: exactly one of the two fields.
///
/// @param interval ISO-8601 duration such as `PT15M`, may be null
/// @param cron five-field cron expression or shorthand, may be null
public record ScheduleDefinition(String interval, String cron) {

    /// Converts the entry into a rule.
    ///
    /// @return the rule, never null
    /// @throws ScheduleConfigException if both or neither field is set, or the
    ///         set one is malformed
    public ScheduleRule toRule() {
        Duration period =
                interval == null || interval.isBlank() ? null : IsoDurations.parse(interval);
        return ScheduleRule.of(period, cron);
    }
}
