package io.pipewright.core.schedule;

import java.io.Serial;

/// Thrown when a schedule rule or scheduled job is malformed or contradictory.
///
/// Raised at construction time, before any timer starts.
public class ScheduleConfigException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3820197455016734321L;

    public ScheduleConfigException(String message) {
        super(message);
    }

    public ScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
