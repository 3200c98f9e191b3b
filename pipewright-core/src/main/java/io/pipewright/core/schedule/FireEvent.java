package io.pipewright.core.schedule;

import java.time.Instant;
import java.util.Objects;

/// One trigger of a scheduled job.
///
/// @param sequence monotonically increasing per job, starting at 1
/// @param firedAt when the timer fired, not null
public record FireEvent(long sequence, Instant firedAt) {
    public FireEvent {
        Objects.requireNonNull(firedAt, "firedAt must not be null");
    }
}
