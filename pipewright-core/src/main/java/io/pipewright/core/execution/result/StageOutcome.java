package io.pipewright.core.execution.result;

import io.pipewright.core.stage.FailureKind;
import java.util.Objects;

/// Outcome of a single stage within a run.
///
/// ### Permitted Subtypes
/// - {@link Succeeded} - stage returned an output
/// - {@link Failed} - stage raised a failure, or its output could not be persisted
/// - {@link Skipped} - stage was never started
///
/// @see RunRecord#outcomes()
public sealed interface StageOutcome {

    /// Stage completed and produced an output.
    ///
    /// @param output the stage output, may be null for stages without output
    record Succeeded(Object output) implements StageOutcome {}

    /// Stage failed.
    ///
    /// @param kind failure kind driving the abort policy, not null
    /// @param message human-readable detail, not null
    /// @param cause underlying exception, may be null
    record Failed(FailureKind kind, String message, Throwable cause) implements StageOutcome {
        public Failed {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /// Stage was not attempted.
    ///
    /// @param reason why the stage did not start, not null
    record Skipped(String reason) implements StageOutcome {
        public Skipped {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /// Returns whether this outcome is a success.
    ///
    /// @return true for {@link Succeeded}
    default boolean isSuccess() {
        return this instanceof Succeeded;
    }
}
