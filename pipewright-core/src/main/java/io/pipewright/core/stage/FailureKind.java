package io.pipewright.core.stage;

/// Severity of a {@link StageFailure}, used by the engine's failure policy.
///
/// @see io.pipewright.core.execution.PipelineEngine
public enum FailureKind {

    /// Only the failed stage's dependent subtree is abandoned; independent
    /// branches keep running.
    TRANSIENT,

    /// The whole run is aborted; no further stage is started.
    PERMANENT
}
