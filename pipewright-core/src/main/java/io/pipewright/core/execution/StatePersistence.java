package io.pipewright.core.execution;

/// When the engine writes successful stage outputs to the attached state store.
///
/// @see io.pipewright.core.EngineConfig#getStatePersistence()
public enum StatePersistence {

    /// Write each output as soon as its stage succeeds, before dependents start.
    ///
    /// Stages that succeeded before a failure keep their state.
    IMMEDIATE,

    /// Buffer outputs for the duration of the run.
    ///
    /// Buffered outputs are committed in topological order only when the run
    /// ends {@link io.pipewright.core.execution.result.RunStatus#SUCCESS}. A
    /// stopped or failed run discards them, so the next run starts from the
    /// last committed state.
    ON_RUN_SUCCESS
}
