package io.pipewright.core.execution.result;

/// Overall outcome of a pipeline run.
///
/// @see RunRecord#status()
public enum RunStatus {

    /// Every stage succeeded.
    SUCCESS,

    /// At least one stage failed transiently; independent branches still ran.
    PARTIAL_FAILURE,

    /// A stage failed permanently and the run was aborted.
    FAILURE,

    /// A stage requested a stop; stages not yet started were skipped.
    STOPPED;

    /// Returns whether a run with this status completed without any failure.
    ///
    /// @return true for {@link #SUCCESS} and {@link #STOPPED}
    public boolean isClean() {
        return this == SUCCESS || this == STOPPED;
    }
}
