package io.pipewright.core.schedule;

/// What happens to pending fires when a job shuts down.
///
/// The active run always completes under either policy.
public enum ShutdownPolicy {

    /// Execute the pending fires, in order, before terminating.
    DRAIN,

    /// Drop the pending fires and terminate after the active run.
    DISCARD
}
