package io.pipewright.core.schedule;

/// What happens to fires that arrive while a run of the same job is active.
public enum BacklogPolicy {

    /// Keep only the most recent pending fire; older pending fires are dropped.
    COLLAPSE,

    /// Keep every pending fire up to {@link SchedulerConfig#getMaxPendingFires()};
    /// on overflow the oldest pending fire is dropped.
    QUEUE_ALL
}
