package io.pipewright.core.schedule;

import io.pipewright.core.execution.result.RunRecord;

/// Callback for the outcomes of a scheduled job.
///
/// Run callbacks are invoked on the job's worker thread, one at a time.
/// Dropped fires may be reported from the timer thread or from the thread
/// calling {@link ScheduledJob#shutdown()}.
public interface ScheduleListener {

    /// Called once per executed fire with the finished run.
    ///
    /// @param event the fire that triggered the run, not null
    /// @param record the run record, not null
    default void onRunComplete(FireEvent event, RunRecord record) {}

    /// Called for each fire that will never run: collapsed, evicted from a
    /// full backlog, or discarded at shutdown.
    ///
    /// @param event the dropped fire, not null
    default void onFireDropped(FireEvent event) {}

    /// Called when a run ended with an unexpected error instead of a record,
    /// such as a failing input supplier.
    ///
    /// The job keeps serving later fires.
    ///
    /// @param event the fire that triggered the run, not null
    /// @param error the exception or error, not null
    default void onRunError(FireEvent event, Throwable error) {}

    /// No-op listener instance that ignores all events.
    ScheduleListener NOOP = new ScheduleListener() {};
}
