package io.pipewright.core.execution;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.graph.StageNode;

/// Listener for pipeline run lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onRunStart(graph, runId)            once, before any stage starts
/// onStageStart(runId, node)           per started stage, on a worker thread
/// onStageComplete(runId, node, out)   per attempted stage, on the run thread
/// onRunComplete(record)               once, after state is committed
/// ```
/// Stages skipped without starting only appear in the final record.
///
/// @implNote Stage callbacks may arrive from several threads at once when
/// independent stages run concurrently. A listener that throws is logged
/// and otherwise ignored by the engine.
///
/// @see PipelineEngine#run(PipelineGraph, Object, io.pipewright.core.state.StateStore,
/// RunListener)
public interface RunListener {

    /// Called before the first stage of a run is dispatched.
    ///
    /// @param graph the graph being run, not null
    /// @param runId identifier of the new run, not null
    default void onRunStart(PipelineGraph graph, String runId) {}

    /// Called on the worker thread right before a stage executes.
    ///
    /// @param runId run identifier, not null
    /// @param node the stage about to run, not null
    default void onStageStart(String runId, StageNode node) {}

    /// Called when an attempted stage has finished.
    ///
    /// @param runId run identifier, not null
    /// @param node the stage that finished, not null
    /// @param outcome its outcome, not null
    default void onStageComplete(String runId, StageNode node, StageOutcome outcome) {}

    /// Called with the final record of a run.
    ///
    /// @param record the finished run, not null
    default void onRunComplete(RunRecord record) {}

    /// No-op listener instance that ignores all events.
    RunListener NOOP = new RunListener() {};
}
