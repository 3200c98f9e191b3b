package io.pipewright.core.execution;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.graph.StageNode;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans out all run lifecycle events to an ordered set of delegates.
///
/// All delegates are invoked in declaration order; an exception from one
/// delegate is logged and does not prevent the remaining delegates from
/// receiving the event.
///
/// ### Usage
/// {@snippet :
/// RunListener listener = new CompositeRunListener(
///     new LoggingRunListener(),
///     metricsListener
/// );
/// engine.run(graph, input, store, listener);
/// }
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are
/// captured at construction and never mutated.
public final class CompositeRunListener implements RunListener {

    private static final Logger logger = Logger.getLogger(CompositeRunListener.class.getName());

    private final List<RunListener> delegates;

    /// Creates a composite listener that dispatches to all provided delegates in order.
    ///
    /// @param delegates listeners to notify; must not be null, elements must not be null
    public CompositeRunListener(RunListener... delegates) {
        this.delegates = List.of(delegates);
    }

    @Override
    public void onRunStart(PipelineGraph graph, String runId) {
        each(d -> d.onRunStart(graph, runId));
    }

    @Override
    public void onStageStart(String runId, StageNode node) {
        each(d -> d.onStageStart(runId, node));
    }

    @Override
    public void onStageComplete(String runId, StageNode node, StageOutcome outcome) {
        each(d -> d.onStageComplete(runId, node, outcome));
    }

    @Override
    public void onRunComplete(RunRecord record) {
        each(d -> d.onRunComplete(record));
    }

    private void each(Consumer<RunListener> event) {
        for (RunListener delegate : delegates) {
            try {
                event.accept(delegate);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Run listener " + delegate.getClass().getName() + " failed",
                        e);
            }
        }
    }
}
