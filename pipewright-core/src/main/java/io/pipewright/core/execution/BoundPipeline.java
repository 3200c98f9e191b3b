package io.pipewright.core.execution;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.history.RunHistory;
import io.pipewright.core.state.StateStore;
import io.pipewright.core.state.StoreException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A graph bound to the engine, store and input supplier it runs with.
///
/// The reusable run target of a {@link io.pipewright.core.schedule.ScheduledJob}:
/// every {@link #run()} pulls a fresh input from the supplier and executes one
/// complete run. When a {@link RunHistory} is attached, each finished run is
/// added to it.
///
/// ### Usage
/// {@snippet :
/// BoundPipeline pipeline = BoundPipeline.builder(engine, graph)
///     .store(new InMemoryStateStore())
///     .input(() -> harvestEndpoint)
///     .listener(new LoggingRunListener())
///     .history(new InMemoryRunHistory())
///     .build();
/// RunRecord record = pipeline.run();
/// }
///
/// @implNote Immutable. Thread-safety of concurrent {@link #run()} calls
/// depends on the stages and the input supplier.
public final class BoundPipeline {

    private static final Logger logger = Logger.getLogger(BoundPipeline.class.getName());

    private final PipelineEngine engine;
    private final PipelineGraph graph;
    private final StateStore store;
    private final Supplier<?> input;
    private final RunListener listener;
    private final RunHistory history;

    private BoundPipeline(Builder builder) {
        this.engine = builder.engine;
        this.graph = builder.graph;
        this.store = builder.store;
        this.input = builder.input;
        this.listener = builder.listener;
        this.history = builder.history;
    }

    /// Executes one run with a freshly supplied input.
    ///
    /// A history that cannot record the run is logged at WARNING; the record
    /// is still returned.
    ///
    /// @return the run record, never null
    public RunRecord run() {
        RunRecord record = engine.run(graph, input.get(), store, listener);
        if (history != null) {
            try {
                history.record(record);
            } catch (StoreException e) {
                logger.log(
                        Level.WARNING,
                        "Cannot record run " + record.runId() + " of pipeline '"
                                + record.pipelineId() + "' in history",
                        e);
            }
        }
        return record;
    }

    public PipelineGraph getGraph() {
        return graph;
    }

    public String getPipelineId() {
        return graph.getPipelineId();
    }

    /// Returns the attached store.
    ///
    /// @return the store, or null for stateless runs
    public StateStore getStore() {
        return store;
    }

    /// Returns the attached run history.
    ///
    /// @return history, empty when runs are not recorded
    public Optional<RunHistory> getHistory() {
        return Optional.ofNullable(history);
    }

    /// Creates a builder for a graph run by an engine.
    ///
    /// @param engine engine executing the runs, not null
    /// @param graph validated graph, not null
    /// @return new builder, never null
    public static Builder builder(PipelineEngine engine, PipelineGraph graph) {
        return new Builder(engine, graph);
    }

    /// Builder for {@link BoundPipeline}.
    public static final class Builder {
        private final PipelineEngine engine;
        private final PipelineGraph graph;
        private StateStore store;
        private Supplier<?> input = () -> null;
        private RunListener listener = RunListener.NOOP;
        private RunHistory history;

        private Builder(PipelineEngine engine, PipelineGraph graph) {
            this.engine = Objects.requireNonNull(engine, "engine must not be null");
            this.graph = Objects.requireNonNull(graph, "graph must not be null");
        }

        /// Attaches a state store.
        ///
        /// @param store state store, may be null for stateless runs
        /// @return this builder for chaining
        public Builder store(StateStore store) {
            this.store = store;
            return this;
        }

        /// Sets the supplier of the external source input, called once per run.
        ///
        /// @param input supplier, not null (defaults to a null input)
        /// @return this builder for chaining
        public Builder input(Supplier<?> input) {
            this.input = Objects.requireNonNull(input, "input must not be null");
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /// Attaches a run history receiving every finished run.
        ///
        /// @param history run history, may be null to stop recording
        /// @return this builder for chaining
        public Builder history(RunHistory history) {
            this.history = history;
            return this;
        }

        public BoundPipeline build() {
            return new BoundPipeline(this);
        }
    }
}
