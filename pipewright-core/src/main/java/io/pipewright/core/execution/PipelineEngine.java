package io.pipewright.core.execution;

import io.pipewright.core.EngineConfig;
import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.graph.Edge;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.graph.StageNode;
import io.pipewright.core.stage.FailureKind;
import io.pipewright.core.stage.StageContext;
import io.pipewright.core.stage.StageFailure;
import io.pipewright.core.stage.StageInput;
import io.pipewright.core.stage.TypeDescriptor;
import io.pipewright.core.state.StateStore;
import io.pipewright.core.state.StoreException;
import io.pipewright.core.state.StoredState;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Execution engine for validated pipeline graphs.
///
/// Walks the graph in its cached topological order and dispatches every stage
/// whose predecessors all succeeded onto the worker pool, so that stages
/// without an ancestor/descendant relation may run concurrently. The calling
/// thread coordinates the run: it releases dependents as completions arrive
/// and applies the failure policy.
///
/// ### Failure Policy
/// - **Transient** failure: every descendant of the failed stage is skipped,
///   independent branches continue, the run ends
///   {@link RunStatus#PARTIAL_FAILURE}
/// - **Permanent** failure: no further stage starts, stages already running
///   finish, the run ends {@link RunStatus#FAILURE}
/// - **Stop request** ({@link StageContext#requestStop(String)}): the stage
///   succeeds, no further stage starts, the run ends {@link RunStatus#STOPPED}
///
/// Unchecked exceptions escaping a stage and {@link StoreException}s raised
/// while reading or writing its state count as permanent failures.
///
/// ### Contracts
/// - **Precondition**: the graph was produced by {@link PipelineGraph.Builder#build()}
/// - **Postcondition**: the returned record holds exactly one outcome per stage
/// - **Invariant**: a stage starts only after each predecessor succeeded and,
///   with {@link StatePersistence#IMMEDIATE}, after its state was written
///
/// @implNote Thread-safe. The engine keeps no state between runs; several runs
/// may share one engine and one worker pool. Stages are never interrupted.
///
/// @see PipelineGraph for composition and validation
/// @see StatePersistence for when outputs reach the store
public class PipelineEngine {

    private static final Logger logger = Logger.getLogger(PipelineEngine.class.getName());

    private final ExecutorService executorService;
    private final EngineConfig config;
    private final Clock clock;

    /// Creates an engine with default configuration.
    ///
    /// @param executorService worker pool running the stages, not null
    public PipelineEngine(ExecutorService executorService) {
        this(executorService, new EngineConfig());
    }

    /// Creates an engine.
    ///
    /// @param executorService worker pool running the stages, not null
    /// @param config engine configuration, not null
    public PipelineEngine(ExecutorService executorService, EngineConfig config) {
        this(executorService, config, Clock.systemUTC());
    }

    /// Creates an engine with an explicit clock for run and state timestamps.
    ///
    /// @param executorService worker pool running the stages, not null
    /// @param config engine configuration, not null
    /// @param clock time source, not null
    public PipelineEngine(ExecutorService executorService, EngineConfig config, Clock clock) {
        this.executorService = Objects.requireNonNull(executorService, "executorService");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /// Runs a graph statelessly.
    ///
    /// @param graph validated graph, not null
    /// @param input external input handed to every source stage, may be null
    /// @return the run record, never null
    public RunRecord run(PipelineGraph graph, Object input) {
        return run(graph, input, null);
    }

    /// Runs a graph, persisting successful outputs to a store.
    ///
    /// @param graph validated graph, not null
    /// @param input external input handed to every source stage, may be null
    /// @param store state store, may be null for a stateless run
    /// @return the run record, never null
    public RunRecord run(PipelineGraph graph, Object input, StateStore store) {
        return run(graph, input, store, RunListener.NOOP);
    }

    /// Runs a graph with a lifecycle listener.
    ///
    /// @param graph validated graph, not null
    /// @param input external input handed to every source stage, may be null
    /// @param store state store, may be null for a stateless run
    /// @param listener lifecycle listener, not null
    /// @return the run record, never null
    public RunRecord run(
            PipelineGraph graph, Object input, StateStore store, RunListener listener) {
        Map<String, Object> sourceInputs = new HashMap<>();
        for (StageNode source : graph.sources()) {
            sourceInputs.put(source.getId(), input);
        }
        return runPerSource(graph, sourceInputs, store, listener);
    }

    /// Runs a graph with a distinct external input per source stage.
    ///
    /// A source stage missing from `sourceInputs` receives null. A source with
    /// no input port ignores its entry. An input its port type does not accept
    /// fails that source permanently.
    ///
    /// @apiNote **Side effects**:
    /// - Invokes every reachable stage at most once
    /// - Writes successful outputs to `store` according to {@link StatePersistence}
    /// - Logs run progress at INFO and failures at WARNING
    ///
    /// @param graph validated graph, not null
    /// @param sourceInputs source stage ID to external input, not null
    /// @param store state store, may be null for a stateless run
    /// @param listener lifecycle listener, not null
    /// @return the run record, never null
    public RunRecord runPerSource(
            PipelineGraph graph,
            Map<String, Object> sourceInputs,
            StateStore store,
            RunListener listener) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(sourceInputs, "sourceInputs must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Run run = new Run(graph, sourceInputs, store, listener);
        return run.execute();
    }

    /// Returns the engine configuration.
    ///
    /// @return configuration, never null
    public EngineConfig getConfig() {
        return config;
    }

    /// Result of one stage task, posted from a worker to the run thread.
    private record Completion(
            StageNode node, StageOutcome outcome, StagedWrite staged, String stopReason) {}

    /// Output buffered under {@link StatePersistence#ON_RUN_SUCCESS}.
    private record StagedWrite(String stageId, Object output, Instant timestamp) {}

    /// Mutable state of one run. Only {@link #halted} and {@link #completions}
    /// are touched by worker threads.
    private final class Run {
        private final PipelineGraph graph;
        private final Map<String, Object> sourceInputs;
        private final StateStore store;
        private final RunListener listener;
        private final String runId = UUID.randomUUID().toString();
        private final String pipelineId;

        private final Map<String, Integer> topoIndex = new HashMap<>();
        private final Map<String, StageOutcome> outcomes = new HashMap<>();
        private final Map<String, Object> outputs = new HashMap<>();
        private final Map<String, Integer> pendingPredecessors = new HashMap<>();
        private final PriorityQueue<String> ready;
        private final List<StagedWrite> stagedWrites = new ArrayList<>();

        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final AtomicBoolean halted = new AtomicBoolean();

        private int inFlight;
        private String permanentFailureAt;
        private boolean transientFailure;
        private String stoppedBy;
        private String stopReason;
        private boolean interrupted;

        Run(
                PipelineGraph graph,
                Map<String, Object> sourceInputs,
                StateStore store,
                RunListener listener) {
            this.graph = graph;
            this.sourceInputs = sourceInputs;
            this.store = store;
            this.listener = listener;
            this.pipelineId = graph.getPipelineId();

            List<String> order = graph.topologicalOrder();
            for (int i = 0; i < order.size(); i++) {
                topoIndex.put(order.get(i), i);
            }
            this.ready = new PriorityQueue<>((a, b) -> topoIndex.get(a) - topoIndex.get(b));
            for (String id : order) {
                int count = graph.predecessors(id).size();
                pendingPredecessors.put(id, count);
                if (count == 0) {
                    ready.add(id);
                }
            }
        }

        RunRecord execute() {
            Instant startedAt = clock.instant();
            notifySafely(() -> listener.onRunStart(graph, runId));

            while (true) {
                dispatchReady();
                if (inFlight == 0) {
                    break;
                }
                Completion completion = awaitCompletion();
                inFlight--;
                complete(completion);
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }

            Map<String, StageOutcome> ordered = new LinkedHashMap<>();
            for (String id : graph.topologicalOrder()) {
                StageOutcome outcome = outcomes.get(id);
                ordered.put(
                        id, outcome != null ? outcome : new StageOutcome.Skipped(skipReason(id)));
            }

            RunStatus status = status();
            if (config.getStatePersistence() == StatePersistence.ON_RUN_SUCCESS && store != null) {
                status = settleStagedWrites(status, ordered);
            }

            // The wall clock may step backwards during a run.
            Instant finishedAt = clock.instant();
            if (finishedAt.isBefore(startedAt)) {
                finishedAt = startedAt;
            }
            RunRecord record =
                    new RunRecord(runId, pipelineId, startedAt, finishedAt, ordered, status);
            notifySafely(() -> listener.onRunComplete(record));
            return record;
        }

        private void dispatchReady() {
            while (!halted.get() && inFlight < config.getMaxParallelism() && !ready.isEmpty()) {
                StageNode node = graph.getNode(ready.poll());
                StageInput input;
                if (node.isSource()) {
                    Optional<StageInput> sourceInput = sourceInput(node);
                    if (sourceInput.isEmpty()) {
                        continue;
                    }
                    input = sourceInput.get();
                } else {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (Edge edge : graph.predecessors(node.getId())) {
                        values.put(edge.port(), outputs.get(edge.from()));
                    }
                    input = StageInput.of(values);
                }

                try {
                    executorService.execute(() -> runStage(node, input));
                    inFlight++;
                } catch (RejectedExecutionException e) {
                    complete(
                            new Completion(
                                    node,
                                    new StageOutcome.Failed(
                                            FailureKind.PERMANENT,
                                            "Worker pool rejected stage '" + node.getId() + "'",
                                            e),
                                    null,
                                    null));
                }
            }
        }

        /// Resolves the external input of a source stage, failing the stage
        /// in place when its port type does not accept the value.
        private Optional<StageInput> sourceInput(StageNode node) {
            String port = node.getSignature().soleInputPort();
            if (port == null) {
                return Optional.of(StageInput.empty());
            }
            Object value = sourceInputs.get(node.getId());
            TypeDescriptor expected = node.getSignature().getInput(port);
            if (!expected.acceptsValue(value)) {
                complete(
                        new Completion(
                                node,
                                new StageOutcome.Failed(
                                        FailureKind.PERMANENT,
                                        "External input of type "
                                                + value.getClass().getName()
                                                + " is not accepted by port '"
                                                + port
                                                + "' ("
                                                + expected.name()
                                                + ")",
                                        null),
                                null,
                                null));
                return Optional.empty();
            }
            Map<String, Object> values = new HashMap<>();
            values.put(port, value);
            return Optional.of(StageInput.of(values));
        }

        private Completion awaitCompletion() {
            while (true) {
                try {
                    return completions.take();
                } catch (InterruptedException e) {
                    // In-flight stages are never abandoned; stop dispatching and keep waiting.
                    interrupted = true;
                    halted.set(true);
                    logger.warning(
                            "Run " + runId + " of pipeline '" + pipelineId + "' interrupted");
                }
            }
        }

        /// Executes one stage on a worker thread. Always posts exactly one completion.
        private void runStage(StageNode node, StageInput input) {
            if (halted.get()) {
                completions.add(new Completion(node, null, null, null));
                return;
            }
            try {
                notifySafely(() -> listener.onStageStart(runId, node));
                completions.add(invoke(node, input));
            } catch (Error e) {
                completions.add(
                        failed(
                                node,
                                FailureKind.PERMANENT,
                                "Stage '" + node.getId() + "' raised " + e,
                                e));
                throw e;
            }
        }

        private Completion invoke(StageNode node, StageInput input) {
            Supplier<Optional<StoredState>> lookup =
                    store == null ? Optional::empty : () -> store.get(pipelineId, node.getId());
            StageContext context =
                    StageContext.builder()
                            .pipelineId(pipelineId)
                            .runId(runId)
                            .stageId(node.getId())
                            .stateLookup(lookup)
                            .build();

            Object output;
            try {
                output = node.getStage().run(input, context);
            } catch (StageFailure e) {
                return failed(node, e.getKind(), e.getMessage(), e);
            } catch (StoreException e) {
                return failed(
                        node, FailureKind.PERMANENT, "State read failed: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                return failed(
                        node,
                        FailureKind.PERMANENT,
                        "Stage '" + node.getId() + "' threw " + e,
                        e);
            }

            if (!node.getOutputType().acceptsValue(output)) {
                return failed(
                        node,
                        FailureKind.PERMANENT,
                        "Stage '"
                                + node.getId()
                                + "' returned "
                                + output.getClass().getName()
                                + " but declares "
                                + node.getOutputType().name(),
                        null);
            }

            StagedWrite staged = null;
            if (store != null) {
                Instant timestamp = clock.instant();
                if (config.getStatePersistence() == StatePersistence.IMMEDIATE) {
                    try {
                        store.put(pipelineId, node.getId(), output, timestamp);
                    } catch (StoreException e) {
                        return failed(
                                node,
                                FailureKind.PERMANENT,
                                "State write failed: " + e.getMessage(),
                                e);
                    }
                } else {
                    staged = new StagedWrite(node.getId(), output, timestamp);
                }
            }

            String stop = context.isStopRequested() ? context.getStopReason() : null;
            return new Completion(node, new StageOutcome.Succeeded(output), staged, stop);
        }

        private Completion failed(
                StageNode node, FailureKind kind, String message, Throwable cause) {
            return new Completion(
                    node,
                    new StageOutcome.Failed(kind, message != null ? message : kind.name(), cause),
                    null,
                    null);
        }

        /// Applies a completion on the run thread.
        private void complete(Completion completion) {
            StageNode node = completion.node();
            if (completion.outcome() == null) {
                // Halted before it started; recorded as skipped at the end.
                return;
            }
            String id = node.getId();
            StageOutcome outcome = completion.outcome();
            outcomes.put(id, outcome);
            notifySafely(() -> listener.onStageComplete(runId, node, outcome));

            if (outcome instanceof StageOutcome.Succeeded succeeded) {
                outputs.put(id, succeeded.output());
                if (completion.staged() != null) {
                    stagedWrites.add(completion.staged());
                }
                if (completion.stopReason() != null) {
                    if (stoppedBy == null) {
                        stoppedBy = id;
                        stopReason = completion.stopReason();
                        logger.info(
                                "Stage '" + id + "' stopped pipeline '" + pipelineId + "': "
                                        + stopReason);
                    }
                    halted.set(true);
                    return;
                }
                for (Edge edge : graph.successors(id)) {
                    if (pendingPredecessors.merge(edge.to(), -1, Integer::sum) == 0) {
                        ready.add(edge.to());
                    }
                }
            } else if (outcome instanceof StageOutcome.Failed failed) {
                if (failed.kind() == FailureKind.PERMANENT) {
                    logger.warning(
                            "Permanent failure in stage '" + id + "', aborting run " + runId
                                    + ": " + failed.message());
                    if (permanentFailureAt == null) {
                        permanentFailureAt = id;
                    }
                    halted.set(true);
                } else {
                    logger.warning(
                            "Transient failure in stage '" + id + "', skipping "
                                    + graph.descendants(id) + ": " + failed.message());
                    transientFailure = true;
                }
            }
        }

        private String skipReason(String stageId) {
            if (permanentFailureAt != null) {
                return "Run aborted after permanent failure of '" + permanentFailureAt + "'";
            }
            if (interrupted) {
                return "Run interrupted";
            }
            String failedAncestor = failedAncestor(stageId);
            if (failedAncestor != null) {
                return "Upstream stage '" + failedAncestor + "' failed";
            }
            if (stoppedBy != null) {
                return "Pipeline stopped by '" + stoppedBy + "': " + stopReason;
            }
            return "Not reached";
        }

        private String failedAncestor(String stageId) {
            for (Edge edge : graph.predecessors(stageId)) {
                StageOutcome upstream = outcomes.get(edge.from());
                if (upstream instanceof StageOutcome.Failed) {
                    return edge.from();
                }
                if (upstream == null) {
                    String ancestor = failedAncestor(edge.from());
                    if (ancestor != null) {
                        return ancestor;
                    }
                }
            }
            return null;
        }

        private RunStatus status() {
            if (permanentFailureAt != null || interrupted) {
                return RunStatus.FAILURE;
            }
            if (transientFailure) {
                return RunStatus.PARTIAL_FAILURE;
            }
            if (stoppedBy != null) {
                return RunStatus.STOPPED;
            }
            return RunStatus.SUCCESS;
        }

        /// Commits buffered writes in topological order for successful runs and
        /// drops them otherwise, stopped runs included. A failed commit fails
        /// its stage permanently.
        private RunStatus settleStagedWrites(RunStatus status, Map<String, StageOutcome> ordered) {
            if (status != RunStatus.SUCCESS) {
                if (!stagedWrites.isEmpty()) {
                    logger.fine(
                            "Discarding " + stagedWrites.size() + " staged writes of run " + runId);
                }
                return status;
            }
            stagedWrites.sort((a, b) -> topoIndex.get(a.stageId()) - topoIndex.get(b.stageId()));
            for (StagedWrite write : stagedWrites) {
                try {
                    store.put(pipelineId, write.stageId(), write.output(), write.timestamp());
                } catch (StoreException e) {
                    logger.log(
                            Level.WARNING,
                            "Commit of state for stage '" + write.stageId() + "' failed",
                            e);
                    ordered.put(
                            write.stageId(),
                            new StageOutcome.Failed(
                                    FailureKind.PERMANENT,
                                    "State commit failed: " + e.getMessage(),
                                    e));
                    return RunStatus.FAILURE;
                }
            }
            return status;
        }

        private void notifySafely(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Run listener failed in run " + runId, e);
            }
        }
    }
}
