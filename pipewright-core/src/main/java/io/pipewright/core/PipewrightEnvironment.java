package io.pipewright.core;

import io.pipewright.core.execution.BoundPipeline;
import io.pipewright.core.execution.PipelineEngine;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.history.RunHistory;
import io.pipewright.core.schedule.ScheduleListener;
import io.pipewright.core.schedule.ScheduleRule;
import io.pipewright.core.schedule.ScheduledJob;
import io.pipewright.core.schedule.SchedulerConfig;
import io.pipewright.core.state.StateStore;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/// Container holding the components needed to run and schedule pipelines.
///
/// Implements {@link AutoCloseable}: closing shuts down every job scheduled
/// through {@link #schedule} (letting active runs finish) and then the
/// worker pool, when the environment created that pool itself.
///
/// ### Contracts
/// - **Precondition**: all constructor parameters are non-null
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link PipewrightFactory} rather than direct
/// construction.
///
/// @see PipewrightFactory#createEnvironment()
public final class PipewrightEnvironment implements AutoCloseable {

    private final PipelineEngine engine;
    private final StateStore stateStore;
    private final RunHistory runHistory;
    private final SchedulerConfig schedulerConfig;
    private final ExecutorService executorService;
    private final boolean ownsExecutorService;
    private final List<ScheduledJob> jobs = new ArrayList<>();

    /// Creates an environment.
    ///
    /// @param engine engine running pipelines, not null
    /// @param stateStore default store bound to pipelines, not null
    /// @param runHistory default history bound to pipelines, not null
    /// @param schedulerConfig configuration for scheduled jobs, not null
    /// @param executorService worker pool used by the engine, not null
    /// @param ownsExecutorService whether {@link #close()} shuts the pool down
    public PipewrightEnvironment(
            PipelineEngine engine,
            StateStore stateStore,
            RunHistory runHistory,
            SchedulerConfig schedulerConfig,
            ExecutorService executorService,
            boolean ownsExecutorService) {
        this.engine = engine;
        this.stateStore = stateStore;
        this.runHistory = runHistory;
        this.schedulerConfig = schedulerConfig;
        this.executorService = executorService;
        this.ownsExecutorService = ownsExecutorService;
    }

    public PipelineEngine getEngine() {
        return engine;
    }

    /// Returns the default state store.
    ///
    /// @return the store, never null
    public StateStore getStateStore() {
        return stateStore;
    }

    /// Returns the default run history.
    ///
    /// @return the history, never null
    public RunHistory getRunHistory() {
        return runHistory;
    }

    public SchedulerConfig getSchedulerConfig() {
        return schedulerConfig;
    }

    /// Starts binding a graph to this environment's engine, default store and
    /// default run history.
    ///
    /// @param graph validated graph, not null
    /// @return builder preset with engine, store and history, never null
    public BoundPipeline.Builder bind(PipelineGraph graph) {
        return BoundPipeline.builder(engine, graph).store(stateStore).history(runHistory);
    }

    /// Creates and starts a job that this environment shuts down on close.
    ///
    /// @param rule schedule rule, not null
    /// @param target pipeline to run, not null
    /// @param listener run outcome callback, not null
    /// @return the started job, never null
    public ScheduledJob schedule(
            ScheduleRule rule, BoundPipeline target, ScheduleListener listener) {
        ScheduledJob job =
                ScheduledJob.builder()
                        .rule(rule)
                        .target(target)
                        .config(schedulerConfig)
                        .listener(listener)
                        .build();
        synchronized (jobs) {
            jobs.add(job);
        }
        job.start();
        return job;
    }

    /// Shuts down scheduled jobs, then the worker pool if this environment
    /// created it. A pool supplied by the caller stays open.
    ///
    /// @apiNote **Side effects**:
    /// - Blocks until the active run of each scheduled job has finished
    /// - An owned pool accepts no new stage tasks afterwards
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not wait for
    /// stages of runs started outside a scheduled job.
    @Override
    public void close() {
        List<ScheduledJob> toStop;
        synchronized (jobs) {
            toStop = new ArrayList<>(jobs);
            jobs.clear();
        }
        toStop.forEach(ScheduledJob::shutdown);
        if (ownsExecutorService) {
            executorService.shutdown();
        }
    }
}
