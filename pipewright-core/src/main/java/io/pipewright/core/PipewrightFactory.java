package io.pipewright.core;

import io.pipewright.core.execution.PipelineEngine;
import io.pipewright.core.history.InMemoryRunHistory;
import io.pipewright.core.history.RunHistory;
import io.pipewright.core.schedule.SchedulerConfig;
import io.pipewright.core.state.InMemoryStateStore;
import io.pipewright.core.state.StateStore;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring Pipewright environments.
///
/// ### Usage Patterns
///
/// **Builder with explicit components**:
/// {@snippet :
/// var env = PipewrightFactory.builder()
///     .engineConfig(EngineConfig.builder().maxParallelism(8).build())
///     .stateStore(new FileStateStore(Path.of("state")))
///     .build();
/// }
///
/// **Quick start with in-memory state**:
/// {@snippet :
/// var env = PipewrightFactory.createEnvironment();
/// }
///
/// **From flat properties** (`pipewright.engine.*`, `pipewright.scheduler.*`):
/// {@snippet :
/// var env = PipewrightFactory.createEnvironment(properties);
/// }
///
/// @see PipewrightEnvironment
/// @see EngineConfig
public final class PipewrightFactory {

    private static final Logger logger = Logger.getLogger(PipewrightFactory.class.getName());

    private PipewrightFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration and an in-memory store.
    ///
    /// @return a fully-configured environment, never null
    public static PipewrightEnvironment createEnvironment() {
        return createEnvironment(new EngineConfig());
    }

    /// Creates an environment with an in-memory store.
    ///
    /// @param config engine configuration, not null
    /// @return a fully-configured environment, never null
    public static PipewrightEnvironment createEnvironment(EngineConfig config) {
        return builder().engineConfig(config).build();
    }

    /// Creates an environment from flat `pipewright.*` properties.
    ///
    /// @param properties settings, not null (may be empty)
    /// @return a fully-configured environment, never null
    /// @throws IllegalArgumentException if an engine setting is invalid
    /// @throws io.pipewright.core.schedule.ScheduleConfigException if a scheduler
    ///         setting is invalid
    public static PipewrightEnvironment createEnvironment(Map<String, String> properties) {
        return builder()
                .engineConfig(EngineConfig.fromProperties(properties))
                .schedulerConfig(SchedulerConfig.fromProperties(properties))
                .build();
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PipewrightEnvironment}.
    ///
    /// Components left unset get defaults: an {@link InMemoryStateStore}, an
    /// {@link InMemoryRunHistory} and a fixed worker pool sized to
    /// `maxParallelism`.
    public static final class Builder {
        private EngineConfig engineConfig = new EngineConfig();
        private SchedulerConfig schedulerConfig = new SchedulerConfig();
        private StateStore stateStore;
        private RunHistory runHistory;
        private ExecutorService executorService;

        private Builder() {}

        public Builder engineConfig(EngineConfig engineConfig) {
            this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
            return this;
        }

        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = Objects.requireNonNull(schedulerConfig, "schedulerConfig");
            return this;
        }

        /// Sets the default state store.
        ///
        /// @param stateStore store, not null
        /// @return this builder for chaining
        public Builder stateStore(StateStore stateStore) {
            this.stateStore = Objects.requireNonNull(stateStore, "stateStore");
            return this;
        }

        /// Sets the default run history.
        ///
        /// @param runHistory history, not null
        /// @return this builder for chaining
        public Builder runHistory(RunHistory runHistory) {
            this.runHistory = Objects.requireNonNull(runHistory, "runHistory");
            return this;
        }

        /// Sets the worker pool. The caller keeps ownership: closing the
        /// environment leaves it running.
        ///
        /// @param executorService pool, not null
        /// @return this builder for chaining
        public Builder executorService(ExecutorService executorService) {
            this.executorService = Objects.requireNonNull(executorService, "executorService");
            return this;
        }

        /// Wires the environment.
        ///
        /// @return a fully-configured environment, never null
        public PipewrightEnvironment build() {
            StateStore store = stateStore != null ? stateStore : new InMemoryStateStore();
            RunHistory history = runHistory != null ? runHistory : new InMemoryRunHistory();
            ExecutorService pool =
                    executorService != null
                            ? executorService
                            : Executors.newFixedThreadPool(
                                    engineConfig.getMaxParallelism(), workerThreads());
            PipelineEngine engine = new PipelineEngine(pool, engineConfig);
            logger.fine(
                    "Created environment: maxParallelism="
                            + engineConfig.getMaxParallelism()
                            + ", statePersistence="
                            + engineConfig.getStatePersistence()
                            + ", store="
                            + store.getClass().getSimpleName());
            return new PipewrightEnvironment(
                    engine, store, history, schedulerConfig, pool, executorService == null);
        }

        private static ThreadFactory workerThreads() {
            AtomicInteger counter = new AtomicInteger();
            return r -> {
                Thread thread = new Thread(r, "pipewright-worker-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
