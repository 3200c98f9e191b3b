package io.pipewright.core.stage;

import io.pipewright.core.state.StoredState;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/// Per-invocation context handed to {@link Stage#run}.
///
/// Exposes the identity of the current run and the stage's own last persisted
/// output, which incremental stages use to emit only new or changed items.
/// Stages may also request that the pipeline stop after them.
///
/// ### Contracts
/// - **Precondition**: `pipelineId`, `runId` and `stageId` are set
/// - **Invariant**: one context per stage invocation, never shared
///
/// @implNote The prior state is fetched lazily on first access and memoized.
/// A store failure surfaces as {@link io.pipewright.core.state.StoreException}
/// from {@link #previousState()} and is recorded as a permanent failure.
public final class StageContext {

    private final String pipelineId;
    private final String runId;
    private final String stageId;
    private final Supplier<Optional<StoredState>> stateLookup;

    private Optional<StoredState> previousState;
    private volatile String stopReason;

    private StageContext(Builder builder) {
        this.pipelineId = Objects.requireNonNull(builder.pipelineId, "pipelineId required");
        this.runId = Objects.requireNonNull(builder.runId, "runId required");
        this.stageId = Objects.requireNonNull(builder.stageId, "stageId required");
        this.stateLookup = builder.stateLookup;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public String getRunId() {
        return runId;
    }

    public String getStageId() {
        return stageId;
    }

    /// Returns the last successful output persisted for this stage.
    ///
    /// @return prior state, empty when no store is attached or nothing was written yet
    /// @throws io.pipewright.core.state.StoreException if the store cannot be read
    public synchronized Optional<StoredState> previousState() {
        if (previousState == null) {
            previousState = stateLookup.get();
        }
        return previousState;
    }

    /// Returns the previous output cast to the expected type.
    ///
    /// @param type expected output type, not null
    /// @param <T> expected output type
    /// @return prior output, empty when absent
    /// @throws ClassCastException if the stored output has a different type
    public <T> Optional<T> previousOutput(Class<T> type) {
        return previousState().map(s -> type.cast(s.output()));
    }

    /// Asks the engine not to start any further stage once this one completes.
    ///
    /// The requesting stage still succeeds and its output is recorded. The run
    /// ends as {@link io.pipewright.core.execution.result.RunStatus#STOPPED}.
    ///
    /// @param reason why the pipeline stops, not null
    public void requestStop(String reason) {
        this.stopReason = Objects.requireNonNull(reason, "reason must not be null");
    }

    /// Returns whether {@link #requestStop(String)} was called.
    ///
    /// @return true if a stop was requested
    public boolean isStopRequested() {
        return stopReason != null;
    }

    /// Returns the stop reason.
    ///
    /// @return reason, or null if no stop was requested
    public String getStopReason() {
        return stopReason;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link StageContext}.
    public static final class Builder {
        private String pipelineId;
        private String runId;
        private String stageId;
        private Supplier<Optional<StoredState>> stateLookup = Optional::empty;

        private Builder() {}

        public Builder pipelineId(String pipelineId) {
            this.pipelineId = pipelineId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder stageId(String stageId) {
            this.stageId = stageId;
            return this;
        }

        /// Sets the lookup used to fetch the stage's prior state.
        ///
        /// @param stateLookup lookup, not null (defaults to always-empty)
        /// @return this builder for chaining
        public Builder stateLookup(Supplier<Optional<StoredState>> stateLookup) {
            this.stateLookup = Objects.requireNonNull(stateLookup, "stateLookup");
            return this;
        }

        public StageContext build() {
            return new StageContext(this);
        }
    }
}
