package io.pipewright.core.execution.result;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable record of one pipeline run.
///
/// Holds exactly one {@link StageOutcome} per stage of the graph, in the
/// graph's topological order, including stages that never started.
///
/// ### Contracts
/// - **Invariant**: `finishedAt` is not before `startedAt`
/// - **Invariant**: the outcome map is never modified after construction
///
/// @param runId unique run identifier, not null
/// @param pipelineId pipeline identifier, not null
/// @param startedAt when the run started, not null
/// @param finishedAt when the last stage finished, not null
/// @param outcomes stage ID to outcome in topological order, not null
/// @param status overall run status, not null
public record RunRecord(
        String runId,
        String pipelineId,
        Instant startedAt,
        Instant finishedAt,
        Map<String, StageOutcome> outcomes,
        RunStatus status) {

    public RunRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (finishedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("finishedAt must not be before startedAt");
        }
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    /// Returns the outcome of a stage.
    ///
    /// @param stageId stage identifier, not null
    /// @return the outcome, never null
    /// @throws IllegalArgumentException if the stage is not part of this run
    public StageOutcome outcome(String stageId) {
        StageOutcome outcome = outcomes.get(stageId);
        if (outcome == null) {
            throw new IllegalArgumentException(
                    "No outcome for stage '" + stageId + "' in run " + runId);
        }
        return outcome;
    }

    /// Returns the output of a stage that succeeded.
    ///
    /// @param stageId stage identifier, not null
    /// @return output, empty if the stage did not succeed or produced null
    public Optional<Object> output(String stageId) {
        if (outcomes.get(stageId) instanceof StageOutcome.Succeeded succeeded) {
            return Optional.ofNullable(succeeded.output());
        }
        return Optional.empty();
    }

    /// Returns the wall-clock duration of the run.
    ///
    /// @return duration, never negative
    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /// Counts outcomes of a given kind.
    ///
    /// @param type outcome subtype, not null
    /// @return number of matching outcomes
    public long count(Class<? extends StageOutcome> type) {
        return outcomes.values().stream().filter(type::isInstance).count();
    }
}
