package io.pipewright.core.history;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import java.util.List;
import java.util.Optional;

/// Repository of finished pipeline runs.
///
/// Keeps the {@link RunRecord}s of past runs so that callers can look back at
/// what ran when, and pick the last successful run as the starting point of
/// incremental work.
///
/// ### Usage
/// {@snippet :
/// RunHistory history = new InMemoryRunHistory();
/// BoundPipeline pipeline = BoundPipeline.builder(engine, graph)
///     .history(history)
///     .build();
/// pipeline.run();
///
/// Optional<RunRecord> last = history.lastSuccessful(graph.getPipelineId());
/// }
///
/// @implNote Implementations must be thread-safe. Failures surface as
/// {@link io.pipewright.core.state.StoreException}.
///
/// @see InMemoryRunHistory for the in-memory implementation
public interface RunHistory {

    /// Adds a finished run. A record with the same run ID is replaced.
    ///
    /// @param record finished run, not null
    /// @throws NullPointerException if record is null
    void record(RunRecord record);

    /// Returns the most recent runs of a pipeline, newest first by start time.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @param limit maximum number of records, positive
    /// @return records, never null (may be empty)
    /// @throws IllegalArgumentException if limit is not positive
    List<RunRecord> recent(String pipelineId, int limit);

    /// Returns the most recent run of a pipeline that ended
    /// {@link RunStatus#SUCCESS}.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @return the run, empty if no run succeeded yet
    default Optional<RunRecord> lastSuccessful(String pipelineId) {
        return recent(pipelineId, Integer.MAX_VALUE).stream()
                .filter(r -> r.status() == RunStatus.SUCCESS)
                .findFirst();
    }
}
