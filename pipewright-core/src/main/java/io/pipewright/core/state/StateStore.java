package io.pipewright.core.state;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/// Key-value persistence of stage outputs for incremental execution.
///
/// Keys are `(pipelineId, stageId)` pairs and are unique: a `put` replaces the
/// previous value. The engine only writes; stages read their own prior state
/// through {@link io.pipewright.core.stage.StageContext}.
///
/// ### Concurrency
/// Different keys may be written concurrently by parallel stages of one run.
/// Implementations must serialize concurrent writes to the same key.
///
/// ### Usage
/// {@snippet :
/// store.put("sensor-catalog", "harvest", things, Instant.now());
/// Optional<StoredState> last = store.get("sensor-catalog", "harvest");
/// }
///
/// @see InMemoryStateStore for the in-memory implementation
public interface StateStore {

    /// Reads the stored state of a stage.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @param stageId stage identifier, not null
    /// @return the stored state, empty if never written
    /// @throws NullPointerException if an argument is null
    /// @throws StoreException if the backend cannot be read
    Optional<StoredState> get(String pipelineId, String stageId);

    /// Writes (or replaces) the stored state of a stage.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @param stageId stage identifier, not null
    /// @param output stage output snapshot, may be null
    /// @param timestamp when the output was produced, not null
    /// @throws NullPointerException if pipelineId, stageId or timestamp is null
    /// @throws StoreException if the backend cannot be written
    void put(String pipelineId, String stageId, Object output, Instant timestamp);

    /// Deletes the stored state of a stage.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @param stageId stage identifier, not null
    /// @return true if a value was removed
    /// @throws StoreException if the backend cannot be written
    boolean delete(String pipelineId, String stageId);

    /// Lists the stored states of every stage of a pipeline.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @return stored states, never null (may be empty)
    /// @throws StoreException if the backend cannot be read
    List<StoredState> findByPipeline(String pipelineId);
}
