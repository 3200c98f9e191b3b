package io.pipewright.core.state;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory state store (default implementation).
///
/// Thread-safe, no external dependencies. Stores states indexed by pipeline
/// ID and stage ID.
///
/// ### Storage Structure
/// Uses nested maps: pipelineId -> stageId -> state
///
/// @implNote Writes go through `ConcurrentHashMap.compute`, which serializes
/// concurrent writers of the same key while leaving other keys uncontended.
///
/// @see StateStore for contract
public final class InMemoryStateStore implements StateStore {

    private final Map<String, Map<String, StoredState>> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<StoredState> get(String pipelineId, String stageId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(stageId, "stageId must not be null");

        Map<String, StoredState> pipelineStates = storage.get(pipelineId);
        if (pipelineStates == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pipelineStates.get(stageId));
    }

    @Override
    public void put(String pipelineId, String stageId, Object output, Instant timestamp) {
        StoredState state = new StoredState(pipelineId, stageId, output, timestamp);

        storage.computeIfAbsent(pipelineId, id -> new ConcurrentHashMap<>())
                .compute(stageId, (id, previous) -> state);
    }

    @Override
    public boolean delete(String pipelineId, String stageId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(stageId, "stageId must not be null");

        Map<String, StoredState> pipelineStates = storage.get(pipelineId);
        if (pipelineStates == null) {
            return false;
        }
        return pipelineStates.remove(stageId) != null;
    }

    @Override
    public List<StoredState> findByPipeline(String pipelineId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");

        Map<String, StoredState> pipelineStates = storage.get(pipelineId);
        if (pipelineStates == null) {
            return List.of();
        }
        return pipelineStates.values().stream()
                .sorted(Comparator.comparing(StoredState::stageId))
                .toList();
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }

    /// Returns count of states for a pipeline (useful for testing).
    public int countForPipeline(String pipelineId) {
        Map<String, StoredState> pipelineStates = storage.get(pipelineId);
        return pipelineStates != null ? pipelineStates.size() : 0;
    }
}
