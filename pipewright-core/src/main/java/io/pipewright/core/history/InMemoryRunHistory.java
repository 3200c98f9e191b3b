package io.pipewright.core.history;

import io.pipewright.core.execution.result.RunRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory run history (default implementation).
///
/// Thread-safe, no external dependencies. Keeps at most `retention` records
/// per pipeline; recording beyond that evicts the run that started first.
///
/// ### Storage Structure
/// Uses nested maps: pipelineId -> runId -> record
///
/// @see RunHistory for contract
public final class InMemoryRunHistory implements RunHistory {

    /// Records kept per pipeline unless configured otherwise.
    public static final int DEFAULT_RETENTION = 1000;

    private static final Comparator<RunRecord> NEWEST_FIRST =
            Comparator.comparing(RunRecord::startedAt).reversed();

    private final Map<String, Map<String, RunRecord>> storage = new ConcurrentHashMap<>();
    private final int retention;

    public InMemoryRunHistory() {
        this(DEFAULT_RETENTION);
    }

    /// Creates a history keeping a bounded number of runs per pipeline.
    ///
    /// @param retention maximum records per pipeline, positive
    public InMemoryRunHistory(int retention) {
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive, got " + retention);
        }
        this.retention = retention;
    }

    @Override
    public void record(RunRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Map<String, RunRecord> runs =
                storage.computeIfAbsent(record.pipelineId(), id -> new LinkedHashMap<>());
        synchronized (runs) {
            runs.put(record.runId(), record);
            while (runs.size() > retention) {
                RunRecord oldest =
                        runs.values().stream()
                                .min(Comparator.comparing(RunRecord::startedAt))
                                .orElseThrow();
                runs.remove(oldest.runId());
            }
        }
    }

    @Override
    public List<RunRecord> recent(String pipelineId, int limit) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }

        Map<String, RunRecord> runs = storage.get(pipelineId);
        if (runs == null) {
            return List.of();
        }
        List<RunRecord> records;
        synchronized (runs) {
            records = new ArrayList<>(runs.values());
        }
        records.sort(NEWEST_FIRST);
        return List.copyOf(records.subList(0, Math.min(limit, records.size())));
    }

    /// Returns the number of runs held for a pipeline.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @return record count
    public int countForPipeline(String pipelineId) {
        Map<String, RunRecord> runs = storage.get(pipelineId);
        if (runs == null) {
            return 0;
        }
        synchronized (runs) {
            return runs.size();
        }
    }
}
