package io.pipewright.serialization.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.history.RunHistory;
import io.pipewright.core.state.StoreException;
import io.pipewright.serialization.RunRecordSerializer;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/// File-backed run history keeping one JSON document per run.
///
/// ### Storage Structure
/// ```
/// <root>/<pipelineId>/<runId>.json
/// ```
/// Documents use the format of {@link RunRecordSerializer}, so restored
/// records carry stage outputs as plain JSON values and failures without
/// their causes. Identifiers are percent-encoded as in {@link FileStateStore}.
///
/// At most `retention` runs are kept per pipeline; recording beyond that
/// deletes the files of the runs that started first.
///
/// @implNote Thread-safe within one JVM: writers of one pipeline are
/// serialized, readers see whole documents only.
///
/// @see io.pipewright.core.history.InMemoryRunHistory for the in-memory variant
public final class FileRunHistory implements RunHistory {

    private static final Logger logger = Logger.getLogger(FileRunHistory.class.getName());

    /// Runs kept per pipeline unless configured otherwise.
    public static final int DEFAULT_RETENTION = 1000;

    private static final String EXTENSION = ".json";

    private static final Comparator<RunRecord> NEWEST_FIRST =
            Comparator.comparing(RunRecord::startedAt).reversed();

    private final Path root;
    private final int retention;
    private final ObjectMapper mapper = RunRecordSerializer.createMapper();
    private final ConcurrentMap<String, Object> pipelineLocks = new ConcurrentHashMap<>();

    /// Creates a history under a directory with the default retention.
    ///
    /// @param root storage directory, created on first write, not null
    public FileRunHistory(Path root) {
        this(root, DEFAULT_RETENTION);
    }

    /// Creates a history under a directory.
    ///
    /// @param root storage directory, created on first write, not null
    /// @param retention maximum runs kept per pipeline, positive
    public FileRunHistory(Path root, int retention) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive, got " + retention);
        }
        this.retention = retention;
    }

    @Override
    public void record(RunRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Path dir = directoryOf(record.pipelineId());
        Path file = dir.resolve(StoreFiles.encode(record.runId()) + EXTENSION);

        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new StoreException(
                    "Cannot serialize run " + record.runId() + ": " + e.getMessage(), e);
        }

        synchronized (lockFor(record.pipelineId())) {
            try {
                StoreFiles.writeAtomically(file, bytes);
            } catch (IOException e) {
                throw new StoreException("Cannot write run record file " + file, e);
            }
            prune(record.pipelineId(), dir);
        }
        logger.fine(
                "Recorded run " + record.runId() + " of pipeline '" + record.pipelineId()
                        + "' in " + file);
    }

    @Override
    public List<RunRecord> recent(String pipelineId, int limit) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + limit);
        }
        List<RunRecord> records = readAll(directoryOf(pipelineId));
        return List.copyOf(records.subList(0, Math.min(limit, records.size())));
    }

    /// Returns the directory holding the run files.
    ///
    /// @return storage root, never null
    public Path getRoot() {
        return root;
    }

    /// Deletes the oldest runs beyond the retention. Caller holds the pipeline lock.
    private void prune(String pipelineId, Path dir) {
        List<RunRecord> records = readAll(dir);
        if (records.size() <= retention) {
            return;
        }
        for (RunRecord expired : records.subList(retention, records.size())) {
            Path file = dir.resolve(StoreFiles.encode(expired.runId()) + EXTENSION);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new StoreException("Cannot delete run record file " + file, e);
            }
            logger.fine("Pruned run " + expired.runId() + " of pipeline '" + pipelineId + "'");
        }
    }

    /// Reads every run of a pipeline directory, newest first.
    private List<RunRecord> readAll(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<RunRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path file : files) {
                RunRecord record = read(file);
                if (record != null) {
                    records.add(record);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list run history directory " + dir, e);
        }
        records.sort(NEWEST_FIRST);
        return records;
    }

    /// Returns null when the file was pruned after the directory was listed.
    private RunRecord read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StoreException("Cannot read run record file " + file, e);
        }
        try {
            return mapper.readValue(bytes, RunRecord.class);
        } catch (IOException | RuntimeException e) {
            throw new StoreException("Corrupt run record file " + file + ": " + e.getMessage(), e);
        }
    }

    private Path directoryOf(String pipelineId) {
        return root.resolve(StoreFiles.encode(pipelineId));
    }

    private Object lockFor(String pipelineId) {
        return pipelineLocks.computeIfAbsent(pipelineId, id -> new Object());
    }
}
