package io.pipewright.serialization.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipewright.core.state.StateStore;
import io.pipewright.core.state.StoreException;
import io.pipewright.core.state.StoredState;
import io.pipewright.serialization.RunRecordSerializer;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/// File-backed state store keeping one JSON document per key.
///
/// ### Storage Structure
/// ```
/// <root>/<pipelineId>/<stageId>.json
/// ```
/// Identifiers are percent-encoded so that any string maps to a safe and
/// distinct file name. Each document records the output's runtime class:
/// ```
/// {"pipelineId":"...","stageId":"...","outputType":"java.lang.String",
///  "output":"...","timestamp":"2024-05-01T10:00:00Z"}
/// ```
/// On read the output is bound back to that class. Collections are recorded
/// by interface (`java.util.List`, `Set`, `Map`) and generic element types are
/// not recorded, so their elements come back as plain JSON values.
///
/// ### Concurrency
/// Writes are staged to a temporary file and moved into place atomically, so
/// readers never see a partial document. Writers of the same key are
/// serialized by a per-key lock; other keys proceed in parallel.
///
/// @implNote Thread-safe within one JVM. Several processes sharing a
/// directory get atomic replacement but no write ordering.
///
/// @see io.pipewright.core.state.InMemoryStateStore for the in-memory variant
public final class FileStateStore implements StateStore {

    private static final Logger logger = Logger.getLogger(FileStateStore.class.getName());

    private static final String EXTENSION = ".json";

    private final Path root;
    private final ObjectMapper mapper;
    private final ConcurrentMap<Path, Object> keyLocks = new ConcurrentHashMap<>();

    /// Creates a store under a directory, using the default mapper.
    ///
    /// @param root storage directory, created on first write, not null
    public FileStateStore(Path root) {
        this(root, RunRecordSerializer.createMapper());
    }

    /// Creates a store with a custom mapper, for outputs that need extra modules.
    ///
    /// @param root storage directory, created on first write, not null
    /// @param mapper mapper used for outputs, not null
    public FileStateStore(Path root, ObjectMapper mapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Optional<StoredState> get(String pipelineId, String stageId) {
        Path file = fileFor(pipelineId, stageId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public void put(String pipelineId, String stageId, Object output, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Path file = fileFor(pipelineId, stageId);

        ObjectNode document = mapper.createObjectNode();
        document.put("pipelineId", pipelineId);
        document.put("stageId", stageId);
        document.put("outputType", output != null ? bindingType(output.getClass()) : null);
        document.set("output", mapper.valueToTree(output));
        document.put("timestamp", timestamp.toString());

        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(document);
        } catch (IOException e) {
            throw new StoreException(
                    "Cannot serialize output of stage '" + stageId + "': " + e.getMessage(), e);
        }

        synchronized (lockFor(file)) {
            try {
                StoreFiles.writeAtomically(file, bytes);
            } catch (IOException e) {
                throw new StoreException("Cannot write state file " + file, e);
            }
        }
        logger.fine("Stored state of " + pipelineId + "/" + stageId + " in " + file);
    }

    @Override
    public boolean delete(String pipelineId, String stageId) {
        Path file = fileFor(pipelineId, stageId);
        synchronized (lockFor(file)) {
            try {
                return Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new StoreException("Cannot delete state file " + file, e);
            }
        }
    }

    @Override
    public List<StoredState> findByPipeline(String pipelineId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Path dir = root.resolve(StoreFiles.encode(pipelineId));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }

        List<StoredState> states = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + EXTENSION)) {
            for (Path file : files) {
                states.add(read(file));
            }
        } catch (IOException e) {
            throw new StoreException("Cannot list state directory " + dir, e);
        }
        states.sort(Comparator.comparing(StoredState::stageId));
        return states;
    }

    /// Returns the directory holding the state files.
    ///
    /// @return storage root, never null
    public Path getRoot() {
        return root;
    }

    private StoredState read(Path file) {
        JsonNode document;
        try {
            document = mapper.readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new StoreException("Cannot read state file " + file, e);
        }
        if (document == null || !document.isObject()) {
            throw new StoreException("State file " + file + " is not a JSON object");
        }

        try {
            Object output = null;
            JsonNode outputNode = document.get("output");
            JsonNode typeNode = document.get("outputType");
            if (outputNode != null && !outputNode.isNull()) {
                Class<?> type =
                        typeNode != null && !typeNode.isNull()
                                ? resolve(typeNode.asText())
                                : Object.class;
                output = mapper.treeToValue(outputNode, type);
            }
            return new StoredState(
                    document.path("pipelineId").asText(),
                    document.path("stageId").asText(),
                    output,
                    Instant.parse(document.path("timestamp").asText()));
        } catch (IOException | RuntimeException e) {
            throw new StoreException("Corrupt state file " + file + ": " + e.getMessage(), e);
        }
    }

    private Class<?> resolve(String typeName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try {
            return Class.forName(
                    typeName,
                    false,
                    loader != null ? loader : FileStateStore.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new StoreException("Unknown output type " + typeName, e);
        }
    }

    /// Collections are recorded by their interface, since JDK implementations
    /// such as `List.of(..)` have no constructor Jackson can call.
    private static String bindingType(Class<?> type) {
        if (List.class.isAssignableFrom(type)) {
            return List.class.getName();
        }
        if (Set.class.isAssignableFrom(type)) {
            return Set.class.getName();
        }
        if (Map.class.isAssignableFrom(type)) {
            return Map.class.getName();
        }
        if (Collection.class.isAssignableFrom(type)) {
            return Collection.class.getName();
        }
        return type.getName();
    }

    private Path fileFor(String pipelineId, String stageId) {
        Objects.requireNonNull(pipelineId, "pipelineId must not be null");
        Objects.requireNonNull(stageId, "stageId must not be null");
        return root.resolve(StoreFiles.encode(pipelineId))
                .resolve(StoreFiles.encode(stageId) + EXTENSION);
    }

    private Object lockFor(Path file) {
        return keyLocks.computeIfAbsent(file, f -> new Object());
    }
}
