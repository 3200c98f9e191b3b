package io.pipewright.serialization.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.state.StoreException;
import io.pipewright.core.state.StoredState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStateStoreTest {

    private static final Instant T1 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2024-05-01T10:15:00Z");

    /// Typed output used to check that values come back with their class.
    public record SensorSnapshot(String thing, int datastreams) {}

    @TempDir Path dir;

    private FileStateStore store;

    @BeforeEach
    void setUp() {
        store = new FileStateStore(dir.resolve("state"));
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertThat(store.get("sensors", "harvest")).isEmpty();
        assertThat(store.findByPipeline("sensors")).isEmpty();
    }

    @Test
    void shouldRoundTripTypedOutput() {
        store.put("sensors", "harvest", new SensorSnapshot("weather-station", 3), T1);

        StoredState state = store.get("sensors", "harvest").orElseThrow();

        assertThat(state.output()).isEqualTo(new SensorSnapshot("weather-station", 3));
        assertThat(state.timestamp()).isEqualTo(T1);
        assertThat(state.pipelineId()).isEqualTo("sensors");
        assertThat(state.stageId()).isEqualTo("harvest");
    }

    @Test
    void shouldRoundTripPlainValues() {
        store.put("sensors", "text", "raw", T1);
        store.put("sensors", "count", 42, T1);
        store.put("sensors", "map", Map.of("a", 1), T1);
        store.put("sensors", "none", null, T1);

        assertThat(store.get("sensors", "text").orElseThrow().output()).isEqualTo("raw");
        assertThat(store.get("sensors", "count").orElseThrow().output()).isEqualTo(42);
        assertThat(store.get("sensors", "map").orElseThrow().output())
                .isEqualTo(Map.of("a", 1));
        assertThat(store.get("sensors", "none").orElseThrow().output()).isNull();
    }

    @Test
    void shouldOverwriteExistingState() {
        store.put("sensors", "harvest", "first", T1);
        store.put("sensors", "harvest", "second", T2);

        StoredState state = store.get("sensors", "harvest").orElseThrow();
        assertThat(state.output()).isEqualTo("second");
        assertThat(state.timestamp()).isEqualTo(T2);
    }

    @Test
    void shouldSurviveNewStoreInstance() {
        store.put("sensors", "harvest", List.of("a", "b"), T1);

        var reopened = new FileStateStore(dir.resolve("state"));

        assertThat(reopened.get("sensors", "harvest").orElseThrow().output())
                .isEqualTo(List.of("a", "b"));
    }

    @Test
    void shouldDeleteState() {
        store.put("sensors", "harvest", "raw", T1);

        assertThat(store.delete("sensors", "harvest")).isTrue();
        assertThat(store.delete("sensors", "harvest")).isFalse();
        assertThat(store.get("sensors", "harvest")).isEmpty();
    }

    @Test
    void shouldListStatesOfPipelineSortedByStage() {
        store.put("sensors", "register", "c", T1);
        store.put("sensors", "group", "b", T1);
        store.put("sensors", "harvest", "a", T1);
        store.put("other", "harvest", "x", T1);

        assertThat(store.findByPipeline("sensors"))
                .extracting(StoredState::stageId)
                .containsExactly("group", "harvest", "register");
    }

    @Test
    void shouldKeepOddIdentifiersInsideRoot() throws IOException {
        store.put("../escape", "a/b", "x", T1);
        store.put("sensors", "a.b", "y", T1);
        store.put("sensors", "a_b", "z", T1);

        assertThat(store.get("../escape", "a/b").orElseThrow().output()).isEqualTo("x");
        assertThat(store.get("sensors", "a.b").orElseThrow().output()).isEqualTo("y");
        assertThat(store.get("sensors", "a_b").orElseThrow().output()).isEqualTo("z");
        try (Stream<Path> files = Files.walk(dir)) {
            assertThat(files.filter(Files::isRegularFile))
                    .allSatisfy(f -> assertThat(f).startsWith(dir.resolve("state")))
                    .hasSize(3);
        }
        assertThat(StoreFiles.encode("a.b")).isEqualTo("a%2Eb");
    }

    @Test
    void shouldLeaveNoTemporaryFiles() throws IOException {
        for (int i = 0; i < 5; i++) {
            store.put("sensors", "harvest", "v" + i, T1);
        }

        try (Stream<Path> files = Files.list(dir.resolve("state").resolve("sensors"))) {
            assertThat(files)
                    .extracting(f -> f.getFileName().toString())
                    .containsExactly("harvest.json");
        }
    }

    @Test
    void shouldSerializeConcurrentWritesToSameKey() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> writes =
                    IntStream.range(0, 32)
                            .<Future<?>>mapToObj(
                                    i ->
                                            pool.submit(
                                                    () -> {
                                                        start.await();
                                                        store.put("sensors", "harvest", i, T1);
                                                        return null;
                                                    }))
                            .toList();
            start.countDown();
            for (Future<?> write : writes) {
                write.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("sensors", "harvest").orElseThrow().output())
                .isInstanceOf(Integer.class);
    }

    @Test
    void shouldReportCorruptFile() throws IOException {
        store.put("sensors", "harvest", "raw", T1);
        Files.writeString(dir.resolve("state/sensors/harvest.json"), "{not json");

        assertThatThrownBy(() -> store.get("sensors", "harvest"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("harvest.json");
    }

    @Test
    void shouldReportUnknownOutputType() throws IOException {
        Files.createDirectories(dir.resolve("state/sensors"));
        Files.writeString(
                dir.resolve("state/sensors/harvest.json"),
                "{\"pipelineId\":\"sensors\",\"stageId\":\"harvest\","
                        + "\"outputType\":\"com.example.Gone\",\"output\":{},"
                        + "\"timestamp\":\"2024-05-01T10:00:00Z\"}");

        assertThatThrownBy(() -> store.get("sensors", "harvest"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("com.example.Gone");
    }
}
