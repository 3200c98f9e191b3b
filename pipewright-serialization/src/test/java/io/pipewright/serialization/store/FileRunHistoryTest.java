package io.pipewright.serialization.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.stage.FailureKind;
import io.pipewright.core.state.StoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRunHistoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir Path dir;

    private FileRunHistory history;

    @BeforeEach
    void setUp() {
        history = new FileRunHistory(dir.resolve("runs"));
    }

    private static RunRecord run(String runId, String pipelineId, int minute, RunStatus status) {
        Instant startedAt = T0.plusSeconds(60L * minute);
        Map<String, StageOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("harvest", new StageOutcome.Succeeded("things of " + runId));
        outcomes.put(
                "translate",
                new StageOutcome.Failed(FailureKind.TRANSIENT, "endpoint timed out", null));
        return new RunRecord(
                runId, pipelineId, startedAt, startedAt.plusSeconds(5), outcomes, status);
    }

    @Test
    void shouldReturnEmptyBeforeFirstRun() {
        assertThat(history.recent("sensors", 5)).isEmpty();
        assertThat(history.lastSuccessful("sensors")).isEmpty();
    }

    @Test
    void shouldRestoreRecordedRun() {
        history.record(run("run-1", "sensors", 1, RunStatus.PARTIAL_FAILURE));

        RunRecord restored = new FileRunHistory(history.getRoot()).recent("sensors", 1).get(0);

        assertThat(restored.runId()).isEqualTo("run-1");
        assertThat(restored.status()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(restored.startedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(restored.outcomes().keySet()).containsExactly("harvest", "translate");
        assertThat(restored.output("harvest")).contains("things of run-1");
        assertThat(restored.outcome("translate")).isInstanceOf(StageOutcome.Failed.class);
    }

    @Test
    void shouldListRunsNewestFirst() {
        history.record(run("b", "sensors", 2, RunStatus.SUCCESS));
        history.record(run("c", "sensors", 3, RunStatus.FAILURE));
        history.record(run("a", "sensors", 1, RunStatus.SUCCESS));

        assertThat(history.recent("sensors", 10))
                .extracting(RunRecord::runId)
                .containsExactly("c", "b", "a");
        assertThat(history.recent("sensors", 1)).extracting(RunRecord::runId).containsExactly("c");
        assertThat(history.lastSuccessful("sensors")).map(RunRecord::runId).contains("b");
    }

    @Test
    void shouldDeleteOldestRunsBeyondRetention() throws IOException {
        var bounded = new FileRunHistory(dir.resolve("bounded"), 2);
        bounded.record(run("r1", "sensors", 1, RunStatus.SUCCESS));
        bounded.record(run("r2", "sensors", 2, RunStatus.SUCCESS));
        bounded.record(run("r3", "sensors", 3, RunStatus.SUCCESS));

        assertThat(bounded.recent("sensors", 10))
                .extracting(RunRecord::runId)
                .containsExactly("r3", "r2");
        try (Stream<Path> files = Files.list(dir.resolve("bounded").resolve("sensors"))) {
            assertThat(files).hasSize(2);
        }
    }

    @Test
    void shouldKeepIdentifiersWithPathCharactersApart() {
        history.record(run("2024/05/01 10:00", "../sensors", 1, RunStatus.SUCCESS));
        history.record(run("x", "sensors", 2, RunStatus.SUCCESS));

        assertThat(history.recent("../sensors", 5))
                .extracting(RunRecord::runId)
                .containsExactly("2024/05/01 10:00");
        assertThat(history.recent("sensors", 5)).extracting(RunRecord::runId).containsExactly("x");
        assertThat(dir.resolve("sensors")).doesNotExist();
    }

    @Test
    void shouldReportCorruptRunFile() throws IOException {
        history.record(run("r1", "sensors", 1, RunStatus.SUCCESS));
        Files.writeString(
                history.getRoot().resolve("sensors").resolve("broken.json"), "{not json");

        assertThatThrownBy(() -> history.recent("sensors", 5))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Corrupt run record file");
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> history.recent("sensors", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileRunHistory(dir, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
