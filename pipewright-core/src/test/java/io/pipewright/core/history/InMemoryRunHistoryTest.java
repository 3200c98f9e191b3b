package io.pipewright.core.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.execution.result.StageOutcome;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class InMemoryRunHistoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryRunHistory history;

    @BeforeEach
    void setUp() {
        history = new InMemoryRunHistory();
    }

    static RunRecord run(String runId, String pipelineId, int minute, RunStatus status) {
        Instant startedAt = T0.plusSeconds(60L * minute);
        return new RunRecord(
                runId,
                pipelineId,
                startedAt,
                startedAt.plusSeconds(5),
                Map.of("harvest", new StageOutcome.Succeeded(runId)),
                status);
    }

    @Test
    void shouldReturnRecentRunsNewestFirst() {
        history.record(run("r2", "sensors", 2, RunStatus.SUCCESS));
        history.record(run("r1", "sensors", 1, RunStatus.SUCCESS));
        history.record(run("r3", "sensors", 3, RunStatus.FAILURE));
        history.record(run("x1", "other", 9, RunStatus.SUCCESS));

        assertThat(history.recent("sensors", 10))
                .extracting(RunRecord::runId)
                .containsExactly("r3", "r2", "r1");
        assertThat(history.recent("sensors", 2))
                .extracting(RunRecord::runId)
                .containsExactly("r3", "r2");
        assertThat(history.recent("unknown", 5)).isEmpty();
    }

    @Test
    void shouldReplaceRecordWithSameRunId() {
        history.record(run("r1", "sensors", 1, RunStatus.FAILURE));
        history.record(run("r1", "sensors", 1, RunStatus.SUCCESS));

        assertThat(history.countForPipeline("sensors")).isEqualTo(1);
        assertThat(history.recent("sensors", 1).get(0).status()).isEqualTo(RunStatus.SUCCESS);
    }

    @Test
    void shouldEvictEarliestRunBeyondRetention() {
        var bounded = new InMemoryRunHistory(2);
        bounded.record(run("r3", "sensors", 3, RunStatus.SUCCESS));
        bounded.record(run("r1", "sensors", 1, RunStatus.SUCCESS));
        bounded.record(run("r2", "sensors", 2, RunStatus.SUCCESS));

        assertThat(bounded.countForPipeline("sensors")).isEqualTo(2);
        assertThat(bounded.recent("sensors", 10))
                .extracting(RunRecord::runId)
                .containsExactly("r3", "r2");
    }

    @Test
    void shouldFindLastSuccessfulRun() {
        history.record(run("r1", "sensors", 1, RunStatus.SUCCESS));
        history.record(run("r2", "sensors", 2, RunStatus.SUCCESS));
        history.record(run("r3", "sensors", 3, RunStatus.PARTIAL_FAILURE));
        history.record(run("r4", "sensors", 4, RunStatus.STOPPED));

        assertThat(history.lastSuccessful("sensors"))
                .map(RunRecord::runId)
                .contains("r2");
        assertThat(history.lastSuccessful("other")).isEmpty();
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> history.recent("sensors", 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit");
        assertThatThrownBy(() -> history.record(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new InMemoryRunHistory(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retention");
    }
}
