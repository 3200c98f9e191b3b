package io.pipewright.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.execution.result.StageOutcome;
import io.pipewright.core.stage.FailureKind;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// JSON rendering of run records through the `PipewrightJacksonModule`.
class RunRecordSerializerTest {

    private RunRecord record;

    @BeforeEach
    void setUp() {
        Map<String, StageOutcome> outcomes = new LinkedHashMap<>();
        outcomes.put("harvest", new StageOutcome.Succeeded("raw things"));
        outcomes.put(
                "translate",
                new StageOutcome.Failed(
                        FailureKind.TRANSIENT,
                        "LLM endpoint timed out",
                        new IllegalStateException("timeout")));
        outcomes.put("describe", new StageOutcome.Skipped("Upstream stage 'translate' failed"));
        record =
                new RunRecord(
                        "run-1",
                        "sensor-catalog",
                        Instant.parse("2024-05-01T10:00:00Z"),
                        Instant.parse("2024-05-01T10:00:05Z"),
                        outcomes,
                        RunStatus.PARTIAL_FAILURE);
    }

    @Test
    void shouldWriteDiscriminatedOutcomes() throws Exception {
        JsonNode json = new ObjectMapper().readTree(RunRecordSerializer.toJson(record));

        assertThat(json.get("status").asText()).isEqualTo("PARTIAL_FAILURE");
        assertThat(json.get("startedAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
        JsonNode outcomes = json.get("outcomes");
        assertThat(outcomes.get("harvest").get("status").asText()).isEqualTo("succeeded");
        assertThat(outcomes.get("harvest").get("output").asText()).isEqualTo("raw things");
        assertThat(outcomes.get("translate").get("kind").asText()).isEqualTo("TRANSIENT");
        assertThat(outcomes.get("translate").get("cause").asText()).contains("timeout");
        assertThat(outcomes.get("describe").get("reason").asText()).contains("translate");
    }

    @Test
    void shouldRestoreRecord() {
        RunRecord restored = RunRecordSerializer.fromJson(RunRecordSerializer.toJson(record));

        assertThat(restored.runId()).isEqualTo("run-1");
        assertThat(restored.status()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(restored.startedAt()).isEqualTo(record.startedAt());
        assertThat(restored.outcomes().keySet())
                .containsExactly("harvest", "translate", "describe");
        assertThat(restored.output("harvest")).contains("raw things");
        assertThat(restored.outcome("translate"))
                .isInstanceOfSatisfying(
                        StageOutcome.Failed.class,
                        failed -> {
                            assertThat(failed.kind()).isEqualTo(FailureKind.TRANSIENT);
                            assertThat(failed.message()).isEqualTo("LLM endpoint timed out");
                            assertThat(failed.cause()).isNull();
                        });
        assertThat(restored.outcome("describe")).isInstanceOf(StageOutcome.Skipped.class);
    }

    @Test
    void shouldRejectUnknownOutcomeStatus() {
        String json =
                "{\"runId\":\"r\",\"pipelineId\":\"p\","
                        + "\"startedAt\":\"2024-05-01T10:00:00Z\","
                        + "\"finishedAt\":\"2024-05-01T10:00:00Z\","
                        + "\"outcomes\":{\"a\":{\"status\":\"exploded\"}},"
                        + "\"status\":\"FAILURE\"}";

        assertThatThrownBy(() -> RunRecordSerializer.fromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exploded");
    }
}
