package io.pipewright.core.execution;

import static io.pipewright.core.stage.TestStages.emitting;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.history.InMemoryRunHistory;
import io.pipewright.core.history.RunHistory;
import io.pipewright.core.stage.StageRole;
import io.pipewright.core.state.StoreException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoundPipelineTest {

    private ExecutorService pool;
    private PipelineEngine engine;
    private PipelineGraph graph;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(2);
        engine = new PipelineEngine(pool);
        graph =
                PipelineGraph.builder("sensors")
                        .stage("harvest", StageRole.SOURCE, emitting(String.class, "raw"))
                        .build();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRecordEveryRunInHistory() {
        var history = new InMemoryRunHistory();
        var pipeline = BoundPipeline.builder(engine, graph).history(history).build();

        RunRecord first = pipeline.run();
        RunRecord second = pipeline.run();

        assertThat(pipeline.getHistory()).containsSame(history);
        assertThat(history.countForPipeline("sensors")).isEqualTo(2);
        assertThat(history.recent("sensors", 10))
                .extracting(RunRecord::runId)
                .containsExactlyInAnyOrder(first.runId(), second.runId());
    }

    @Test
    void shouldReturnRecordWhenHistoryFails() {
        RunHistory history = mock(RunHistory.class);
        doThrow(new StoreException("disk full")).when(history).record(any());
        var pipeline = BoundPipeline.builder(engine, graph).history(history).build();

        RunRecord record = pipeline.run();

        assertThat(record.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(record.output("harvest")).contains("raw");
        verify(history).record(record);
    }

    @Test
    void shouldRunWithoutHistory() {
        var pipeline = BoundPipeline.builder(engine, graph).build();

        assertThat(pipeline.getHistory()).isEmpty();
        assertThat(pipeline.run().status()).isEqualTo(RunStatus.SUCCESS);
    }
}
