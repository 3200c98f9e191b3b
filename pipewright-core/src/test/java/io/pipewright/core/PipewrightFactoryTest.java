package io.pipewright.core;

import static io.pipewright.core.stage.TestStages.emitting;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import io.pipewright.core.execution.PipelineEngine;
import io.pipewright.core.execution.StatePersistence;
import io.pipewright.core.execution.result.RunRecord;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.history.InMemoryRunHistory;
import io.pipewright.core.schedule.BacklogPolicy;
import io.pipewright.core.schedule.ScheduleListener;
import io.pipewright.core.schedule.ScheduleRule;
import io.pipewright.core.schedule.SchedulerConfig;
import io.pipewright.core.stage.StageRole;
import io.pipewright.core.state.InMemoryStateStore;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

class PipewrightFactoryTest {

    private static PipelineGraph graph() {
        return PipelineGraph.builder("sensors")
                .stage("harvest", StageRole.SOURCE, emitting(String.class, "raw"))
                .build();
    }

    @Test
    void shouldCreateEnvironmentWithInMemoryStore() {
        try (var env = PipewrightFactory.createEnvironment()) {
            var record = env.bind(graph()).build().run();

            assertThat(record.status()).isEqualTo(RunStatus.SUCCESS);
            assertThat(env.getStateStore()).isInstanceOf(InMemoryStateStore.class);
            assertThat(env.getStateStore().get("sensors", "harvest")).isPresent();
        }
    }

    @Test
    void shouldApplyProperties() {
        try (var env =
                PipewrightFactory.createEnvironment(
                        Map.of(
                                "pipewright.engine.max-parallelism", "2",
                                "pipewright.engine.state-persistence", "on-run-success",
                                "pipewright.scheduler.backlog-policy", "queue-all"))) {
            assertThat(env.getEngine().getConfig().getMaxParallelism()).isEqualTo(2);
            assertThat(env.getEngine().getConfig().getStatePersistence())
                    .isEqualTo(StatePersistence.ON_RUN_SUCCESS);
            assertThat(env.getSchedulerConfig().getBacklogPolicy())
                    .isEqualTo(BacklogPolicy.QUEUE_ALL);
        }
    }

    @Test
    void shouldStopScheduledJobsOnClose() {
        ScheduleListener listener = mock(ScheduleListener.class);
        var store = new InMemoryStateStore();
        var env = PipewrightFactory.builder().stateStore(store).build();
        var job =
                env.schedule(
                        ScheduleRule.interval(Duration.ofMillis(50)).firingImmediately(),
                        env.bind(graph()).build(),
                        listener);

        verify(listener, timeout(5000).atLeastOnce()).onRunComplete(any(), any());
        env.close();

        assertThat(job.isTerminated()).isTrue();
        assertThat(store.get("sensors", "harvest")).isPresent();
    }

    @Test
    void shouldRecordBoundRunsInHistory() {
        var history = new InMemoryRunHistory();
        try (var env = PipewrightFactory.builder().runHistory(history).build()) {
            var first = env.bind(graph()).build().run();
            var second = env.bind(graph()).build().run();

            assertThat(env.getRunHistory()).isSameAs(history);
            assertThat(history.recent("sensors", 10))
                    .extracting(RunRecord::runId)
                    .containsExactlyInAnyOrder(first.runId(), second.runId());
            assertThat(history.lastSuccessful("sensors")).isPresent();
        }
    }

    @Test
    void shouldLeaveCallerSuppliedPoolRunning() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            var env = PipewrightFactory.builder().executorService(pool).build();
            env.bind(graph()).build().run();
            env.close();

            assertThat(pool.isShutdown()).isFalse();
            var next = PipewrightFactory.builder().executorService(pool).build();
            assertThat(next.bind(graph()).build().run().status()).isEqualTo(RunStatus.SUCCESS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldShutDownOnlyOwnedPoolOnClose() {
        ExecutorService owned = mock(ExecutorService.class);
        ExecutorService borrowed = mock(ExecutorService.class);

        environment(owned, true).close();
        environment(borrowed, false).close();

        verify(owned).shutdown();
        verify(borrowed, never()).shutdown();
    }

    private static PipewrightEnvironment environment(ExecutorService pool, boolean owned) {
        return new PipewrightEnvironment(
                new PipelineEngine(pool),
                new InMemoryStateStore(),
                new InMemoryRunHistory(),
                new SchedulerConfig(),
                pool,
                owned);
    }
}
