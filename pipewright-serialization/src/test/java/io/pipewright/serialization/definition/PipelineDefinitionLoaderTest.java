package io.pipewright.serialization.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.execution.PipelineEngine;
import io.pipewright.core.execution.result.RunStatus;
import io.pipewright.core.graph.GraphException;
import io.pipewright.core.graph.GraphViolation;
import io.pipewright.core.graph.StageNode;
import io.pipewright.core.schedule.ScheduleRule;
import io.pipewright.core.stage.StageRole;
import io.pipewright.core.stage.spi.StageRegistry;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineDefinitionLoaderTest {

    private PipelineDefinitionLoader loader;
    private StageRegistry registry;

    @BeforeEach
    void setUp() {
        loader = new PipelineDefinitionLoader();
        registry = TestStageProviders.registry();
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(PipelineDefinitionLoaderTest.class.getResource(name).toURI());
    }

    @Nested
    class LoadTest {

        @Test
        void shouldLoadYamlAsLinearChain() throws URISyntaxException {
            var definition = loader.load(resource("/definitions/sensor-catalog.yaml"));

            assertThat(definition.id()).isEqualTo("sensor-catalog");
            assertThat(definition.stages()).hasSize(3);
            assertThat(definition.stages().get(2).role()).isEqualTo(StageRole.REGISTRATION);
            assertThat(definition.edges()).isEmpty();
            assertThat(definition.scheduleRule())
                    .contains(ScheduleRule.interval(Duration.ofMinutes(15)));

            var graph = definition.toGraph(registry);
            assertThat(graph.topologicalOrder())
                    .containsExactly("harvest", "describe", "register");
        }

        @Test
        void shouldLoadJsonWithExplicitEdges() throws URISyntaxException {
            var definition = loader.load(resource("/definitions/branching.json"));

            var graph = definition.toGraph(registry);

            assertThat(graph.successors("harvest")).hasSize(2);
            assertThat(graph.terminals())
                    .extracting(StageNode::getId)
                    .containsExactlyInAnyOrder("left", "right");
            assertThat(definition.scheduleRule())
                    .hasValueSatisfying(
                            rule -> assertThat(rule).isInstanceOf(ScheduleRule.Cron.class));
        }

        @Test
        void shouldRunLoadedPipeline() throws URISyntaxException {
            var graph = loader.loadGraph(resource("/definitions/sensor-catalog.yaml"), registry);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                var record = new PipelineEngine(pool).run(graph, null);

                assertThat(record.status()).isEqualTo(RunStatus.SUCCESS);
                assertThat(record.output("register")).contains("frost things (described)!");
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void shouldParseInlineDocument() {
            var definition =
                    loader.parse(
                            "id: inline\nstages:\n  - {id: a, type: constant, role: source,"
                                    + " params: {value: x}}\n",
                            PipelineDefinitionLoader.Format.YAML);

            assertThat(definition.schedule()).isNull();
            assertThat(definition.scheduleRule()).isEmpty();
            assertThat(definition.stages().get(0).params()).containsEntry("value", "x");
        }
    }

    @Nested
    class RejectionTest {

        @TempDir Path dir;

        private Path write(String name, String content) throws IOException {
            return Files.writeString(dir.resolve(name), content);
        }

        @Test
        void shouldRejectUnknownStageType() throws IOException {
            var file =
                    write(
                            "unknown.yaml",
                            "id: p\nstages:\n  - {id: a, type: ckan, role: source}\n");

            assertThatThrownBy(() -> loader.loadGraph(file, registry))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("stage 'a'")
                    .hasMessageContaining("No provider found for stage type: ckan");
        }

        @Test
        void shouldRejectMissingProviderParameter() throws IOException {
            var file =
                    write(
                            "param.yaml",
                            "id: p\nstages:\n  - {id: a, type: constant, role: source}\n");

            assertThatThrownBy(() -> loader.loadGraph(file, registry))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("requires parameter 'value'");
        }

        @Test
        void shouldRejectScheduleWithIntervalAndCron() throws IOException {
            var file =
                    write(
                            "both.yaml",
                            "id: p\n"
                                    + "stages:\n  - {id: a, type: constant, role: source}\n"
                                    + "schedule: {interval: PT5M, cron: '@daily'}\n");

            assertThatThrownBy(() -> loader.load(file))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("not both");
        }

        @Test
        void shouldRejectMalformedInterval() throws IOException {
            var file =
                    write(
                            "interval.yaml",
                            "id: p\n"
                                    + "stages:\n  - {id: a, type: constant, role: source}\n"
                                    + "schedule: {interval: 15 minutes}\n");

            assertThatThrownBy(() -> loader.load(file))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("Invalid schedule");
        }

        @Test
        void shouldRejectMissingIdAndStages() throws IOException {
            var noId = write("noid.json", "{\"stages\": []}");
            var noStages = write("nostages.json", "{\"id\": \"p\"}");

            assertThatThrownBy(() -> loader.load(noId)).hasMessageContaining("missing 'id'");
            assertThatThrownBy(() -> loader.load(noStages))
                    .hasMessageContaining("declares no stages");
        }

        @Test
        void shouldRejectUnknownField() throws IOException {
            var file = write("typo.json", "{\"id\": \"p\", \"stagse\": []}");

            assertThatThrownBy(() -> loader.load(file))
                    .isInstanceOf(PipelineDefinitionException.class);
        }

        @Test
        void shouldRejectUnsupportedExtension() throws IOException {
            var file = write("pipeline.toml", "id = 'p'");

            assertThatThrownBy(() -> loader.load(file))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining(".json, .yaml or .yml");
        }

        @Test
        void shouldRejectMissingFile() {
            assertThatThrownBy(() -> loader.load(dir.resolve("absent.yaml")))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        void shouldReportGraphViolationsAsGraphException() throws IOException {
            var file =
                    write(
                            "cycle.yaml",
                            "id: p\n"
                                    + "stages:\n"
                                    + "  - {id: src, type: constant, role: source,"
                                    + " params: {value: x}}\n"
                                    + "  - {id: a, type: suffix, role: enrichment}\n"
                                    + "  - {id: b, type: suffix, role: enrichment}\n"
                                    + "edges:\n"
                                    + "  - {from: src, to: a}\n"
                                    + "  - {from: a, to: b}\n"
                                    + "  - {from: b, to: a}\n");

            assertThatThrownBy(() -> loader.loadGraph(file, registry))
                    .isInstanceOfSatisfying(
                            GraphException.class,
                            e -> assertThat(e.getViolation()).isEqualTo(GraphViolation.CYCLE));
        }
    }
}
