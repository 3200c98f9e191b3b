package io.pipewright.core.stage.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pipewright.core.stage.StageContext;
import io.pipewright.core.stage.StageFailure;
import io.pipewright.core.stage.StageInput;
import io.pipewright.core.stage.StageRole;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StageRegistryTest {

    private static StageSpec spec(String type, Map<String, Object> params) {
        return new StageSpec("s1", type, StageRole.ENRICHMENT, params);
    }

    @Test
    void shouldDiscoverProvidersThroughServiceLoader() throws StageFailure {
        var registry = StageRegistry.loadProviders();

        assertThat(registry.getTypes()).contains("suffix");
        var stage = registry.create(spec("suffix", Map.of("suffix", "?")));
        var context = StageContext.builder().pipelineId("p").runId("r").stageId("s1").build();
        assertThat(stage.run(StageInput.single("sensor"), context)).isEqualTo("sensor?");
    }

    @Test
    void shouldRejectDuplicateType() {
        var registry = new StageRegistry().register(new SuffixStageProvider());

        assertThatThrownBy(() -> registry.register(new SuffixStageProvider()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("suffix");
    }

    @Test
    void shouldNameAvailableTypesForUnknownType() {
        var registry = new StageRegistry().register(new SuffixStageProvider());

        assertThatThrownBy(() -> registry.create(spec("ckan", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ckan")
                .hasMessageContaining("[suffix]");
    }

    @Test
    void shouldConvertNumericParameters() {
        var spec = spec("suffix", Map.of("limit", 10, "ratio", 1, "name", 7));

        assertThat(spec.param("limit", Long.class)).contains(10L);
        assertThat(spec.param("ratio", Double.class)).contains(1.0);
        assertThat(spec.param("name", String.class)).contains("7");
        assertThat(spec.param("missing", String.class)).isEmpty();
        assertThatThrownBy(() -> spec.param("limit", Boolean.class))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> spec.requireParam("missing", String.class))
                .hasMessageContaining("requires parameter 'missing'");
    }
}
