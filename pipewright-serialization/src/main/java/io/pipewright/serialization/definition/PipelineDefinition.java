package io.pipewright.serialization.definition;

import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.schedule.ScheduleRule;
import io.pipewright.core.stage.Stage;
import io.pipewright.core.stage.spi.StageRegistry;
import io.pipewright.core.stage.spi.StageSpec;
import java.util.List;
import java.util.Optional;

/// Declarative pipeline as read from a JSON or YAML file.
///
/// When `edges` is absent or empty the stages form a linear chain in
/// declaration order.
///
/// @param id pipeline identifier
/// @param stages stage specifications in declaration order
/// @param edges explicit edges, may be null
/// @param schedule optional schedule, may be null
/// @see PipelineDefinitionLoader
public record PipelineDefinition(
        String id,
        List<StageSpec> stages,
        List<EdgeDefinition> edges,
        ScheduleDefinition schedule) {

    public PipelineDefinition {
        stages = stages == null ? List.of() : List.copyOf(stages);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /// Builds the validated graph, creating each stage through the registry.
    ///
    /// @param registry providers for the stage types used, not null
    /// @return validated graph, never null
    /// @throws PipelineDefinitionException if a stage type is unknown or its
    ///         provider rejects the parameters
    /// @throws io.pipewright.core.graph.GraphException if the graph is invalid
    public PipelineGraph toGraph(StageRegistry registry) {
        PipelineGraph.Builder builder = PipelineGraph.builder(id);
        for (StageSpec spec : stages) {
            Stage stage;
            try {
                stage = registry.create(spec);
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new PipelineDefinitionException(
                        "Cannot create stage '" + spec.id() + "' of pipeline '" + id + "': "
                                + e.getMessage(),
                        e);
            }
            builder.stage(spec.id(), spec.role(), stage);
        }

        if (edges.isEmpty()) {
            builder.linear();
        } else {
            for (EdgeDefinition edge : edges) {
                builder.connect(edge.from(), edge.to(), edge.port());
            }
        }
        return builder.build();
    }

    /// Returns the schedule rule, if the definition has one.
    ///
    /// @return the rule, empty for unscheduled pipelines
    /// @throws io.pipewright.core.schedule.ScheduleConfigException if the
    ///         schedule entry is invalid
    public Optional<ScheduleRule> scheduleRule() {
        return Optional.ofNullable(schedule).map(ScheduleDefinition::toRule);
    }
}
