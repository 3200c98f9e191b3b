package io.pipewright.serialization.definition;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.pipewright.core.graph.PipelineGraph;
import io.pipewright.core.schedule.ScheduleConfigException;
import io.pipewright.core.stage.spi.StageRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/// Reads pipeline definitions from JSON or YAML.
///
/// The format follows the file extension: `.json`, or `.yaml` / `.yml`.
///
/// ### Document Shape
/// ```yaml
/// id: sensor-catalog
/// stages:
///   - id: harvest
///     type: frost-harvester
///     role: source
///     params:
///       endpoint: https://frost.example.org/v1.1
///   - id: register
///     type: ckan-registration
///     role: registration
/// edges:                 # optional, defaults to a linear chain
///   - from: harvest
///     to: register
/// schedule:              # optional, exactly one of interval / cron
///   interval: PT15M
/// ```
///
/// Unknown fields are rejected so that typos surface at load time. Roles are
/// matched case-insensitively.
///
/// @implNote Thread-safe. The mappers are created once and never reconfigured.
public class PipelineDefinitionLoader {

    private static final Logger logger =
            Logger.getLogger(PipelineDefinitionLoader.class.getName());

    /// Definition file format.
    public enum Format {
        JSON,
        YAML;

        /// Detects the format from a file name.
        ///
        /// @param file definition file, not null
        /// @return the format, never null
        /// @throws PipelineDefinitionException if the extension is not recognised
        public static Format of(Path file) {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.endsWith(".json")) {
                return JSON;
            }
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                return YAML;
            }
            throw new PipelineDefinitionException(
                    "Unsupported definition file '" + file + "': expected .json, .yaml or .yml");
        }
    }

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public PipelineDefinitionLoader() {
        this.jsonMapper =
                JsonMapper.builder()
                        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .build();
        this.yamlMapper =
                YAMLMapper.builder()
                        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                        .build();
    }

    /// Reads and validates a definition file.
    ///
    /// @param file JSON or YAML file, not null
    /// @return the definition, never null
    /// @throws PipelineDefinitionException if the file cannot be read or is invalid
    public PipelineDefinition load(Path file) {
        Format format = Format.of(file);
        logger.fine("Loading pipeline definition from " + file);
        try (InputStream in = Files.newInputStream(file)) {
            return validate(mapper(format).readValue(in, PipelineDefinition.class), file);
        } catch (IOException e) {
            throw new PipelineDefinitionException(
                    "Cannot read pipeline definition " + file + ": " + e.getMessage(), e);
        }
    }

    /// Parses and validates a definition held in memory.
    ///
    /// @param content document text, not null
    /// @param format document format, not null
    /// @return the definition, never null
    /// @throws PipelineDefinitionException if the document is invalid
    public PipelineDefinition parse(String content, Format format) {
        try {
            return validate(
                    mapper(format).readValue(content, PipelineDefinition.class), "<inline>");
        } catch (IOException e) {
            throw new PipelineDefinitionException(
                    "Cannot parse pipeline definition: " + e.getMessage(), e);
        }
    }

    /// Reads a definition file and builds its graph.
    ///
    /// @param file JSON or YAML file, not null
    /// @param registry providers for the stage types used, not null
    /// @return validated graph, never null
    /// @throws PipelineDefinitionException if the definition is invalid
    /// @throws io.pipewright.core.graph.GraphException if the graph is invalid
    public PipelineGraph loadGraph(Path file, StageRegistry registry) {
        PipelineGraph graph = load(file).toGraph(registry);
        logger.info(
                "Loaded pipeline '"
                        + graph.getPipelineId()
                        + "' with "
                        + graph.getNodes().size()
                        + " stages from "
                        + file);
        return graph;
    }

    private ObjectMapper mapper(Format format) {
        return format == Format.JSON ? jsonMapper : yamlMapper;
    }

    private static PipelineDefinition validate(PipelineDefinition definition, Object source) {
        if (definition == null) {
            throw new PipelineDefinitionException("Pipeline definition " + source + " is empty");
        }
        if (definition.id() == null || definition.id().isBlank()) {
            throw new PipelineDefinitionException(
                    "Pipeline definition " + source + " is missing 'id'");
        }
        if (definition.stages().isEmpty()) {
            throw new PipelineDefinitionException(
                    "Pipeline '" + definition.id() + "' declares no stages");
        }
        for (EdgeDefinition edge : definition.edges()) {
            if (edge.from() == null || edge.to() == null) {
                throw new PipelineDefinitionException(
                        "Edge of pipeline '" + definition.id() + "' needs 'from' and 'to'");
            }
        }
        if (definition.schedule() != null) {
            try {
                definition.scheduleRule();
            } catch (ScheduleConfigException e) {
                throw new PipelineDefinitionException(
                        "Invalid schedule of pipeline '" + definition.id() + "': "
                                + e.getMessage(),
                        e);
            }
        }
        return definition;
    }
}
