package io.pipewright.serialization.definition;

import java.io.Serial;

/// Thrown when a pipeline definition cannot be read or turned into a graph.
///
/// Covers unreadable files, malformed JSON or YAML, missing required fields,
/// unknown stage types and parameters rejected by a stage provider. Structural
/// graph errors are reported as {@link io.pipewright.core.graph.GraphException}.
public class PipelineDefinitionException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3385710946128320754L;

    public PipelineDefinitionException(String message) {
        super(message);
    }

    public PipelineDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
