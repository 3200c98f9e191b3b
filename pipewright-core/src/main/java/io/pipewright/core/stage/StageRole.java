package io.pipewright.core.stage;

/// Role a stage plays in a pipeline.
///
/// The graph engine is agnostic to role except for {@link #SOURCE}: source stages
/// receive the external run input and may not have inbound edges. All other
/// roles are informational tags used for logging and definition files.
public enum StageRole {

    /// Produces items from an external system (e.g. harvesting sensor metadata).
    SOURCE,

    /// Groups items produced upstream.
    GROUPING,

    /// Derives additional data from source and group outputs.
    ENRICHMENT,

    /// Publishes results to a target catalog.
    REGISTRATION
}
