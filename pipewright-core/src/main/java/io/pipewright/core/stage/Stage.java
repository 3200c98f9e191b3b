package io.pipewright.core.stage;

/// Minimal capability every pipeline stage exposes.
///
/// A stage accepts the values wired to its input ports and produces one output
/// or a declared {@link StageFailure}. The pipeline graph only ever inspects
/// {@link #signature()} and never calls {@link #run} during validation, so
/// signatures must be side-effect free. Side effects (network calls, file
/// writes) belong inside {@link #run}.
///
/// ### Roles
/// Source, grouping, enrichment and registration stages all implement this one
/// interface. Role-specific wiring, such as enrichment consuming both source
/// and grouping outputs, is expressed through multiple input ports in the
/// signature rather than through subclassing.
///
/// ### Incremental execution
/// A stage may consult its own previous output via
/// {@link StageContext#previousState()} to emit only new or changed items.
///
/// @implNote Implementations must be thread-safe if the same instance is bound
/// into more than one pipeline. The engine never invokes the same node twice
/// concurrently within one run.
///
/// @see TypedStage for single-input stages
/// @see io.pipewright.core.graph.PipelineGraph for composition checks
@FunctionalInterface
public interface Stage {

    /// Runs the stage.
    ///
    /// @param input values on the declared input ports, not null
    /// @param context run identity, prior state and stop control, not null
    /// @return the output, an instance of the declared output type, may be null
    /// @throws StageFailure on a declared transient or permanent failure
    Object run(StageInput input, StageContext context) throws StageFailure;

    /// Returns the declared input/output signature.
    ///
    /// Defaults to a single untyped port producing an untyped output.
    ///
    /// @return signature, never null
    default StageSignature signature() {
        return StageSignature.of(Object.class, Object.class);
    }
}
