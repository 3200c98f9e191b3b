package io.pipewright.core.graph;

/// Structural invariant violated by a rejected pipeline composition.
///
/// @see GraphException
public enum GraphViolation {

    /// The graph declares no stage.
    EMPTY_GRAPH,

    /// Two stages share the same identifier.
    DUPLICATE_NODE,

    /// An edge references a stage that is not declared.
    UNKNOWN_NODE,

    /// An edge targets an input port the consumer does not declare, or omits the
    /// port for a consumer with several ports.
    UNKNOWN_PORT,

    /// The same producer is wired to the same consumer port twice.
    DUPLICATE_EDGE,

    /// The producer's output type is not assignable to the consumer port's type.
    TYPE_MISMATCH,

    /// The edges form a cycle.
    CYCLE,

    /// A source stage has an inbound edge.
    INVALID_SOURCE,

    /// More than one edge feeds the same input port.
    FAN_IN,

    /// A non-source stage has an input port without an inbound edge.
    MISSING_INPUT
}
