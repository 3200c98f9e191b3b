package io.pipewright.core.graph;

import java.io.Serial;
import java.util.Objects;

/// Thrown when a pipeline composition violates a structural invariant.
///
/// Always fatal to graph construction: no partially built graph is ever
/// returned. The violated invariant is available via {@link #getViolation()}.
public class GraphException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1931270388374921547L;

    private final GraphViolation violation;

    public GraphException(GraphViolation violation, String message) {
        super(violation + ": " + message);
        this.violation = Objects.requireNonNull(violation, "violation must not be null");
    }

    /// Returns the violated invariant.
    ///
    /// @return violation, never null
    public GraphViolation getViolation() {
        return violation;
    }
}
