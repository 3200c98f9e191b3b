package io.pipewright.core.graph;

import java.util.Objects;

/// Directed connection from a producing stage to one input port of a consuming stage.
///
/// @param from producer stage identifier, not null
/// @param to consumer stage identifier, not null
/// @param port consumer input port receiving the producer's output, not null
public record Edge(String from, String to, String port) {

    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(port, "port must not be null");
    }

    @Override
    public String toString() {
        return from + " -> " + to + "." + port;
    }
}
