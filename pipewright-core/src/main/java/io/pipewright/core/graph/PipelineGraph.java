package io.pipewright.core.graph;

import io.pipewright.core.stage.Stage;
import io.pipewright.core.stage.StageRole;
import io.pipewright.core.stage.TypeDescriptor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/// Immutable, validated directed acyclic graph of pipeline stages.
///
/// A graph is a pure data structure: stage nodes in declaration order, the
/// edges wiring producer outputs to consumer input ports, and a cached
/// topological order reused by every run. Graphs are only obtainable through
/// {@link Builder#build()}, which validates the whole composition eagerly.
///
/// ### Validation
/// Checks run in this order and the first violation is raised as a
/// {@link GraphException}:
/// 1. at least one stage, no duplicate stage identifiers
/// 2. every edge references declared stages and a declared input port, no duplicate edges
/// 3. producer output type is accepted by the consumer port type
/// 4. no cycles (depth-first search with visiting/visited colouring)
/// 5. sources have no inbound edges and at most one port; each port has at
///    most one inbound edge; every port of a non-source stage is fed
///
/// Stage implementations are never invoked during validation.
///
/// @implNote Immutable and thread-safe after construction. All collections
/// are wrapped in unmodifiable views.
///
/// @see io.pipewright.core.execution.PipelineEngine for execution
public final class PipelineGraph {

    private final String pipelineId;
    private final Map<String, StageNode> nodes;
    private final List<Edge> edges;
    private final List<String> topologicalOrder;
    private final Map<String, List<Edge>> inbound;
    private final Map<String, List<Edge>> outbound;

    private PipelineGraph(
            String pipelineId,
            Map<String, StageNode> nodes,
            List<Edge> edges,
            Map<String, List<Edge>> inbound,
            Map<String, List<Edge>> outbound,
            List<String> topologicalOrder) {
        this.pipelineId = pipelineId;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = List.copyOf(edges);
        this.inbound = freeze(inbound);
        this.outbound = freeze(outbound);
        this.topologicalOrder = List.copyOf(topologicalOrder);
    }

    private static Map<String, List<Edge>> freeze(Map<String, List<Edge>> adjacency) {
        Map<String, List<Edge>> copy = new LinkedHashMap<>();
        adjacency.forEach((id, list) -> copy.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns the pipeline identifier.
    ///
    /// @return pipeline ID, never null
    public String getPipelineId() {
        return pipelineId;
    }

    /// Returns all stage nodes by identifier, in declaration order.
    ///
    /// @return unmodifiable map of stage ID to node, never null
    public Map<String, StageNode> getNodes() {
        return nodes;
    }

    /// Returns a stage node.
    ///
    /// @param stageId stage identifier, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if the stage is not part of this graph
    public StageNode getNode(String stageId) {
        StageNode node = nodes.get(stageId);
        if (node == null) {
            throw new IllegalArgumentException(
                    "Stage '" + stageId + "' not found in pipeline '" + pipelineId + "'");
        }
        return node;
    }

    /// Returns all edges in declaration order.
    ///
    /// @return unmodifiable edge list, never null
    public List<Edge> getEdges() {
        return edges;
    }

    /// Returns the cached topological order.
    ///
    /// Stable: among stages whose predecessors are all placed, the one declared
    /// first comes first.
    ///
    /// @return unmodifiable list of stage IDs, never null
    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    /// Returns the edges feeding a stage.
    ///
    /// @param stageId stage identifier, not null
    /// @return inbound edges, never null
    public List<Edge> predecessors(String stageId) {
        return inbound.getOrDefault(stageId, List.of());
    }

    /// Returns the edges leaving a stage.
    ///
    /// @param stageId stage identifier, not null
    /// @return outbound edges, never null
    public List<Edge> successors(String stageId) {
        return outbound.getOrDefault(stageId, List.of());
    }

    /// Returns every stage reachable from the given stage, excluding itself.
    ///
    /// @param stageId stage identifier, not null
    /// @return reachable stage IDs in breadth-first order, never null
    public Set<String> descendants(String stageId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(stageId);
        while (!queue.isEmpty()) {
            for (Edge edge : successors(queue.poll())) {
                if (seen.add(edge.to())) {
                    queue.add(edge.to());
                }
            }
        }
        return seen;
    }

    /// Returns the source stages, in declaration order.
    ///
    /// @return source nodes, never null
    public List<StageNode> sources() {
        return nodes.values().stream().filter(StageNode::isSource).toList();
    }

    /// Returns the stages without outbound edges, in declaration order.
    ///
    /// @return terminal nodes, never null
    public List<StageNode> terminals() {
        return nodes.values().stream().filter(n -> successors(n.getId()).isEmpty()).toList();
    }

    /// Creates a new graph builder.
    ///
    /// @param pipelineId pipeline identifier, not null
    /// @return new builder, never null
    public static Builder builder(String pipelineId) {
        return new Builder(pipelineId);
    }

    /// Builder collecting stages and edges before all-or-nothing validation.
    ///
    /// Builder methods only record declarations; all checks happen in
    /// {@link #build()} so that a rejected composition leaves nothing behind.
    public static final class Builder {
        private final String pipelineId;
        private final List<StageNode> declared = new ArrayList<>();
        private final List<PendingEdge> pendingEdges = new ArrayList<>();

        private Builder(String pipelineId) {
            this.pipelineId = Objects.requireNonNull(pipelineId, "Pipeline ID required");
        }

        /// Declares a stage.
        ///
        /// @param id stage identifier, not null or blank
        /// @param role stage role, not null
        /// @param stage implementation, not null
        /// @return this builder for chaining
        public Builder stage(String id, StageRole role, Stage stage) {
            declared.add(new StageNode(id, role, stage));
            return this;
        }

        /// Declares a pre-built stage node.
        ///
        /// @param node node, not null
        /// @return this builder for chaining
        public Builder stage(StageNode node) {
            declared.add(Objects.requireNonNull(node, "node"));
            return this;
        }

        /// Wires a producer to the only input port of a consumer.
        ///
        /// @param from producer stage ID, not null
        /// @param to consumer stage ID, not null
        /// @return this builder for chaining
        public Builder connect(String from, String to) {
            return connect(from, to, null);
        }

        /// Wires a producer to a named input port of a consumer.
        ///
        /// @param from producer stage ID, not null
        /// @param to consumer stage ID, not null
        /// @param port consumer port, may be null when the consumer has exactly one port
        /// @return this builder for chaining
        public Builder connect(String from, String to, String port) {
            pendingEdges.add(
                    new PendingEdge(
                            Objects.requireNonNull(from, "from"),
                            Objects.requireNonNull(to, "to"),
                            port));
            return this;
        }

        /// Chains the stages declared so far in listed order.
        ///
        /// Used when a pipeline definition omits its edges.
        ///
        /// @return this builder for chaining
        public Builder linear() {
            for (int i = 1; i < declared.size(); i++) {
                connect(declared.get(i - 1).getId(), declared.get(i).getId());
            }
            return this;
        }

        /// Validates the composition and builds the graph.
        ///
        /// @return validated graph, never null
        /// @throws GraphException naming the first violated invariant
        public PipelineGraph build() {
            Map<String, StageNode> nodes = indexNodes();
            List<Edge> edges = resolveEdges(nodes);
            checkTypes(nodes, edges);

            Map<String, List<Edge>> inbound = new LinkedHashMap<>();
            Map<String, List<Edge>> outbound = new LinkedHashMap<>();
            for (String id : nodes.keySet()) {
                inbound.put(id, new ArrayList<>());
                outbound.put(id, new ArrayList<>());
            }
            for (Edge edge : edges) {
                outbound.get(edge.from()).add(edge);
                inbound.get(edge.to()).add(edge);
            }

            detectCycles(nodes, outbound);
            checkCompleteness(nodes, inbound);
            List<String> order = topologicalSort(nodes, inbound, outbound);

            return new PipelineGraph(pipelineId, nodes, edges, inbound, outbound, order);
        }

        private Map<String, StageNode> indexNodes() {
            if (declared.isEmpty()) {
                throw new GraphException(
                        GraphViolation.EMPTY_GRAPH,
                        "Pipeline '" + pipelineId + "' declares no stage");
            }
            Map<String, StageNode> nodes = new LinkedHashMap<>();
            for (StageNode node : declared) {
                if (nodes.putIfAbsent(node.getId(), node) != null) {
                    throw new GraphException(
                            GraphViolation.DUPLICATE_NODE,
                            "Stage '" + node.getId() + "' is declared more than once");
                }
            }
            return nodes;
        }

        private List<Edge> resolveEdges(Map<String, StageNode> nodes) {
            List<Edge> edges = new ArrayList<>();
            Set<Edge> seen = new HashSet<>();
            for (PendingEdge pending : pendingEdges) {
                requireKnown(nodes, pending.from(), pending);
                StageNode consumer = requireKnown(nodes, pending.to(), pending);

                String port = pending.port();
                if (port == null) {
                    port = consumer.getSignature().soleInputPort();
                    if (port == null) {
                        throw new GraphException(
                                GraphViolation.UNKNOWN_PORT,
                                "Edge "
                                        + pending
                                        + " must name a port: stage '"
                                        + consumer.getId()
                                        + "' declares ports "
                                        + consumer.getSignature().getInputs().keySet());
                    }
                } else if (consumer.getSignature().getInput(port) == null) {
                    throw new GraphException(
                            GraphViolation.UNKNOWN_PORT,
                            "Stage '" + consumer.getId() + "' has no input port '" + port + "'");
                }

                Edge edge = new Edge(pending.from(), pending.to(), port);
                if (!seen.add(edge)) {
                    throw new GraphException(
                            GraphViolation.DUPLICATE_EDGE, "Edge " + edge + " declared twice");
                }
                edges.add(edge);
            }
            return edges;
        }

        private StageNode requireKnown(
                Map<String, StageNode> nodes, String stageId, PendingEdge pending) {
            StageNode node = nodes.get(stageId);
            if (node == null) {
                throw new GraphException(
                        GraphViolation.UNKNOWN_NODE,
                        "Edge " + pending + " references unknown stage '" + stageId + "'");
            }
            return node;
        }

        private void checkTypes(Map<String, StageNode> nodes, List<Edge> edges) {
            for (Edge edge : edges) {
                TypeDescriptor produced = nodes.get(edge.from()).getOutputType();
                TypeDescriptor expected = nodes.get(edge.to()).getSignature().getInput(edge.port());
                if (!expected.accepts(produced)) {
                    throw new GraphException(
                            GraphViolation.TYPE_MISMATCH,
                            "Edge "
                                    + edge
                                    + ": output "
                                    + produced.name()
                                    + " of '"
                                    + edge.from()
                                    + "' is not assignable to "
                                    + expected.name());
                }
            }
        }

        private void detectCycles(
                Map<String, StageNode> nodes, Map<String, List<Edge>> outbound) {
            Map<String, Colour> colours = new HashMap<>();
            Deque<String> path = new ArrayDeque<>();
            for (String id : nodes.keySet()) {
                if (colours.get(id) == null) {
                    visit(id, outbound, colours, path);
                }
            }
        }

        private void visit(
                String id,
                Map<String, List<Edge>> outbound,
                Map<String, Colour> colours,
                Deque<String> path) {
            colours.put(id, Colour.VISITING);
            path.addLast(id);
            for (Edge edge : outbound.get(id)) {
                Colour colour = colours.get(edge.to());
                if (colour == Colour.VISITING) {
                    throw new GraphException(
                            GraphViolation.CYCLE, "Cycle detected: " + describeCycle(path, edge));
                }
                if (colour == null) {
                    visit(edge.to(), outbound, colours, path);
                }
            }
            path.removeLast();
            colours.put(id, Colour.VISITED);
        }

        private static String describeCycle(Deque<String> path, Edge backEdge) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String id : path) {
                if (id.equals(backEdge.to())) {
                    inCycle = true;
                }
                if (inCycle) {
                    cycle.add(id);
                }
            }
            cycle.add(backEdge.to());
            return String.join(" -> ", cycle);
        }

        private void checkCompleteness(
                Map<String, StageNode> nodes, Map<String, List<Edge>> inbound) {
            for (StageNode node : nodes.values()) {
                List<Edge> feeding = inbound.get(node.getId());
                if (node.isSource()) {
                    if (!feeding.isEmpty()) {
                        throw new GraphException(
                                GraphViolation.INVALID_SOURCE,
                                "Source stage '"
                                        + node.getId()
                                        + "' must not have inbound edges but has "
                                        + feeding);
                    }
                    if (node.getSignature().isMultiInput()) {
                        throw new GraphException(
                                GraphViolation.INVALID_SOURCE,
                                "Source stage '"
                                        + node.getId()
                                        + "' declares ports "
                                        + node.getSignature().getInputs().keySet()
                                        + " but a source receives at most one external input");
                    }
                    continue;
                }

                if (feeding.isEmpty()) {
                    throw new GraphException(
                            GraphViolation.MISSING_INPUT,
                            "Stage '" + node.getId() + "' is not a source and has no inbound edge");
                }

                Map<String, Integer> perPort = new HashMap<>();
                for (Edge edge : feeding) {
                    if (perPort.merge(edge.port(), 1, Integer::sum) > 1) {
                        throw new GraphException(
                                GraphViolation.FAN_IN,
                                "Port '"
                                        + edge.port()
                                        + "' of stage '"
                                        + node.getId()
                                        + "' is fed by more than one edge; declare one port per"
                                        + " producer");
                    }
                }
                for (String port : node.getSignature().getInputs().keySet()) {
                    if (!perPort.containsKey(port)) {
                        throw new GraphException(
                                GraphViolation.MISSING_INPUT,
                                "Port '" + port + "' of stage '" + node.getId() + "' is not fed");
                    }
                }
            }
        }

        private List<String> topologicalSort(
                Map<String, StageNode> nodes,
                Map<String, List<Edge>> inbound,
                Map<String, List<Edge>> outbound) {
            List<String> ids = new ArrayList<>(nodes.keySet());
            Map<String, Integer> declarationIndex = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                declarationIndex.put(ids.get(i), i);
            }

            Map<String, Integer> remaining = new HashMap<>();
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (String id : ids) {
                int count = inbound.get(id).size();
                remaining.put(id, count);
                if (count == 0) {
                    ready.add(declarationIndex.get(id));
                }
            }

            List<String> order = new ArrayList<>(ids.size());
            while (!ready.isEmpty()) {
                String id = ids.get(ready.poll());
                order.add(id);
                for (Edge edge : outbound.get(id)) {
                    if (remaining.merge(edge.to(), -1, Integer::sum) == 0) {
                        ready.add(declarationIndex.get(edge.to()));
                    }
                }
            }
            return order;
        }
    }

    private enum Colour {
        VISITING,
        VISITED
    }

    private record PendingEdge(String from, String to, String port) {
        @Override
        public String toString() {
            return from + " -> " + to + (port != null ? "." + port : "");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipelineGraph graph)) return false;
        return pipelineId.equals(graph.pipelineId)
                && nodes.keySet().equals(graph.nodes.keySet())
                && edges.equals(graph.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pipelineId, nodes.keySet(), edges);
    }

    @Override
    public String toString() {
        return "PipelineGraph{id='" + pipelineId + "', stages=" + nodes.keySet() + "}";
    }
}
