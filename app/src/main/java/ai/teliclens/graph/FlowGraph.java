package ai.teliclens.graph;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** A node list and an edge list taken together; the shape consumed by rendering and produced by clustering. */
public record FlowGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public static final FlowGraph EMPTY = new FlowGraph(List.of(), List.of());

    public FlowGraph {
        // either list may be absent in hand-written overlay JSON
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public Set<String> nodeIds() {
        return nodes.stream().map(GraphNode::id).collect(Collectors.toSet());
    }
}
