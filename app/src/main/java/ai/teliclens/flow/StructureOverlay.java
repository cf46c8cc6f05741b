package ai.teliclens.flow;

import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Combines externally supplied structure (functions, files, data, intents) with extracted variables so that the
 * variables cluster under the supplied function nodes.
 */
public final class StructureOverlay {

    private StructureOverlay() {}

    /**
     * Re-parents each variable onto the first existing function whose label contains the variable's parent function,
     * then concatenates both lists keeping the first node for each ID.
     */
    public static List<GraphNode> mergeVariableNodes(List<GraphNode> existing, List<GraphNode> variables) {
        var functions =
                existing.stream().filter(n -> n.type() == NodeType.FUNCTION).toList();
        var merged = new LinkedHashMap<String, GraphNode>();
        for (var node : existing) {
            merged.putIfAbsent(node.id(), node);
        }
        for (var variable : variables) {
            var reparented = owningFunction(variable, functions)
                    .map(f -> variable.withClusterId(f.id()))
                    .orElse(variable);
            merged.putIfAbsent(reparented.id(), reparented);
        }
        return List.copyOf(merged.values());
    }

    /** Overlay nodes and edges first, then the extracted ones; duplicate edges are dropped. */
    public static FlowGraph merge(FlowGraph overlay, FlowGraph extracted) {
        var nodes = mergeVariableNodes(overlay.nodes(), extracted.nodes());
        var edges = new ArrayList<GraphEdge>(overlay.edges());
        for (var edge : extracted.edges()) {
            if (!edges.contains(edge)) {
                edges.add(edge);
            }
        }
        return new FlowGraph(nodes, edges);
    }

    private static Optional<GraphNode> owningFunction(GraphNode variable, List<GraphNode> functions) {
        var info = variable.variableInfo();
        if (info == null || info.parentFunction() == null) {
            return Optional.empty();
        }
        String parent = info.parentFunction();
        return functions.stream().filter(f -> f.label().contains(parent)).findFirst();
    }
}
