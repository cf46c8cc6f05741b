package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural difference between an expected graph and an actual one. Nodes are compared by ID and edges by their
 * ordered endpoint pair; labels and flags are ignored.
 */
public record GraphDiff(
        List<String> missingNodes,
        List<String> extraNodes,
        List<String> missingEdges,
        List<String> extraEdges,
        String summary) {

    public static GraphDiff between(FlowGraph expected, FlowGraph actual) {
        var expectedNodeIds = expected.nodeIds();
        var actualNodeIds = actual.nodeIds();
        var expectedEdgeKeys = edgeKeys(expected);
        var actualEdgeKeys = edgeKeys(actual);

        var missingNodes = expected.nodes().stream()
                .map(GraphNode::id)
                .filter(id -> !actualNodeIds.contains(id))
                .toList();
        var extraNodes = actual.nodes().stream()
                .map(GraphNode::id)
                .filter(id -> !expectedNodeIds.contains(id))
                .toList();
        var missingEdges =
                expectedEdgeKeys.stream().filter(k -> !actualEdgeKeys.contains(k)).toList();
        var extraEdges =
                actualEdgeKeys.stream().filter(k -> !expectedEdgeKeys.contains(k)).toList();

        return new GraphDiff(
                missingNodes,
                extraNodes,
                missingEdges,
                extraEdges,
                summarize(missingNodes, extraNodes, missingEdges, extraEdges));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return missingNodes.isEmpty() && extraNodes.isEmpty() && missingEdges.isEmpty() && extraEdges.isEmpty();
    }

    private static Set<String> edgeKeys(FlowGraph graph) {
        return graph.edges().stream().map(GraphEdge::key).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static String summarize(
            List<String> missingNodes, List<String> extraNodes, List<String> missingEdges, List<String> extraEdges) {
        int total = missingNodes.size() + extraNodes.size() + missingEdges.size() + extraEdges.size();
        if (total == 0) {
            return "Graphs match";
        }
        var lines = new ArrayList<String>();
        lines.add("Found " + total + " differences:");
        appendCount(lines, missingNodes, "missing nodes");
        appendCount(lines, extraNodes, "extra nodes");
        appendCount(lines, missingEdges, "missing edges");
        appendCount(lines, extraEdges, "extra edges");
        return String.join("\n", lines);
    }

    private static void appendCount(List<String> lines, List<String> items, String category) {
        if (!items.isEmpty()) {
            lines.add("  - " + items.size() + " " + category);
        }
    }
}
