package ai.teliclens.flow;

import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphNode;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Flags variables whose names suggest they carry data across a trust boundary (database handles, credentials,
 * dynamic evaluation) and every edge touching them. The consistency checker then requires those edges to be
 * sanitized.
 */
public class TrustBoundaryMarker {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
            "database", "findUser", "query", "fetch", "exec", "eval", "password", "secret", "credential");

    private final List<String> keywords;

    public TrustBoundaryMarker() {
        this(DEFAULT_KEYWORDS);
    }

    public TrustBoundaryMarker(List<String> keywords) {
        this.keywords =
                keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).filter(k -> !k.isEmpty()).toList();
    }

    public boolean matches(String symbolName) {
        String lower = symbolName.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    public FlowGraph mark(FlowGraph graph) {
        var marked = new HashSet<String>();
        var nodes = graph.nodes().stream()
                .map(node -> {
                    var info = node.variableInfo();
                    if (info == null || !matches(info.symbolName())) {
                        return node;
                    }
                    marked.add(node.id());
                    return node.withVariableInfo(info.withTrustBoundary(true));
                })
                .toList();
        for (GraphNode node : graph.nodes()) {
            if (node.isTrustBoundary()) {
                marked.add(node.id());
            }
        }
        var edges = graph.edges().stream()
                .map(edge -> !edge.trustBoundary()
                                && (marked.contains(edge.source()) || marked.contains(edge.target()))
                        ? edge.withTrustBoundary(true)
                        : edge)
                .toList();
        return new FlowGraph(nodes, edges);
    }
}
