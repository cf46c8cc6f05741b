package ai.teliclens.flow;

import static java.util.Objects.requireNonNull;

import ai.teliclens.graph.EdgeType;
import ai.teliclens.graph.GraphEdge;

/**
 * Directed data flow between two canonical variable keys ({@code file:scope:name}). Endpoints are not required to
 * exist as nodes; dangling ones are reported by the consistency checker.
 */
public record FlowEdge(String from, String to, FlowEdgeKind kind, String reason, boolean trustBoundary) {

    public FlowEdge {
        requireNonNull(from, "from");
        requireNonNull(to, "to");
        requireNonNull(kind, "kind");
        requireNonNull(reason, "reason");
    }

    public FlowEdge(String from, String to, FlowEdgeKind kind, String reason) {
        this(from, to, kind, reason, false);
    }

    public GraphEdge toGraphEdge() {
        return new GraphEdge(
                CanonicalId.variable(from),
                CanonicalId.variable(to),
                EdgeType.FLOW,
                kind.wireName(),
                reason,
                trustBoundary);
    }
}
