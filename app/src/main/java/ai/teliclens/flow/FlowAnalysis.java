package ai.teliclens.flow;

import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import java.util.List;

/** Result of one analysis run: the variable graph and its consistency report. */
public record FlowAnalysis(FlowGraph graph, ConsistencyReport report) {

    public List<GraphNode> nodes() {
        return graph.nodes();
    }

    public List<GraphEdge> edges() {
        return graph.edges();
    }

    public FlowGraph atZoom(ZoomLevel level) {
        return GraphClusterer.cluster(graph, level);
    }

    public FlowGraph atZoom(int level) {
        return atZoom(ZoomLevel.of(level));
    }
}
