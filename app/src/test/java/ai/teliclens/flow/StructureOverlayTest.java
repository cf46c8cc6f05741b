package ai.teliclens.flow;

import static org.junit.jupiter.api.Assertions.*;

import ai.teliclens.graph.EdgeType;
import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import ai.teliclens.graph.VariableKind;
import java.util.List;
import org.junit.jupiter.api.Test;

public class StructureOverlayTest {

    private final GraphNode checkout = GraphNode.of("fn-1", "checkout()", NodeType.FUNCTION, null);
    private final GraphNode data = GraphNode.of("data-1", "checkout totals", NodeType.DATA, null);
    private final GraphNode cartItem =
            SymbolTable.toNode(VariableSymbol.def("item", "checkout", VariableKind.LOCAL, "c.ts", 2, null));
    private final GraphNode moduleSetting =
            SymbolTable.toNode(VariableSymbol.def("currency", "global", VariableKind.GLOBAL, "c.ts", 1, null));

    @Test
    void testVariablesAreReparentedOntoMatchingFunction() {
        var merged = StructureOverlay.mergeVariableNodes(List.of(data, checkout), List.of(cartItem, moduleSetting));

        assertEquals(4, merged.size());
        assertEquals("fn-1", merged.get(2).clusterId(), "Only function nodes are candidates");
        assertEquals("func:c.ts:global", merged.get(3).clusterId(), "Module-scope variables keep their cluster");
        assertEquals("func:c.ts:checkout", cartItem.clusterId(), "Inputs are not modified");
    }

    @Test
    void testDuplicateIdsKeepFirst() {
        var clash = GraphNode.of(cartItem.id(), "overlay copy", NodeType.DATA, null);

        var merged = StructureOverlay.mergeVariableNodes(List.of(clash), List.of(cartItem));

        assertEquals(List.of(clash), merged);
    }

    @Test
    void testMergeGraphsKeepsOverlayEdgesFirst() {
        var structural = new GraphEdge("fn-1", "data-1", EdgeType.DEPENDENCY, "writes", null, false);
        var variableFlow = new GraphEdge(moduleSetting.id(), cartItem.id(), EdgeType.FLOW, "assignment", "r", false);

        var merged = StructureOverlay.merge(
                new FlowGraph(List.of(checkout, data), List.of(structural)),
                new FlowGraph(List.of(cartItem, moduleSetting), List.of(variableFlow, variableFlow)));

        assertEquals(List.of(structural, variableFlow), merged.edges());
        assertEquals(4, merged.nodes().size());
    }
}
