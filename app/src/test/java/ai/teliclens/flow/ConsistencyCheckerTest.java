package ai.teliclens.flow;

import static org.junit.jupiter.api.Assertions.*;

import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.graph.EdgeType;
import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import ai.teliclens.graph.VariableKind;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    private static GraphNode node(VariableSymbol symbol) {
        return SymbolTable.toNode(symbol);
    }

    private static GraphNode defAndUse(String name, String scope, VariableKind kind) {
        return node(new VariableSymbol(name, scope, kind, "c.ts", 1, true, true, scope, null));
    }

    private static GraphNode trustBoundary(GraphNode node) {
        return node.withVariableInfo(node.variableInfo().withTrustBoundary(true));
    }

    private static GraphEdge flow(String from, String to, String reason) {
        return new GraphEdge(from, to, EdgeType.FLOW, "assignment", reason, false);
    }

    @Test
    void testUnusedDeclarationIsOrphanDefinition() {
        var extraction = new VariableExtractor()
                .extract(SourceFile.of(
                        "b.ts",
                        """
                        function login(password) {
                          const sanitizedPassword = sanitize(password);
                          return password;
                        }
                        """));
        var nodes = SymbolTable.of(extraction.variables()).toNodes();
        var edges = extraction.flows().stream().map(FlowEdge::toGraphEdge).toList();

        var report = checker.check(nodes, edges);

        assertTrue(
                report.orphanDefs().contains("var:b.ts:login:sanitizedPassword (sanitizedPassword in login)"),
                "Got " + report.orphanDefs());
        assertFalse(report.orphanDefs().stream().anyMatch(e -> e.startsWith("var:b.ts:login:password ")));
    }

    @Test
    void testUnsanitizedFlowIntoTrustBoundaryIsViolation() {
        var username = defAndUse("username", "auth", VariableKind.PARAMETER);
        var database = trustBoundary(node(VariableSymbol.use("database", "auth", "c.ts", 2)));
        var raw = flow(username.id(), database.id(), "username passed to database.findUser");

        var report = checker.check(List.of(username, database), List.of(raw));

        assertEquals(
                List.of("var:c.ts:auth:username → var:c.ts:auth:database (crosses trust boundary without sanitization)"),
                report.trustBoundaryViolations());
    }

    @Test
    void testSanitizedFlowIntoTrustBoundaryIsAccepted() {
        var username = defAndUse("username", "auth", VariableKind.PARAMETER);
        var database = trustBoundary(node(VariableSymbol.use("database", "auth", "c.ts", 2)));

        for (var reason : List.of("sanitize before lookup", "SANITIZED input", "Encrypted", "validate(username)")) {
            var report = checker.check(List.of(username, database), List.of(flow(username.id(), database.id(), reason)));
            assertTrue(report.trustBoundaryViolations().isEmpty(), reason);
        }
    }

    @Test
    void testFlaggedEdgeIsCheckedEvenBetweenUnflaggedNodes() {
        var a = defAndUse("alpha", "f", VariableKind.LOCAL);
        var b = defAndUse("beta", "f", VariableKind.LOCAL);
        var flagged = new GraphEdge(a.id(), b.id(), EdgeType.FLOW, "assignment", "alpha assigned to beta", true);

        var report = checker.check(List.of(a, b), List.of(flagged));

        assertEquals(1, report.trustBoundaryViolations().size());
    }

    @Test
    void testOrphanUseFallsBackToAnySameNamedDefinition() {
        var use = node(VariableSymbol.use("config", "handler", "c.ts", 4));
        var unrelatedDef = node(VariableSymbol.def("config", "global", VariableKind.GLOBAL, "other.ts", 1, null));

        var alone = checker.check(List.of(use), List.of());
        var withDef = checker.check(List.of(use, unrelatedDef), List.of());

        assertEquals(List.of("var:c.ts:handler:config (config in handler)"), alone.orphanUses());
        assertTrue(withDef.orphanUses().isEmpty());
    }

    @Test
    void testUseWithIncomingEdgeIsNotOrphan() {
        var source = defAndUse("source", "f", VariableKind.LOCAL);
        var use = node(VariableSymbol.use("target", "f", "c.ts", 3));

        var report = checker.check(List.of(source, use), List.of(flow(source.id(), use.id(), "r")));

        assertTrue(report.orphanUses().isEmpty());
    }

    @Test
    void testUnreachableFlows() {
        var def = node(VariableSymbol.def("value", "f", VariableKind.LOCAL, "c.ts", 1, null));
        var reached = node(VariableSymbol.use("value", "g", "c.ts", 5));
        var stranded = node(VariableSymbol.use("value", "h", "c.ts", 8));
        var parameterUse = node(new VariableSymbol("arg", "h", VariableKind.PARAMETER, "c.ts", 8, false, true, "h", null));

        var report = checker.check(
                List.of(def, reached, stranded, parameterUse), List.of(flow(def.id(), reached.id(), "value passed")));

        assertEquals(List.of("var:c.ts:h:value (value at c.ts:8)"), report.unreachableFlows());
    }

    @Test
    void testNodeThatIsBothDefinitionAndUseReachesItself() {
        var report = checker.check(List.of(defAndUse("count", "f", VariableKind.LOCAL)), List.of());

        assertTrue(report.unreachableFlows().isEmpty());
        assertTrue(report.isClean());
    }

    @Test
    void testSelfAssignmentLoopIsConsistent() {
        var extraction = new VariableExtractor()
                .extract(SourceFile.of(
                        "loop.ts",
                        """
                        function tick() {
                          let counter = 0;
                          counter = counter;
                        }
                        """));
        var nodes = SymbolTable.of(extraction.variables()).toNodes();
        var edges = extraction.flows().stream().map(FlowEdge::toGraphEdge).toList();
        var id = "var:loop.ts:tick:counter";
        assertTrue(edges.stream().anyMatch(e -> e.source().equals(id) && e.target().equals(id)), "Got " + edges);

        var report = checker.check(nodes, edges);

        assertTrue(report.orphanDefs().stream().noneMatch(e -> e.startsWith(id + " ")), "Got " + report.orphanDefs());
        assertTrue(report.unreachableFlows().stream().noneMatch(e -> e.startsWith(id + " ")));
        assertTrue(report.missingNodes().isEmpty());
    }

    @Test
    void testSelfLoopOnUseOnlyNodeCountsAsIncoming() {
        var use = node(VariableSymbol.use("cursor", "walk", "c.ts", 4));

        var report = checker.check(List.of(use), List.of(flow(use.id(), use.id(), "cursor assigned to cursor")));

        assertTrue(report.orphanUses().isEmpty());
        assertEquals(List.of("var:c.ts:walk:cursor (cursor at c.ts:4)"), report.unreachableFlows());
    }

    @Test
    void testDanglingEndpointsAreMissingNodes() {
        var present = defAndUse("present", "f", VariableKind.LOCAL);
        var edges = List.of(flow(present.id(), "var:c.ts:f:gone", "r"), flow("var:x", "var:y", "r"));

        var report = checker.check(List.of(present), edges);

        assertEquals(
                List.of(
                        "var:c.ts:f:gone (referenced in edge but missing node)",
                        "var:x (referenced in edge but missing node)",
                        "var:y (referenced in edge but missing node)"),
                report.missingNodes());
    }

    @Test
    void testStructuralNodesAndIntentEdgesAreIgnoredByVariableChecks() {
        var def = node(VariableSymbol.def("unused", "f", VariableKind.LOCAL, "c.ts", 1, null));
        var intent = GraphNode.of("intent-1", "Protect users", NodeType.INTENT, null);
        var serves = new GraphEdge(def.id(), intent.id(), EdgeType.SERVES_INTENT, null, null, false);

        var report = checker.check(List.of(def, intent), List.of(serves));

        assertEquals(List.of("var:c.ts:f:unused (unused in f)"), report.orphanDefs());
        assertTrue(report.missingNodes().isEmpty());
    }

    @Test
    void testSummary() {
        assertEquals(
                "All 0 variables are consistent. No data flow issues detected.",
                checker.check(List.of(), List.of()).summary());

        var def = node(VariableSymbol.def("unused", "f", VariableKind.LOCAL, "c.ts", 1, null));
        var report = checker.check(List.of(def), List.of(flow("var:a", "var:b", "r")));

        assertEquals(3, report.issueCount());
        assertEquals("Found 3 consistency issues across 1 variables:\n  - 1 orphan definitions\n  - 2 missing nodes",
                report.summary());
    }
}
