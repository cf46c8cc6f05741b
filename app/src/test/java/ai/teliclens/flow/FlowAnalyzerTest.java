package ai.teliclens.flow;

import static org.junit.jupiter.api.Assertions.*;

import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.graph.DataType;
import ai.teliclens.graph.EdgeType;
import ai.teliclens.graph.FlowGraph;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import ai.teliclens.graph.VariableKind;
import ai.teliclens.util.AnalysisSettings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class FlowAnalyzerTest {

    private static final Path FIXTURES = Path.of("src/test/resources/testcode-ts");

    private static SourceFile safeAuth;
    private static SourceFile vulnerableAuth;
    private static SourceFile cart;

    @BeforeAll
    static void loadFixtures() throws IOException {
        assertTrue(Files.isDirectory(FIXTURES), "Test resource directory 'testcode-ts' must exist.");
        safeAuth = fixture("safe-auth.ts");
        vulnerableAuth = fixture("vulnerable-auth.ts");
        cart = fixture("cart.js");
    }

    private static SourceFile fixture(String name) throws IOException {
        return SourceFile.of(name, Files.readString(FIXTURES.resolve(name)));
    }

    private static Map<String, GraphNode> byId(List<GraphNode> nodes) {
        return nodes.stream().collect(Collectors.toMap(GraphNode::id, Function.identity()));
    }

    private static FlowAnalyzer withCallEdges() {
        return new FlowAnalyzer(AnalysisSettings.defaults().withCallArgumentEdges(true));
    }

    @Test
    void testVulnerableFixtureReportsDeadSanitizationAndRawQuery() {
        var analysis = withCallEdges().analyze(List.of(vulnerableAuth));
        var report = analysis.report();

        assertTrue(
                report.orphanDefs()
                        .contains("var:vulnerable-auth.ts:authenticateUser:sanitizedPassword "
                                + "(sanitizedPassword in authenticateUser)"),
                "Got " + report.orphanDefs());
        assertTrue(
                report.trustBoundaryViolations()
                        .contains("var:vulnerable-auth.ts:authenticateUser:username → "
                                + "var:vulnerable-auth.ts:authenticateUser:database "
                                + "(crosses trust boundary without sanitization)"),
                "Got " + report.trustBoundaryViolations());
        assertFalse(report.isClean());
    }

    @Test
    void testSafeFixtureQueriesOnlySanitizedInput() {
        var report = withCallEdges().analyze(List.of(safeAuth)).report();

        assertTrue(
                report.trustBoundaryViolations().stream().noneMatch(v -> v.contains("authenticateUser:database ")),
                "Got " + report.trustBoundaryViolations());
        assertTrue(
                report.orphanDefs().stream().noneMatch(v -> v.contains("sanitizedUsername")),
                "Got " + report.orphanDefs());
    }

    @Test
    void testSensitiveParameterStaysTraceableToNetworkSink() {
        var graph = new FlowAnalyzer().analyze(List.of(vulnerableAuth)).atZoom(ZoomLevel.VARIABLE);

        var sinkEdge = graph.edges().stream()
                .filter(e -> e.source().equals("var:vulnerable-auth.ts:authenticateUser:username")
                        && e.target().equals("var:vulnerable-auth.ts:authenticateUser:sendToAnalytics"))
                .findFirst();
        assertTrue(sinkEdge.isPresent(), "Got " + graph.edges());
        assertEquals(EdgeType.FLOW, sinkEdge.get().type());
        assertEquals("username passed to sendToAnalytics", sinkEdge.get().reason());
        assertTrue(graph.nodeIds().contains("var:vulnerable-auth.ts:authenticateUser:sendToAnalytics"));
    }

    @Test
    void testCallArgumentEdgesCanBeTurnedOff() {
        var settings = AnalysisSettings.defaults().withCallArgumentEdges(false);

        var graph = new FlowAnalyzer(settings).analyze(List.of(vulnerableAuth)).atZoom(ZoomLevel.VARIABLE);

        assertTrue(graph.edges().stream().noneMatch(e -> "parameter-argument".equals(e.label())), "Got " + graph.edges());
    }

    @Test
    void testJavaScriptFixture() {
        var nodes = byId(new FlowAnalyzer().analyze(List.of(cart)).nodes());

        assertEquals(VariableKind.PARAMETER, nodes.get("var:cart.js:total:discount").variableInfo().kind());
        assertEquals(VariableKind.PARAMETER, nodes.get("var:cart.js:arrow_12:amount").variableInfo().kind());
        assertEquals(DataType.FUNCTION, nodes.get("var:cart.js:global:format").variableInfo().dataType());
        assertEquals(DataType.NUMBER, nodes.get("var:cart.js:global:TAX_RATE").variableInfo().dataType());
        assertTrue(nodes.get("var:cart.js:total:item").variableInfo().isDef());
    }

    @Test
    void testNoiseFilterCanBeDisabled() {
        var code = SourceFile.of("loop.ts", "function run(n) { for (let i = 0; i < n; i++) { } }");

        var filtered = byId(new FlowAnalyzer().analyze(List.of(code)).nodes());
        var unfiltered = byId(new FlowAnalyzer(AnalysisSettings.defaults().withFilterEnabled(false))
                .analyze(List.of(code))
                .nodes());

        assertFalse(filtered.containsKey("var:loop.ts:run:i"));
        assertTrue(unfiltered.containsKey("var:loop.ts:run:i"));
    }

    @Test
    void testParallelExtractionMatchesSequential() {
        var files = List.of(safeAuth, vulnerableAuth, cart);

        var sequential = withCallEdges().analyze(files);
        var parallel = new FlowAnalyzer(AnalysisSettings.defaults()
                        .withCallArgumentEdges(true)
                        .withParallelism(3))
                .analyze(files);

        assertEquals(sequential, parallel);
    }

    @Test
    void testUnparseableFileDoesNotAbortRun() {
        var files = List.of(SourceFile.of("README.md", "# not code"), cart);

        var analysis = new FlowAnalyzer().analyze(files);

        assertFalse(analysis.nodes().isEmpty());
        assertTrue(analysis.nodes().stream().allMatch(n -> "cart.js".equals(n.locationFile())));
    }

    @Test
    void testOverlayFunctionsOwnVariables() {
        var overlay = new FlowGraph(
                List.of(
                        GraphNode.of("fn-auth", "authenticateUser(username, password)", NodeType.FUNCTION, null),
                        GraphNode.of("intent-login", "Authenticate users", NodeType.INTENT, null)),
                List.of());

        var analysis = new FlowAnalyzer().analyze(List.of(safeAuth), overlay);
        var nodes = byId(analysis.nodes());

        assertEquals("fn-auth", nodes.get("var:safe-auth.ts:authenticateUser:username").clusterId());
        assertEquals("func:safe-auth.ts:generateToken", nodes.get("var:safe-auth.ts:generateToken:userId").clusterId());

        var functions = byId(analysis.atZoom(ZoomLevel.FUNCTION).nodes());
        var auth = functions.get("fn-auth");
        assertTrue(auth.memberCount() > 0);
        assertTrue(auth.description().endsWith("variables]"), auth.description());
    }

    @Test
    void testZoomLevelsCoarsenFixtureGraph() {
        var analysis = withCallEdges().analyze(List.of(safeAuth, vulnerableAuth, cart));

        int previous = Integer.MAX_VALUE;
        for (var level : ZoomLevel.values()) {
            int count = analysis.atZoom(level).nodes().size();
            assertTrue(count <= previous, level + ": " + count);
            previous = count;
        }
        assertEquals(3, analysis.atZoom(ZoomLevel.FILE).nodes().size(), "One node per file");
        assertTrue(analysis.atZoom(ZoomLevel.INTENT).nodes().isEmpty());
    }
}
