package ai.teliclens.flow;

import static org.junit.jupiter.api.Assertions.*;

import ai.teliclens.analyzer.ParseFailure;
import ai.teliclens.analyzer.SourceFile;
import ai.teliclens.analyzer.TreeSitterSyntaxTreeProvider;
import ai.teliclens.graph.DataType;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.VariableKind;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class VariableExtractorTest {

    private static ExtractionResult extract(String fileName, String code) {
        return new VariableExtractor().extract(SourceFile.of(fileName, code));
    }

    private static Map<String, GraphNode> nodesById(ExtractionResult result) {
        return SymbolTable.of(result.variables()).toNodes().stream()
                .collect(Collectors.toMap(GraphNode::id, Function.identity()));
    }

    private static GraphNode node(Map<String, GraphNode> nodes, String id) {
        var node = nodes.get(id);
        assertNotNull(node, "Missing node " + id + ". Found: " + nodes.keySet());
        return node;
    }

    @Test
    void testParametersReturnAndAssignmentFlows() {
        var result = extract("a.ts", "function f(u,p){ const s=sanitize(u); const h=hash(p); return h; }");
        var nodes = nodesById(result);

        assertEquals(VariableKind.PARAMETER, node(nodes, "var:a.ts:f:u").variableInfo().kind());
        assertEquals(VariableKind.PARAMETER, node(nodes, "var:a.ts:f:p").variableInfo().kind());
        var returned = node(nodes, "var:a.ts:f:return_h").variableInfo();
        assertEquals(VariableKind.RETURN, returned.kind());
        assertTrue(returned.isUse());
        assertEquals("f", returned.parentFunction());

        assertTrue(
                result.flows().contains(new FlowEdge("a.ts:f:p", "a.ts:f:h", FlowEdgeKind.ASSIGNMENT, "p assigned to h")),
                "Expected p -> h, got " + result.flows());
        assertTrue(
                result.flows()
                        .contains(new FlowEdge("a.ts:f:h", "a.ts:f:return_h", FlowEdgeKind.RETURN, "h returned from f")),
                "Expected h -> return_h, got " + result.flows());
    }

    @Test
    void testBareIdentifierInitializerAndAssignment() {
        var result = extract(
                "b.ts",
                """
                function copy(source) {
                  const target = source;
                  let other = 0;
                  other = target;
                  return other;
                }
                """);

        assertTrue(result.flows()
                .contains(new FlowEdge(
                        "b.ts:copy:source", "b.ts:copy:target", FlowEdgeKind.ASSIGNMENT, "source assigned to target")));
        assertTrue(result.flows()
                .contains(new FlowEdge(
                        "b.ts:copy:target", "b.ts:copy:other", FlowEdgeKind.ASSIGNMENT, "target assigned to other")));
    }

    @Test
    void testShadowingProducesDistinctNodes() {
        var result = extract(
                "s.ts",
                """
                const x = 1;
                function g() {
                  const x = "inner";
                  return x;
                }
                """);
        var nodes = nodesById(result);

        var outer = node(nodes, "var:s.ts:global:x").variableInfo();
        var inner = node(nodes, "var:s.ts:g:x").variableInfo();
        assertEquals(VariableKind.GLOBAL, outer.kind());
        assertEquals(DataType.NUMBER, outer.dataType());
        assertEquals(VariableKind.LOCAL, inner.kind());
        assertEquals(DataType.STRING, inner.dataType());
        assertEquals("func:s.ts:global", node(nodes, "var:s.ts:global:x").clusterId());
        assertEquals("func:s.ts:g", node(nodes, "var:s.ts:g:x").clusterId());
    }

    @Test
    void testSelfAssignmentIsSelfLoop() {
        var result = extract("t.ts", "let a = 1;\na = a;\n");

        assertTrue(result.flows()
                .contains(new FlowEdge("t.ts:global:a", "t.ts:global:a", FlowEdgeKind.ASSIGNMENT, "a assigned to a")));
        assertEquals(1, nodesById(result).size());
    }

    @Test
    void testScopeNamesForAnonymousFunctionsArrowsAndMethods() {
        var result = extract(
                "n.ts",
                """
                const handler = function (req) { return req; };
                const cb = (v) => v;
                class Box {
                  open(lid) { return lid; }
                }
                """);
        var nodes = nodesById(result);

        assertEquals(VariableKind.PARAMETER, node(nodes, "var:n.ts:anonymous_1:req").variableInfo().kind());
        assertEquals(VariableKind.RETURN, node(nodes, "var:n.ts:anonymous_1:return_req").variableInfo().kind());
        assertEquals(VariableKind.PARAMETER, node(nodes, "var:n.ts:arrow_2:v").variableInfo().kind());
        assertEquals(VariableKind.PARAMETER, node(nodes, "var:n.ts:open:lid").variableInfo().kind());
        assertEquals(DataType.FUNCTION, node(nodes, "var:n.ts:global:handler").variableInfo().dataType());
        assertFalse(nodes.containsKey("var:n.ts:global:Box"), "Class names are not variable uses");
    }

    @Test
    void testDeclaredFunctionNameIsNotAUse() {
        var nodes = nodesById(extract("d.js", "function helper(x) { return x; }\n"));

        assertFalse(nodes.containsKey("var:d.js:global:helper"));
        assertFalse(nodes.containsKey("var:d.js:helper:helper"));
        assertTrue(nodes.containsKey("var:d.js:helper:x"));
    }

    @Test
    void testDataTypeInference() {
        var result = extract(
                "types.ts",
                """
                const name = "x";
                const count = 42;
                const flag = true;
                const list = [1, 2];
                const bag = { a: 1 };
                const fn = () => 1;
                const made = Array(3);
                const other = compute();
                let later;
                """);
        var nodes = nodesById(result);

        assertEquals(DataType.STRING, node(nodes, "var:types.ts:global:name").variableInfo().dataType());
        assertEquals(DataType.NUMBER, node(nodes, "var:types.ts:global:count").variableInfo().dataType());
        assertEquals(DataType.BOOLEAN, node(nodes, "var:types.ts:global:flag").variableInfo().dataType());
        assertEquals(DataType.ARRAY, node(nodes, "var:types.ts:global:list").variableInfo().dataType());
        assertEquals(DataType.OBJECT, node(nodes, "var:types.ts:global:bag").variableInfo().dataType());
        assertEquals(DataType.FUNCTION, node(nodes, "var:types.ts:global:fn").variableInfo().dataType());
        assertEquals(DataType.ARRAY, node(nodes, "var:types.ts:global:made").variableInfo().dataType());
        assertEquals(DataType.UNKNOWN, node(nodes, "var:types.ts:global:other").variableInfo().dataType());
        assertNull(node(nodes, "var:types.ts:global:later").variableInfo().dataType());
    }

    @Test
    void testShorthandPropertyIsAUse() {
        var result = extract("o.ts", "function wrap(userId) { return { userId }; }\n");

        assertTrue(
                result.variables().stream()
                        .anyMatch(v -> v.name().equals("userId") && v.isUse() && v.scope().equals("wrap")),
                "Shorthand property should count as a use: " + result.variables());
        assertFalse(result.variables().stream().anyMatch(v -> v.kind() == VariableKind.RETURN));
    }

    @Test
    void testImportBindingsAreGlobalDefinitions() {
        var result = extract(
                "i.ts",
                """
                import { a as b, c } from './m';
                import d from './d';
                import * as ns from './ns';
                """);
        var nodes = nodesById(result);

        for (var name : new String[] {"b", "c", "d", "ns"}) {
            var info = node(nodes, "var:i.ts:global:" + name).variableInfo();
            assertEquals(VariableKind.GLOBAL, info.kind());
            assertTrue(info.isDef());
            assertFalse(info.isUse());
        }
        assertFalse(nodes.containsKey("var:i.ts:global:a"), "Imported name behind an alias is not bound locally");
    }

    @Test
    void testForOfBindingAndClassField() {
        var result = extract(
                "f.ts",
                """
                class Repo {
                  private table = "users";
                }
                function each(items) {
                  for (const item of items) {
                    consume(item);
                  }
                }
                """);
        var nodes = nodesById(result);

        var field = node(nodes, "var:f.ts:Repo:table").variableInfo();
        assertEquals(VariableKind.FIELD, field.kind());
        assertEquals(DataType.STRING, field.dataType());
        var item = node(nodes, "var:f.ts:each:item").variableInfo();
        assertEquals(VariableKind.LOCAL, item.kind());
        assertTrue(item.isDef());
        assertTrue(item.isUse());
    }

    @Test
    void testCallArgumentEdgesAreOptIn() {
        var code = "function lookup(username) { return database.findUser(username); }\n";
        var expected = new FlowEdge(
                "c.ts:lookup:username",
                "c.ts:lookup:database",
                FlowEdgeKind.PARAMETER_ARGUMENT,
                "username passed to database.findUser");

        var plain = extract("c.ts", code);
        assertFalse(plain.flows().stream().anyMatch(f -> f.kind() == FlowEdgeKind.PARAMETER_ARGUMENT));

        var withCalls = new VariableExtractor(new TreeSitterSyntaxTreeProvider(), true)
                .extract(SourceFile.of("c.ts", code));
        assertTrue(withCalls.flows().contains(expected), "Got " + withCalls.flows());
    }

    @Test
    void testExtractionIsDeterministic() {
        var code = """
                function f(u, p) {
                  const s = sanitize(u);
                  const h = hash(p);
                  return h;
                }
                """;
        assertEquals(extract("a.ts", code), extract("a.ts", code));
    }

    @Test
    void testUnsupportedLanguageYieldsEmptyResult() {
        var file = SourceFile.of("notes.txt", "const a = 1;");
        var outcome = new TreeSitterSyntaxTreeProvider().parse(file);

        assertInstanceOf(ParseFailure.class, outcome);
        assertTrue(new VariableExtractor().extract(file).isEmpty());
    }

    @Test
    void testStrictParsingRejectsSyntaxErrors() {
        var file = SourceFile.of("broken.ts", "function ( { const = ;");
        var strict = new VariableExtractor(new TreeSitterSyntaxTreeProvider(true), false);

        assertSame(ExtractionResult.EMPTY, strict.extract(file));
    }

    @Test
    void testLanguageHintOverridesExtension() {
        var file = new SourceFile("snippet", "const total = price;", "javascript");
        var result = new VariableExtractor().extract(file);

        assertTrue(result.flows()
                .contains(new FlowEdge(
                        "snippet:global:price",
                        "snippet:global:total",
                        FlowEdgeKind.ASSIGNMENT,
                        "price assigned to total")));
    }
}
