package ai.teliclens.flow;

import ai.teliclens.graph.GraphEdge;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.VariableInfo;
import ai.teliclens.graph.VariableKind;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Structural and security checks over a variable graph. Findings are returned as data; the checker never throws on
 * malformed graphs, so dangling edge endpoints become {@code missingNodes} entries.
 */
public class ConsistencyChecker {
    private static final Logger log = LogManager.getLogger(ConsistencyChecker.class);

    public static final List<String> DEFAULT_SANITIZERS = List.of("sanitize", "encrypt", "validate");

    private final List<String> sanitizers;

    public ConsistencyChecker() {
        this(DEFAULT_SANITIZERS);
    }

    /** @param sanitizers reason fragments that mark an edge as sanitized, matched case-insensitively */
    public ConsistencyChecker(List<String> sanitizers) {
        this.sanitizers =
                sanitizers.stream().map(s -> s.toLowerCase(Locale.ROOT)).filter(s -> !s.isEmpty()).toList();
    }

    public ConsistencyReport check(List<GraphNode> nodes, List<GraphEdge> edges) {
        var variables = nodes.stream()
                .filter(n -> n.isVariable() && n.variableInfo() != null)
                .toList();
        var variablesById = variables.stream()
                .collect(Collectors.toMap(GraphNode::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        var nodesById =
                nodes.stream().collect(Collectors.toMap(GraphNode::id, Function.identity(), (a, b) -> a, HashMap::new));
        var dataEdges = edges.stream().filter(e -> e.type().carriesData()).toList();

        var outgoing = new HashMap<String, List<String>>();
        var incoming = new HashMap<String, List<String>>();
        for (var edge : dataEdges) {
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge.target());
            incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
        }
        var definedNames = variables.stream()
                .map(GraphNode::variableInfo)
                .filter(VariableInfo::isDef)
                .map(VariableInfo::symbolName)
                .collect(Collectors.toSet());

        var orphanDefs = new ArrayList<String>();
        var orphanUses = new ArrayList<String>();
        var unreachable = new ArrayList<String>();
        for (var node : variables) {
            var info = info(node);
            if (info.isDef() && !info.isUse() && !outgoing.containsKey(node.id())) {
                orphanDefs.add(node.id() + " (" + node.label() + " in " + info.scope() + ")");
            }
            if (info.isUse()
                    && !info.isDef()
                    && !incoming.containsKey(node.id())
                    && !definedElsewhere(node, info, variables, definedNames)) {
                orphanUses.add(node.id() + " (" + node.label() + " in " + info.scope() + ")");
            }
            if (info.isUse()
                    && info.kind() != VariableKind.PARAMETER
                    && !reachesDefinition(node.id(), info.symbolName(), incoming, variablesById)) {
                var location = node.location();
                String where = location == null ? "unknown:0" : location.file() + ":" + location.startLine();
                unreachable.add(node.id() + " (" + node.label() + " at " + where + ")");
            }
        }

        var violations = new ArrayList<String>();
        for (var edge : dataEdges) {
            if (crossesTrustBoundary(edge, nodesById) && !isSanitized(edge)) {
                violations.add(
                        edge.source() + " → " + edge.target() + " (crosses trust boundary without sanitization)");
            }
        }

        var missing = new ArrayList<String>();
        for (var edge : edges) {
            for (String endpoint : List.of(edge.source(), edge.target())) {
                if (!nodesById.containsKey(endpoint)) {
                    missing.add(endpoint + " (referenced in edge but missing node)");
                }
            }
        }

        var summary = summarize(variables.size(), orphanDefs, orphanUses, unreachable, violations, missing);
        var report = new ConsistencyReport(orphanDefs, orphanUses, unreachable, violations, missing, summary);
        log.debug("Checked {} variables and {} edges: {} issues", variables.size(), edges.size(), report.issueCount());
        return report;
    }

    /**
     * Any other node with the same name that is a definition excuses an orphan use, regardless of scope or file.
     * This is deliberately permissive so that closures and module-level names do not flood the report.
     */
    private static boolean definedElsewhere(
            GraphNode node, VariableInfo info, List<GraphNode> variables, Set<String> definedNames) {
        if (!definedNames.contains(info.symbolName())) {
            return false;
        }
        return variables.stream()
                .anyMatch(other -> !other.id().equals(node.id())
                        && info(other).isDef()
                        && info(other).symbolName().equals(info.symbolName()));
    }

    /** Backward breadth-first search from the use; the start node itself counts as visited. */
    private static boolean reachesDefinition(
            String start, String symbolName, Map<String, List<String>> incoming, Map<String, GraphNode> variables) {
        var visited = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            var node = variables.get(current);
            if (node != null && info(node).isDef() && info(node).symbolName().equals(symbolName)) {
                return true;
            }
            for (String parent : incoming.getOrDefault(current, List.of())) {
                if (!visited.contains(parent)) {
                    queue.add(parent);
                }
            }
        }
        return false;
    }

    private static boolean crossesTrustBoundary(GraphEdge edge, Map<String, GraphNode> nodesById) {
        if (edge.trustBoundary()) {
            return true;
        }
        var source = nodesById.get(edge.source());
        var target = nodesById.get(edge.target());
        return (source != null && source.isTrustBoundary()) || (target != null && target.isTrustBoundary());
    }

    private boolean isSanitized(GraphEdge edge) {
        var reason = edge.reason();
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase(Locale.ROOT);
        return sanitizers.stream().anyMatch(lower::contains);
    }

    private static VariableInfo info(GraphNode node) {
        var info = node.variableInfo();
        if (info == null) {
            throw new IllegalStateException("Variable node without variable info: " + node.id());
        }
        return info;
    }

    static String summarize(
            int variableCount,
            List<String> orphanDefs,
            List<String> orphanUses,
            List<String> unreachable,
            List<String> violations,
            List<String> missing) {
        int issues = orphanDefs.size() + orphanUses.size() + unreachable.size() + violations.size() + missing.size();
        if (issues == 0) {
            return "All " + variableCount + " variables are consistent. No data flow issues detected.";
        }
        var summary = new StringBuilder()
                .append("Found ")
                .append(issues)
                .append(" consistency issues across ")
                .append(variableCount)
                .append(" variables:");
        appendCategory(summary, orphanDefs.size(), "orphan definitions");
        appendCategory(summary, orphanUses.size(), "orphan uses");
        appendCategory(summary, unreachable.size(), "unreachable flows");
        appendCategory(summary, violations.size(), "trust boundary violations");
        appendCategory(summary, missing.size(), "missing nodes");
        return summary.toString();
    }

    private static void appendCategory(StringBuilder summary, int count, String category) {
        if (count > 0) {
            summary.append("\n  - ").append(count).append(' ').append(category);
        }
    }
}
