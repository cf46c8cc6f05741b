package ai.teliclens.flow;

import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.VariableInfo;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops variable nodes that carry little information: throwaway names, loop counters and short locals. Non-variable
 * nodes always pass; edges are never touched, so edges into dropped nodes show up as missing nodes when checked.
 */
public class NoiseFilter {
    public static final Set<String> DEFAULT_LOOP_COUNTERS = Set.of("i", "j", "k");

    private static final Pattern TEMPORARY = Pattern.compile("(?:tmp|temp)\\d*");

    private final Set<String> loopCounters;

    public NoiseFilter() {
        this(DEFAULT_LOOP_COUNTERS);
    }

    public NoiseFilter(Collection<String> loopCounters) {
        this.loopCounters = Set.copyOf(loopCounters);
    }

    public List<GraphNode> filter(List<GraphNode> nodes) {
        return nodes.stream().filter(this::keep).toList();
    }

    public boolean keep(GraphNode node) {
        var info = node.variableInfo();
        return !node.isVariable() || info == null || isMeaningful(info);
    }

    public boolean isMeaningful(VariableInfo info) {
        String name = info.symbolName();
        if (name.startsWith("_") && name.length() < 3) {
            return false;
        }
        if (TEMPORARY.matcher(name).matches() || loopCounters.contains(name)) {
            return false;
        }
        if (name.length() == 1 && !isPlainLowercase(name.charAt(0))) {
            return false;
        }
        return switch (info.kind()) {
            case PARAMETER, RETURN, FIELD, GLOBAL -> true;
            case LOCAL -> name.length() > 2;
        };
    }

    private static boolean isPlainLowercase(char c) {
        return c >= 'a' && c <= 'z';
    }
}
