package ai.teliclens.flow;

import ai.teliclens.graph.DataType;
import ai.teliclens.graph.GraphNode;
import ai.teliclens.graph.NodeType;
import ai.teliclens.graph.SourceLocation;
import ai.teliclens.graph.VariableInfo;
import ai.teliclens.graph.VariableKind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Merges variable observations into one symbol per canonical key. Merged symbols live in an arena and are addressed
 * by integer handles; a map from canonical key to handle gives the at-most-one-node-per-key guarantee.
 *
 * <p>The merged values do not depend on the order observations are added in: flags are OR-ed, the highest precedence
 * kind wins, the line comes from the earliest definition (or the earliest use if there is none) and the data type from
 * the first typed observation in that same ordering. Only the order of {@link #symbols()} follows first observation.
 */
public final class SymbolTable {

    /** Definitions before uses, then by line; the type breaks ties so equal lines stay order-independent. */
    private static final Comparator<VariableSymbol> REPRESENTATIVE_ORDER = Comparator.comparing(
                    (VariableSymbol s) -> !s.isDef())
            .thenComparingInt(VariableSymbol::line)
            .thenComparing(VariableSymbol::dataType, Comparator.nullsLast(Comparator.<DataType>naturalOrder()));

    private final List<Entry> arena = new ArrayList<>();
    private final Map<String, Integer> handles = new HashMap<>();

    public static SymbolTable of(Collection<VariableSymbol> observations) {
        var table = new SymbolTable();
        observations.forEach(table::add);
        return table;
    }

    /** Adds an observation and returns the handle of the symbol it was merged into. */
    public int add(VariableSymbol observation) {
        String key = observation.key();
        var handle = handles.get(key);
        if (handle == null) {
            handle = arena.size();
            arena.add(new Entry(observation));
            handles.put(key, handle);
        } else {
            arena.get(handle).merge(observation);
        }
        return handle;
    }

    public int size() {
        return arena.size();
    }

    public VariableSymbol get(int handle) {
        return arena.get(handle).toSymbol();
    }

    public Optional<Integer> handleOf(String key) {
        return Optional.ofNullable(handles.get(key));
    }

    public Optional<VariableSymbol> lookup(String key) {
        return handleOf(key).map(this::get);
    }

    /** Merged symbols in first-observation order. */
    public List<VariableSymbol> symbols() {
        return arena.stream().map(Entry::toSymbol).toList();
    }

    public List<GraphNode> toNodes() {
        return arena.stream().map(Entry::toSymbol).map(SymbolTable::toNode).toList();
    }

    public static GraphNode toNode(VariableSymbol symbol) {
        var location = new SourceLocation(
                symbol.file(),
                symbol.line(),
                symbol.line(),
                (symbol.isDef() ? "Defined" : "Used") + " at line " + symbol.line());
        var info = new VariableInfo(
                symbol.name(),
                symbol.scope(),
                symbol.kind(),
                symbol.dataType(),
                symbol.isDef(),
                symbol.isUse(),
                symbol.parentFunction(),
                false);
        return new GraphNode(
                symbol.id(),
                symbol.name(),
                NodeType.VARIABLE,
                symbol.kind() + " in " + symbol.scope(),
                location,
                info,
                CanonicalId.functionCluster(symbol.file(), symbol.parentFunction()),
                0,
                null,
                List.of(),
                List.of());
    }

    private static final class Entry {
        private final VariableSymbol first;
        private boolean isDef;
        private boolean isUse;
        private VariableKind kind;
        private VariableSymbol representative;
        private @Nullable VariableSymbol typed;
        private @Nullable String parentFunction;

        Entry(VariableSymbol observation) {
            this.first = observation;
            this.isDef = observation.isDef();
            this.isUse = observation.isUse();
            this.kind = observation.kind();
            this.representative = observation;
            this.typed = observation.dataType() == null ? null : observation;
            this.parentFunction = observation.parentFunction();
        }

        void merge(VariableSymbol observation) {
            isDef |= observation.isDef();
            isUse |= observation.isUse();
            kind = kind.mergeWith(observation.kind());
            if (REPRESENTATIVE_ORDER.compare(observation, representative) < 0) {
                representative = observation;
            }
            if (observation.dataType() != null
                    && (typed == null || REPRESENTATIVE_ORDER.compare(observation, typed) < 0)) {
                typed = observation;
            }
            if (parentFunction == null) {
                parentFunction = observation.parentFunction();
            }
        }

        VariableSymbol toSymbol() {
            @Nullable DataType dataType = typed == null ? null : typed.dataType();
            return new VariableSymbol(
                    first.name(),
                    first.scope(),
                    kind,
                    first.file(),
                    representative.line(),
                    isDef,
                    isUse,
                    parentFunction,
                    dataType);
        }
    }
}
