package ai.teliclens.flow;

import java.util.ArrayList;
import java.util.List;

/** Raw, unmerged output of extracting one or more files. */
public record ExtractionResult(List<VariableSymbol> variables, List<FlowEdge> flows) {

    public static final ExtractionResult EMPTY = new ExtractionResult(List.of(), List.of());

    public ExtractionResult {
        variables = List.copyOf(variables);
        flows = List.copyOf(flows);
    }

    public boolean isEmpty() {
        return variables.isEmpty() && flows.isEmpty();
    }

    /** Concatenates per-file results in the given order. */
    public static ExtractionResult concat(List<ExtractionResult> results) {
        var variables = new ArrayList<VariableSymbol>();
        var flows = new ArrayList<FlowEdge>();
        for (var result : results) {
            variables.addAll(result.variables());
            flows.addAll(result.flows());
        }
        return new ExtractionResult(variables, flows);
    }
}
