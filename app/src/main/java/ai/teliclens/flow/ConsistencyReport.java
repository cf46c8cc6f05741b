package ai.teliclens.flow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/** Findings of {@link ConsistencyChecker}. Every list holds one human-readable entry per finding. */
public record ConsistencyReport(
        List<String> orphanDefs,
        List<String> orphanUses,
        List<String> unreachableFlows,
        List<String> trustBoundaryViolations,
        List<String> missingNodes,
        String summary) {

    public ConsistencyReport {
        orphanDefs = List.copyOf(orphanDefs);
        orphanUses = List.copyOf(orphanUses);
        unreachableFlows = List.copyOf(unreachableFlows);
        trustBoundaryViolations = List.copyOf(trustBoundaryViolations);
        missingNodes = List.copyOf(missingNodes);
    }

    @JsonIgnore
    public int issueCount() {
        return orphanDefs.size()
                + orphanUses.size()
                + unreachableFlows.size()
                + trustBoundaryViolations.size()
                + missingNodes.size();
    }

    @JsonIgnore
    public boolean isClean() {
        return issueCount() == 0;
    }
}
