package ai.teliclens.graph;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the analysis graph at any resolution: a variable at level 0, or a function, file, data or intent node
 * supplied by a collaborator or synthesized by clustering.
 *
 * <p>Nodes are immutable; the {@code with*} methods return modified copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphNode(
        String id,
        String label,
        NodeType type,
        @Nullable String description,
        @Nullable SourceLocation location,
        @Nullable VariableInfo variableInfo,
        @Nullable String clusterId,
        @Nullable Integer clusterLevel,
        @Nullable Integer memberCount,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> inputs,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> outputs) {

    public GraphNode {
        requireNonNull(id, "id");
        requireNonNull(label, "label");
        requireNonNull(type, "type");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    /** A bare structural node, as an overlay or a clustering step would create it. */
    public static GraphNode of(String id, String label, NodeType type, @Nullable SourceLocation location) {
        return new GraphNode(id, label, type, null, location, null, null, null, null, List.of(), List.of());
    }

    @JsonIgnore
    public boolean isVariable() {
        return type == NodeType.VARIABLE;
    }

    @JsonIgnore
    public boolean isTrustBoundary() {
        return variableInfo != null && variableInfo.trustBoundary();
    }

    @JsonIgnore
    public @Nullable String locationFile() {
        return location == null ? null : location.file();
    }

    public GraphNode withVariableInfo(@Nullable VariableInfo newInfo) {
        return new GraphNode(
                id, label, type, description, location, newInfo, clusterId, clusterLevel, memberCount, inputs, outputs);
    }

    public GraphNode withClusterId(@Nullable String newClusterId) {
        return new GraphNode(
                id,
                label,
                type,
                description,
                location,
                variableInfo,
                newClusterId,
                clusterLevel,
                memberCount,
                inputs,
                outputs);
    }

    /** Copy annotated as a cluster of {@code count} members with the given aggregated inputs and outputs. */
    public GraphNode asCluster(
            String newDescription, int count, int level, List<String> newInputs, List<String> newOutputs) {
        return new GraphNode(
                id,
                label,
                type,
                newDescription,
                location,
                variableInfo,
                clusterId,
                level,
                count,
                newInputs,
                newOutputs);
    }
}
