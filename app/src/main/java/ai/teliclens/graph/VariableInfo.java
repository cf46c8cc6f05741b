package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/** Variable-specific payload of a {@link NodeType#VARIABLE} node. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariableInfo(
        @JsonProperty("symbolName") String symbolName,
        @JsonProperty("scope") String scope,
        @JsonProperty("kind") VariableKind kind,
        @JsonProperty("dataType") @Nullable DataType dataType,
        @JsonProperty("isDef") boolean isDef,
        @JsonProperty("isUse") boolean isUse,
        @JsonProperty("parentFunction") @Nullable String parentFunction,
        @JsonProperty("trustBoundary") boolean trustBoundary) {

    public VariableInfo withTrustBoundary(boolean flag) {
        return new VariableInfo(symbolName, scope, kind, dataType, isDef, isUse, parentFunction, flag);
    }
}
