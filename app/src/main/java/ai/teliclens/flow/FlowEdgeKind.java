package ai.teliclens.flow;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowEdgeKind {
    ASSIGNMENT("assignment"),
    RETURN("return"),
    PARAMETER_ARGUMENT("parameter-argument"),
    DEF_USE("def-use");

    private final String wireName;

    FlowEdgeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
