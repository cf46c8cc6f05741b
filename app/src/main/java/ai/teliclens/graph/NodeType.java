package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum NodeType {
    FILE("file"),
    FUNCTION("function"),
    DATA("data"),
    INTENT("intent"),
    VARIABLE("variable");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NodeType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node type: " + wireName));
    }

    /** Functions and the variables clustered into them both lift to file level together. */
    public boolean isFunctionLike() {
        return this == FUNCTION || this == VARIABLE;
    }
}
