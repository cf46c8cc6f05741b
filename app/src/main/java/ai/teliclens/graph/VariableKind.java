package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Role of a variable observation. Declaration order is merge precedence: when observations of one variable disagree,
 * the earliest constant wins.
 */
public enum VariableKind {
    PARAMETER("parameter"),
    RETURN("return"),
    FIELD("field"),
    GLOBAL("global"),
    LOCAL("local");

    private final String wireName;

    VariableKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static VariableKind fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown variable kind: " + wireName));
    }

    public VariableKind mergeWith(VariableKind other) {
        return compareTo(other) <= 0 ? this : other;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
