package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum EdgeType {
    DEPENDENCY("dependency"),
    FLOW("flow"),
    SERVES_INTENT("serves_intent"),
    SUPPORTS_INTENT("supports_intent"),
    UNDERMINES_INTENT("undermines_intent");

    private final String wireName;

    EdgeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EdgeType fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge type: " + wireName));
    }

    /** Edge types that carry data between variables and are therefore subject to consistency checks. */
    public boolean carriesData() {
        return this == FLOW || this == DEPENDENCY;
    }
}
