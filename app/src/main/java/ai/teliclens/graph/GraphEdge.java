package ai.teliclens.graph;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphEdge(
        String source,
        String target,
        EdgeType type,
        @Nullable String label,
        @Nullable String reason,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean trustBoundary) {

    public GraphEdge {
        requireNonNull(source, "source");
        requireNonNull(target, "target");
        requireNonNull(type, "type");
    }

    public static GraphEdge of(String source, String target, EdgeType type, @Nullable String label) {
        return new GraphEdge(source, target, type, label, null, false);
    }

    /** Ordered endpoint pair; the dedup key used at every clustering level. */
    @JsonIgnore
    public String key() {
        return source + "->" + target;
    }

    public GraphEdge withTrustBoundary(boolean flag) {
        return new GraphEdge(source, target, type, label, reason, flag);
    }
}
