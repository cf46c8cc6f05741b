package ai.teliclens.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceLocation(String file, int startLine, int endLine, @Nullable String comment) {

    public SourceLocation {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid line range " + startLine + "-" + endLine + " in " + file);
        }
    }

    public static SourceLocation at(String file, int line) {
        return new SourceLocation(file, line, line, null);
    }
}
