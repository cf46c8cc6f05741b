package ai.teliclens.flow;

import static java.util.Objects.requireNonNull;

import ai.teliclens.graph.DataType;
import ai.teliclens.graph.VariableKind;
import org.jetbrains.annotations.Nullable;

/**
 * One observation of a variable: a definition, a use, or both once merged.
 *
 * @param parentFunction the enclosing scope when it is not the module scope
 * @param dataType syntactically inferred type, only known for definitions with an initializer
 */
public record VariableSymbol(
        String name,
        String scope,
        VariableKind kind,
        String file,
        int line,
        boolean isDef,
        boolean isUse,
        @Nullable String parentFunction,
        @Nullable DataType dataType) {

    public VariableSymbol {
        requireNonNull(name, "name");
        requireNonNull(scope, "scope");
        requireNonNull(kind, "kind");
        requireNonNull(file, "file");
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0, was " + line);
        }
    }

    public static VariableSymbol def(
            String name, String scope, VariableKind kind, String file, int line, @Nullable DataType dataType) {
        return new VariableSymbol(name, scope, kind, file, line, true, false, parentOf(scope), dataType);
    }

    public static VariableSymbol use(String name, String scope, String file, int line) {
        return new VariableSymbol(name, scope, VariableKind.LOCAL, file, line, false, true, parentOf(scope), null);
    }

    public String key() {
        return CanonicalId.key(this);
    }

    public String id() {
        return CanonicalId.variable(key());
    }

    private static @Nullable String parentOf(String scope) {
        return TraversalContext.GLOBAL_SCOPE.equals(scope) ? null : scope;
    }
}
