package ai.teliclens.flow;

import org.jetbrains.annotations.Nullable;

/**
 * Canonical identity of variables and of the function clusters they belong to. A variable is identified by
 * {@code (file, scope, name)}; every observation with the same triple denotes the same graph node. Flow edges carry
 * the bare key, graph nodes and edges carry the key with the {@code var:} prefix.
 */
public final class CanonicalId {
    public static final String VARIABLE_PREFIX = "var:";
    public static final String FUNCTION_PREFIX = "func:";
    public static final String FILE_PREFIX = "file:";

    private CanonicalId() {}

    public static String key(String file, String scope, String name) {
        return file + ":" + scope + ":" + name;
    }

    public static String key(VariableSymbol symbol) {
        return key(symbol.file(), symbol.scope(), symbol.name());
    }

    public static String variable(String key) {
        return VARIABLE_PREFIX + key;
    }

    public static String variable(String file, String scope, String name) {
        return variable(key(file, scope, name));
    }

    /** Cluster a variable belongs to at function level; module-scope variables share the file's global cluster. */
    public static String functionCluster(String file, @Nullable String parentFunction) {
        return FUNCTION_PREFIX + file + ":" + (parentFunction == null ? TraversalContext.GLOBAL_SCOPE : parentFunction);
    }

    public static String file(String file) {
        return FILE_PREFIX + file;
    }

    /** Function part of a cluster key, i.e. everything after the last separator. */
    public static String functionName(String clusterKey) {
        int lastColon = clusterKey.lastIndexOf(':');
        return lastColon >= 0 ? clusterKey.substring(lastColon + 1) : clusterKey;
    }
}
