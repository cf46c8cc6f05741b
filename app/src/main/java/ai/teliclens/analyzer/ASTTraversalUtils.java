package ai.teliclens.analyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Utility class for the AST access patterns used by the flow extractor: null-safe child and field lookup and node
 * identity.
 */
public class ASTTraversalUtils {

    private ASTTraversalUtils() {}

    /** TreeSitter returns "null nodes" rather than Java nulls for absent children; this treats both the same. */
    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** The child stored under the given field name, if the grammar produced one. */
    public static Optional<TSNode> field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? Optional.of(child) : Optional.empty();
    }

    /** Named children in source order, skipping absent ones. */
    public static List<TSNode> namedChildren(TSNode node) {
        var children = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child)) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Two handles denote the same syntax node when they cover the same bytes with the same type. Wrappers around the
     * same native node are not guaranteed to be equal objects.
     */
    public static boolean sameNode(@Nullable TSNode a, @Nullable TSNode b) {
        if (!isPresent(a) || !isPresent(b)) {
            return false;
        }
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /** 1-based line on which the node starts. */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }
}
