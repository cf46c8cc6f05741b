package ai.teliclens.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A parsed file. Holds on to the native tree so that its nodes stay valid while the tree is being walked.
 *
 * <p>A tree may contain ERROR nodes where the input was malformed; walkers treat those like any other node.
 */
public record SyntaxTree(String fileName, Language language, SourceContent source, TSTree tree)
        implements ParseOutcome {

    public TSNode rootNode() {
        return tree.getRootNode();
    }

    public boolean hasErrors() {
        return rootNode().hasError();
    }
}
