package ai.teliclens.analyzer;

/** Result of asking a {@link SyntaxTreeProvider} for a tree: either the tree or a typed failure. */
public sealed interface ParseOutcome permits SyntaxTree, ParseFailure {

    String fileName();
}
