package ai.teliclens.analyzer;

import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * {@link SyntaxTreeProvider} backed by the TreeSitter TypeScript and JavaScript grammars.
 *
 * <p>TreeSitter recovers from malformed input by inserting ERROR nodes, so most bad files still produce a best-effort
 * tree. In strict mode such trees are rejected as parse failures instead.
 */
public class TreeSitterSyntaxTreeProvider implements SyntaxTreeProvider {
    private static final Logger log = LogManager.getLogger(TreeSitterSyntaxTreeProvider.class);

    // TSParser is not threadsafe, so each thread gets its own parser per language
    private final ThreadLocal<Map<Language, TSParser>> threadLocalParsers =
            ThreadLocal.withInitial(() -> new EnumMap<>(Language.class));
    private final boolean strict;

    public TreeSitterSyntaxTreeProvider() {
        this(false);
    }

    public TreeSitterSyntaxTreeProvider(boolean strict) {
        this.strict = strict;
    }

    @Override
    public ParseOutcome parse(String fileName, String sourceText, @Nullable String languageHint) {
        var language = Language.resolve(fileName, languageHint);
        if (language.isEmpty()) {
            return new ParseFailure(
                    fileName,
                    "language selection",
                    "No grammar for language hint '" + languageHint + "' or file extension of " + fileName);
        }

        try {
            return parseTree(fileName, SourceContent.of(sourceText), language.get());
        } catch (TreeSitterAnalysisException e) {
            return e.toParseFailure();
        }
    }

    private SyntaxTree parseTree(String fileName, SourceContent source, Language language)
            throws TreeSitterAnalysisException {
        var parser = parserFor(language, fileName);

        TSTree tree;
        try {
            tree = parser.parseString(null, source.text());
        } catch (RuntimeException e) {
            throw new TreeSitterAnalysisException(String.valueOf(e.getMessage()), e, fileName, "parse");
        }
        if (tree == null || !ASTTraversalUtils.isPresent(tree.getRootNode())) {
            throw new TreeSitterAnalysisException("parser produced no tree", fileName, "parse");
        }

        var syntaxTree = new SyntaxTree(fileName, language, source, tree);
        if (syntaxTree.hasErrors()) {
            if (strict) {
                throw new TreeSitterAnalysisException("source contains syntax errors", fileName, "parse");
            }
            log.debug("Parsed {} as {} with error recovery", fileName, language.displayName());
        } else {
            log.trace("Parsed {} as {}", fileName, language.displayName());
        }
        return syntaxTree;
    }

    private TSParser parserFor(Language language, String fileName) throws TreeSitterAnalysisException {
        var parsers = threadLocalParsers.get();
        var existing = parsers.get(language);
        if (existing != null) {
            return existing;
        }
        var parser = new TSParser();
        if (!parser.setLanguage(language.createTSLanguage())) {
            log.error("Failed to set language on TSParser for {}", language.displayName());
            throw new TreeSitterAnalysisException(
                    "grammar for " + language.displayName() + " could not be loaded", fileName, "parser setup");
        }
        parsers.put(language, parser);
        return parser;
    }
}
