package ai.teliclens.analyzer;

import org.jetbrains.annotations.Nullable;

/** Turns source text into a syntax tree, or reports why it could not. Implementations never throw for bad input. */
public interface SyntaxTreeProvider {

    ParseOutcome parse(String fileName, String sourceText, @Nullable String languageHint);

    default ParseOutcome parse(SourceFile file) {
        return parse(file.name(), file.content(), file.languageHint());
    }
}
