package ai.teliclens.analyzer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

/** Source languages the syntax tree provider has a TreeSitter grammar for. */
public enum Language {
    TYPESCRIPT("TypeScript", List.of("ts", "mts", "cts"), List.of("typescript", "ts")),
    JAVASCRIPT("JavaScript", List.of("js", "mjs", "cjs", "jsx"), List.of("javascript", "js", "jsx", "ecmascript"));

    private final String displayName;
    private final List<String> extensions;
    private final List<String> hints;

    Language(String displayName, List<String> extensions, List<String> hints) {
        this.displayName = displayName;
        this.extensions = extensions;
        this.hints = hints;
    }

    public String displayName() {
        return displayName;
    }

    /** A fresh grammar handle. TSLanguage instances are cheap wrappers around a static native table. */
    public TSLanguage createTSLanguage() {
        return switch (this) {
            case TYPESCRIPT -> new TreeSitterTypescript();
            case JAVASCRIPT -> new TreeSitterJavascript();
        };
    }

    public static Optional<Language> fromHint(@Nullable String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        var normalized = hint.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.hints.contains(normalized)).findFirst();
    }

    public static Optional<Language> fromFileName(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot < 0 || lastDot == fileName.length() - 1) {
            return Optional.empty();
        }
        var extension = fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.extensions.contains(extension))
                .findFirst();
    }

    /** The hint wins when it names a known language; otherwise the file extension decides. */
    public static Optional<Language> resolve(String fileName, @Nullable String hint) {
        return fromHint(hint).or(() -> fromFileName(fileName));
    }
}
