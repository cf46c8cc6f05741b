package ai.teliclens.analyzer;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One unit of source text handed to the analysis.
 *
 * @param name the file name as it should appear in node IDs and locations
 * @param content the full source text
 * @param languageHint optional language name; the extension of {@code name} is used when absent or unknown
 */
public record SourceFile(String name, String content, @Nullable String languageHint) {
    private static final Logger logger = LogManager.getLogger(SourceFile.class);

    public SourceFile {
        requireNonNull(name, "name");
        requireNonNull(content, "content");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static SourceFile of(String name, String content) {
        return new SourceFile(name, content, null);
    }

    /**
     * Reads a file from disk, naming it by the path exactly as given. Bytes that are not valid UTF-8 are decoded as
     * replacement characters so one badly encoded file still yields a best-effort analysis.
     */
    public static SourceFile read(Path path, @Nullable String languageHint) throws IOException {
        String content;
        try {
            content = Files.readString(path);
        } catch (CharacterCodingException e) {
            logger.warn("{} is not valid UTF-8; decoding with replacement characters", path);
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        }
        return new SourceFile(path.toString(), content, languageHint);
    }
}
