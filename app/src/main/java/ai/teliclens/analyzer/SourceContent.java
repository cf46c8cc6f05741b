package ai.teliclens.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Provides safe substring extraction by UTF-8 byte offsets, which is
 * what TreeSitter reports, and avoids repeated String.getBytes(StandardCharsets.UTF_8) allocations across callers.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char UTF8_BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = utf8Bytes.length;
    }

    /** Creates a SourceContent wrapper for the provided source text, dropping a leading byte order mark. */
    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == UTF8_BOM ? src.substring(1) : src;
        return new SourceContent(stripped, stripped.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * <p>Out-of-range requests return the empty string and log a warning; an end offset past the end of the source is
     * truncated. The returned String is built directly from the byte slice.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }

        if (startByte == endByte) {
            return "";
        }

        if (startByte >= byteLength) {
            log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            return "";
        }

        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }

        return new String(utf8Bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** Text covered by the node, trimmed; empty for a null node. */
    public String textOf(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte()).trim();
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourceContent other)) return false;
        return Arrays.equals(utf8Bytes, other.utf8Bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(utf8Bytes);
    }

    @Override
    public String toString() {
        return "SourceContent[" + byteLength + " bytes]";
    }
}
