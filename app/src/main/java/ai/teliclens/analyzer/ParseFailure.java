package ai.teliclens.analyzer;

/**
 * A file that could not be turned into a syntax tree.
 *
 * @param fileName the file that failed
 * @param operation the provider step that failed, e.g. "language selection" or "parse"
 * @param message human-readable cause
 */
public record ParseFailure(String fileName, String operation, String message) implements ParseOutcome {}
