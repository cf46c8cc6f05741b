package ai.teliclens.analyzer;

/**
 * Exception thrown when TreeSitter parsing fails. Provides more specific error handling than generic Exception and
 * records which file and which step were involved.
 */
public class TreeSitterAnalysisException extends Exception {
    private final String fileName;
    private final String operation;

    public TreeSitterAnalysisException(String message, String fileName, String operation) {
        super(message);
        this.fileName = fileName;
        this.operation = operation;
    }

    public TreeSitterAnalysisException(String message, Throwable cause, String fileName, String operation) {
        super(message, cause);
        this.fileName = fileName;
        this.operation = operation;
    }

    public String getFileName() {
        return fileName;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return String.format(
                "TreeSitter analysis failed during %s for file %s: %s", operation, fileName, super.getMessage());
    }

    public ParseFailure toParseFailure() {
        return new ParseFailure(fileName, operation, getMessage());
    }
}
