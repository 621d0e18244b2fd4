package loganalyzer.engine.source;

/**
 * Failure to open or read a log file.
 */
public class LineSourceException extends Exception {

    public enum Kind {
        /** The file reference does not resolve to a file */
        NOT_FOUND,
        /** I/O failure, may succeed on a later attempt */
        READ_FAILURE
    }

    private final Kind kind;
    private final String fileId;

    public LineSourceException(Kind kind, String fileId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.fileId = fileId;
    }

    public static LineSourceException notFound(String fileId) {
        return new LineSourceException(Kind.NOT_FOUND, fileId, "Log file not found: " + fileId, null);
    }

    public static LineSourceException readFailure(String fileId, Throwable cause) {
        return new LineSourceException(Kind.READ_FAILURE, fileId,
                "Failed to read log file " + fileId + ": " + cause.getMessage(), cause);
    }

    public Kind kind() {
        return kind;
    }

    public String fileId() {
        return fileId;
    }

    public boolean isRetryable() {
        return kind == Kind.READ_FAILURE;
    }
}
