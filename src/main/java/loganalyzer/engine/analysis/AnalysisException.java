package loganalyzer.engine.analysis;

/**
 * The classifier could not produce findings for a batch.
 */
public class AnalysisException extends Exception {

    private final boolean retryable;

    public AnalysisException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public AnalysisException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static AnalysisException timeout(long timeoutMs) {
        return new AnalysisException("Analysis call timed out after " + timeoutMs + "ms", true);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
