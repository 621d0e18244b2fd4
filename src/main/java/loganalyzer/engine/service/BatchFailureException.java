package loganalyzer.engine.service;

/**
 * One attempt at a batch failed. Retryable failures are retried by the
 * controller; anything else ends the job in ERROR.
 */
public class BatchFailureException extends Exception {

    private final boolean retryable;

    public BatchFailureException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
