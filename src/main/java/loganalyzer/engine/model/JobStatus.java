package loganalyzer.engine.model;

/**
 * Lifecycle status of an analysis job.
 * Stored as its name in the {@code analysis_jobs.status} column.
 */
public enum JobStatus {
    /** Submitted, waiting for a worker */
    QUEUED,
    /** A worker is executing the batch loop */
    RUNNING,
    /** Stopped at a batch boundary, waiting for resume */
    PAUSED,
    /** Every batch committed */
    COMPLETED,
    /** Stopped by user request */
    CANCELLED,
    /** Stopped by an unrecoverable failure */
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == ERROR;
    }

    public boolean isActive() {
        return !isTerminal();
    }
}
