package loganalyzer.engine.error;

/**
 * Versioned write lost against a concurrent writer of the same job.
 * Two owners touched one job, so this is never retried.
 */
public class PersistenceConflictException extends RuntimeException {

    private final String jobId;
    private final long expectedVersion;

    public PersistenceConflictException(String jobId, long expectedVersion) {
        super("Concurrent modification of job " + jobId + " (expected version " + expectedVersion + ")");
        this.jobId = jobId;
        this.expectedVersion = expectedVersion;
    }

    public String jobId() {
        return jobId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }
}
