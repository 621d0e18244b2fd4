package loganalyzer.engine.error;

import loganalyzer.engine.model.JobStatus;

/**
 * Control operation incompatible with the job's current status.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }

    public static InvalidStateException forOperation(String operation, String jobId, JobStatus status) {
        return new InvalidStateException(
                "Job " + jobId + " cannot be " + operation + ". Current status: " + status.name().toLowerCase());
    }
}
