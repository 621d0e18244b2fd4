package loganalyzer.engine.core;

import loganalyzer.engine.model.AnalysisJob;

import java.time.Instant;

/**
 * Something observable happened to a job. {@code job} is the snapshot as
 * persisted right after the change.
 */
public record JobEvent(Type type, AnalysisJob job, Instant at, String detail) {

    public enum Type {
        STARTED,
        RESUMED,
        BATCH_COMPLETED,
        BATCH_FAILED,
        PAUSED,
        CANCELLED,
        COMPLETED,
        FAILED
    }

    public static JobEvent of(Type type, AnalysisJob job) {
        return new JobEvent(type, job, Instant.now(), null);
    }

    public static JobEvent of(Type type, AnalysisJob job, String detail) {
        return new JobEvent(type, job, Instant.now(), detail);
    }

    public String jobId() {
        return job.id();
    }
}
