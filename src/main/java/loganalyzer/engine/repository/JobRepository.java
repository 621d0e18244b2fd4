package loganalyzer.engine.repository;

import loganalyzer.engine.error.PersistenceConflictException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.JobPage;
import loganalyzer.engine.model.JobQuery;
import loganalyzer.engine.model.JobSignals;
import loganalyzer.engine.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for analysis job persistence.
 *
 * Progress and status are written through {@link #update} with an
 * optimistic version check. The pause/cancel request flags have their own
 * statements which never touch the version, so an external actor can raise
 * them while a worker owns the job.
 */
public interface JobRepository {

    /**
     * Insert a new job.
     *
     * @param job the job to save
     */
    void save(AnalysisJob job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<AnalysisJob> findById(String jobId);

    /**
     * Get jobs in any of the given states, oldest first.
     *
     * @param statuses the status filter
     * @return list of jobs
     */
    List<AnalysisJob> findByStatus(JobStatus... statuses);

    /**
     * Get one page of jobs matching the query, most recent first.
     */
    JobPage find(JobQuery query);

    /**
     * Find the most recent queued, running or paused job for a file.
     */
    Optional<AnalysisJob> findActiveForFile(String fileId);

    /**
     * Write status, counters, timestamps and metadata of a job if its stored
     * version still equals {@code job.version()}.
     *
     * @param job          the new state
     * @param clearPause   also reset the pause request flag in the same write
     * @param clearCancel  also reset the cancel request flag in the same write
     * @return the job as stored, with the incremented version
     * @throws PersistenceConflictException if the stored version differs
     */
    AnalysisJob update(AnalysisJob job, boolean clearPause, boolean clearCancel);

    /**
     * Same as {@code update(job, false, false)}.
     */
    default AnalysisJob update(AnalysisJob job) {
        return update(job, false, false);
    }

    /**
     * Read only the request flags of a job.
     */
    Optional<JobSignals> findSignals(String jobId);

    /**
     * Raise the pause request flag of a non-terminal job.
     *
     * @return true if the flag was set by this call
     */
    boolean requestPause(String jobId);

    /**
     * Raise the cancel request flag of a non-terminal job.
     *
     * @return true if the flag was set by this call
     */
    boolean requestCancel(String jobId);

    /**
     * Drop a pause request left on a PAUSED job, so a resume is not undone
     * by its first boundary check.
     *
     * @return true if a flag was cleared
     */
    boolean withdrawPause(String jobId);

    /**
     * Unconditionally move a non-terminal job to ERROR.
     * Used when a versioned write can no longer be trusted.
     *
     * @return true if the job was updated
     */
    boolean forceError(String jobId, String errorMessage);

    /**
     * Delete a job.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique job ID.
     */
    String generateId();
}
