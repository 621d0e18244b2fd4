package loganalyzer.engine.service;

import loganalyzer.engine.error.InvalidSpecException;
import loganalyzer.engine.error.InvalidStateException;
import loganalyzer.engine.error.JobNotFoundException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.JobPage;
import loganalyzer.engine.model.JobQuery;
import loganalyzer.engine.model.JobSpec;
import loganalyzer.engine.model.JobStatus;
import loganalyzer.engine.repository.JobRepository;
import loganalyzer.engine.source.LineReader;
import loganalyzer.engine.source.LineSource;
import loganalyzer.engine.source.LineSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Business logic for job records outside of execution.
 * Handles submission, lookups, listings and purging of finished jobs.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final LineSource lineSource;

    public JobService(JobRepository jobRepository, LineSource lineSource) {
        this.jobRepository = jobRepository;
        this.lineSource = lineSource;
    }

    /**
     * Validate a submission and persist it as a QUEUED job.
     *
     * @param spec submission request
     * @return created job
     * @throws InvalidSpecException  if the request is malformed or the file does not exist
     * @throws InvalidStateException if the file already has a queued, running or paused job
     */
    public synchronized AnalysisJob createJob(JobSpec spec) {
        if (spec == null) {
            throw new InvalidSpecException("job spec is required");
        }
        spec.validate();
        checkFileExists(spec.fileId());

        Optional<AnalysisJob> active = jobRepository.findActiveForFile(spec.fileId());
        if (active.isPresent()) {
            AnalysisJob existing = active.get();
            throw new InvalidStateException("File " + spec.fileId() + " already has an active analysis job "
                    + existing.id() + " (" + existing.status().name().toLowerCase() + ")");
        }

        Instant now = Instant.now();
        AnalysisJob.Builder builder = AnalysisJob.builder()
                .id(jobRepository.generateId())
                .fileId(spec.fileId())
                .organizationId(spec.organizationId())
                .userId(spec.userId())
                .status(JobStatus.QUEUED)
                .batchSize(spec.effectiveBatchSize())
                .maxBatches(spec.maxBatches())
                .createdAt(now)
                .updatedAt(now)
                .putMetadata("createdAt", now.toString());
        if (spec.maxBatches() != null) {
            builder.putMetadata("requestedMaxBatches", spec.maxBatches());
        }
        AnalysisJob job = builder.build();

        jobRepository.save(job);
        log.info("Created job {} for file {} (org {}, batch size {}{})", job.id(), job.fileId(),
                job.organizationId(), job.batchSize(),
                job.maxBatches() != null ? ", max " + job.maxBatches() + " batches" : "");
        return job;
    }

    private void checkFileExists(String fileId) {
        try (LineReader ignored = lineSource.open(fileId)) {
            log.debug("File {} is readable", fileId);
        } catch (LineSourceException e) {
            if (e.kind() == LineSourceException.Kind.NOT_FOUND) {
                throw new InvalidSpecException("File not found: " + fileId);
            }
            // transient: the worker retries reads, so accept the job
            log.warn("Could not verify file {}: {}", fileId, e.getMessage());
        }
    }

    /**
     * Get a job by ID.
     *
     * @throws JobNotFoundException if no such job exists
     */
    public AnalysisJob getJob(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Get one page of jobs, most recent first.
     */
    public JobPage listJobs(JobQuery query) {
        return jobRepository.find(query);
    }

    /**
     * Find the queued, running or paused job of a file, if any.
     */
    public Optional<AnalysisJob> findActiveJobForFile(String fileId) {
        return jobRepository.findActiveForFile(fileId);
    }

    /**
     * Delete the record of a finished job. Alerts it created are kept.
     *
     * @throws JobNotFoundException  if no such job exists
     * @throws InvalidStateException if the job is not terminal
     */
    public void purge(String jobId) {
        AnalysisJob job = getJob(jobId);
        if (!job.isTerminal()) {
            throw InvalidStateException.forOperation("purged", jobId, job.status());
        }
        if (jobRepository.delete(jobId)) {
            log.info("Purged job {} ({})", jobId, job.status());
        }
    }
}
