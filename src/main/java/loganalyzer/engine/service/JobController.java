package loganalyzer.engine.service;

import loganalyzer.engine.core.JobEvent;
import loganalyzer.engine.core.JobEventBus;
import loganalyzer.engine.error.PersistenceConflictException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.BatchResult;
import loganalyzer.engine.model.JobSignals;
import loganalyzer.engine.model.JobStatus;
import loganalyzer.engine.model.LogLine;
import loganalyzer.engine.repository.JobRepository;
import loganalyzer.engine.source.LineBatch;
import loganalyzer.engine.source.LineReader;
import loganalyzer.engine.source.LineSource;
import loganalyzer.engine.source.LineSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives one job through its batch loop on the calling worker thread.
 *
 * Only the thread running {@link #run} for a job writes its status and
 * counters; every write is versioned. Pause and cancel requests are read from
 * the store at batch boundaries and between retry attempts, cancel first.
 * A batch is committed as a whole or not at all.
 */
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    static final int BATCH_HISTORY_SIZE = 10;
    static final int ERROR_HISTORY_SIZE = 20;

    private final JobRepository jobRepository;
    private final LineSource lineSource;
    private final BatchProcessor batchProcessor;
    private final RetryPolicy retryPolicy;
    private final JobEventBus eventBus;
    private final Clock clock;

    public JobController(JobRepository jobRepository, LineSource lineSource, BatchProcessor batchProcessor,
            RetryPolicy retryPolicy, JobEventBus eventBus) {
        this(jobRepository, lineSource, batchProcessor, retryPolicy, eventBus, Clock.systemUTC());
    }

    public JobController(JobRepository jobRepository, LineSource lineSource, BatchProcessor batchProcessor,
            RetryPolicy retryPolicy, JobEventBus eventBus, Clock clock) {
        this.jobRepository = jobRepository;
        this.lineSource = lineSource;
        this.batchProcessor = batchProcessor;
        this.retryPolicy = retryPolicy;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Execute the job until it pauses or reaches a terminal state.
     * Never throws; failures end the job in ERROR. If the worker is
     * interrupted the job is left RUNNING so startup recovery picks it up.
     */
    public void run(String jobId) {
        AnalysisJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Job {} disappeared before it could run", jobId);
            return;
        }
        if (job.isTerminal()) {
            log.debug("Job {} is already {}, nothing to run", jobId, job.status());
            return;
        }

        try (JobRun jobRun = new JobRun(job)) {
            jobRun.execute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Job {} interrupted, left for recovery", jobId);
        } catch (PersistenceConflictException e) {
            log.error("Job {}: {}", jobId, e.getMessage());
            failHard(jobId, "Persistence conflict: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", jobId, e);
            failHard(jobId, "Internal error: " + e.getMessage());
        }
    }

    /**
     * Cancel a paused job that no worker holds.
     *
     * @return the job as stored afterwards
     */
    public AnalysisJob cancelIdle(String jobId) {
        AnalysisJob job = jobRepository.findById(jobId).orElse(null);
        if (job == null || job.status() != JobStatus.PAUSED) {
            return job;
        }
        try {
            AnalysisJob cancelled = jobRepository.update(cancelled(job), true, true);
            log.info("Job {} cancelled while paused at batch {}", jobId, cancelled.currentBatch());
            eventBus.publish(JobEvent.of(JobEvent.Type.CANCELLED, cancelled));
            return cancelled;
        } catch (PersistenceConflictException e) {
            log.error("Job {}: {}", jobId, e.getMessage());
            failHard(jobId, "Persistence conflict: " + e.getMessage());
            return jobRepository.findById(jobId).orElse(null);
        }
    }

    private void failHard(String jobId, String message) {
        try {
            if (jobRepository.forceError(jobId, message)) {
                jobRepository.findById(jobId)
                        .ifPresent(j -> eventBus.publish(JobEvent.of(JobEvent.Type.FAILED, j, message)));
            }
        } catch (RuntimeException e) {
            log.error("Could not record failure of job {}", jobId, e);
        }
    }

    private AnalysisJob cancelled(AnalysisJob job) {
        Instant now = clock.instant();
        return job.toBuilder()
                .status(JobStatus.CANCELLED)
                .endTime(now)
                .estimatedEndTime(null)
                .putMetadata("cancelledAt", now.toString())
                .putMetadata("cancelledAtBatch", job.currentBatch())
                .build();
    }

    /**
     * State of one execution of one job. {@code job} always holds the latest
     * stored snapshot, so the next versioned write starts from it.
     */
    private final class JobRun implements AutoCloseable {

        private AnalysisJob job;
        private LineReader reader;

        JobRun(AnalysisJob job) {
            this.job = job;
        }

        void execute() throws InterruptedException {
            enterRunning();

            while (true) {
                if (honorSignals()) {
                    return;
                }
                if (job.allBatchesCommitted()) {
                    complete();
                    return;
                }
                if (!runNextBatch()) {
                    return;
                }
                if (job.allBatchesCommitted()) {
                    complete();
                    return;
                }
            }
        }

        private void enterRunning() {
            JobStatus previous = job.status();
            Instant now = clock.instant();
            AnalysisJob.Builder builder = job.toBuilder().status(JobStatus.RUNNING);
            if (job.startTime() == null) {
                builder.startTime(now);
            }
            JobEvent.Type type;
            switch (previous) {
                case QUEUED -> {
                    builder.putMetadata("startedAt", now.toString());
                    type = JobEvent.Type.STARTED;
                }
                case PAUSED -> {
                    builder.putMetadata("resumedAt", now.toString());
                    type = JobEvent.Type.RESUMED;
                }
                default -> {
                    builder.putMetadata("recoveredAt", now.toString());
                    type = JobEvent.Type.RESUMED;
                }
            }
            job = jobRepository.update(builder.build());
            log.info("Job {} {} at batch {} (file {}, batch size {})",
                    job.id(), previous == JobStatus.QUEUED ? "started" : "resumed",
                    job.currentBatch() + 1, job.fileId(), job.batchSize());
            eventBus.publish(JobEvent.of(type, job));
        }

        /**
         * @return true if a cancel or pause request ended this run
         */
        private boolean honorSignals() {
            JobSignals signals = jobRepository.findSignals(job.id()).orElse(JobSignals.NONE);
            if (signals.cancelRequested()) {
                job = jobRepository.update(cancelled(job), true, true);
                log.info("Job {} cancelled at batch {} ({} lines processed)",
                        job.id(), job.currentBatch(), job.linesProcessed());
                eventBus.publish(JobEvent.of(JobEvent.Type.CANCELLED, job));
                return true;
            }
            if (signals.pauseRequested()) {
                Instant now = clock.instant();
                job = jobRepository.update(job.toBuilder()
                        .status(JobStatus.PAUSED)
                        .putMetadata("pausedAt", now.toString())
                        .putMetadata("pausedBeforeBatch", job.currentBatch() + 1)
                        .build(), true, false);
                log.info("Job {} paused before batch {}", job.id(), job.currentBatch() + 1);
                eventBus.publish(JobEvent.of(JobEvent.Type.PAUSED, job));
                return true;
            }
            return false;
        }

        private void complete() {
            Instant now = clock.instant();
            job = jobRepository.update(job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .endTime(now)
                    .estimatedEndTime(now)
                    .putMetadata("completedAt", now.toString())
                    .build(), true, true);
            log.info("Job {} completed: {} lines, {} issues, {} alerts",
                    job.id(), job.linesProcessed(), job.issuesFound(), job.alertsCreated());
            eventBus.publish(JobEvent.of(JobEvent.Type.COMPLETED, job));
        }

        private void fail(String message) {
            Instant now = clock.instant();
            job = jobRepository.update(job.toBuilder()
                    .status(JobStatus.ERROR)
                    .endTime(now)
                    .estimatedEndTime(null)
                    .errorMessage(message)
                    .putMetadata("errorOccurredAt", now.toString())
                    .build(), true, true);
            log.error("Job {} failed at batch {}: {}", job.id(), job.currentBatch() + 1, message);
            eventBus.publish(JobEvent.of(JobEvent.Type.FAILED, job, message));
        }

        /**
         * Run the next batch under the retry policy.
         *
         * @return true to keep looping, false if the run ended
         */
        private boolean runNextBatch() throws InterruptedException {
            int batchNumber = job.currentBatch() + 1;
            int attempt = 1;
            while (true) {
                try {
                    attemptBatch(batchNumber);
                    return true;
                } catch (BatchFailureException e) {
                    recordFailure(batchNumber, attempt, e);
                    if (!e.retryable() || !retryPolicy.canRetry(attempt)) {
                        fail(e.retryable()
                                ? "Batch " + batchNumber + " failed after " + attempt + " attempts: " + e.getMessage()
                                : "Batch " + batchNumber + " failed: " + e.getMessage());
                        return false;
                    }
                    log.warn("Job {} batch {} attempt {}/{} failed, retrying in {}ms: {}",
                            job.id(), batchNumber, attempt, retryPolicy.maxAttempts(),
                            retryPolicy.delayFor(attempt).toMillis(), e.getMessage());
                    retryPolicy.sleep(attempt);
                    if (honorSignals()) {
                        return false;
                    }
                    attempt++;
                }
            }
        }

        private void attemptBatch(int batchNumber) throws BatchFailureException, InterruptedException {
            LineBatch batch;
            try {
                batch = reader().read(job.nextStartLine(), job.batchSize());
            } catch (LineSourceException e) {
                closeReader();
                throw new BatchFailureException(e.getMessage(), e.isRetryable(), e);
            }

            if (job.totalLines() == null && batch.totalLines() != null) {
                applyTotals(batch.totalLines());
            }

            List<LogLine> lines = batch.lines();
            if (job.totalLines() != null) {
                int remaining = Math.max(0, job.totalLines() - job.linesProcessed());
                if (lines.size() > remaining) {
                    lines = lines.subList(0, remaining);
                }
            }

            if (lines.isEmpty()) {
                // the source has nothing left: what is committed is the whole job
                job = jobRepository.update(job.toBuilder()
                        .totalLines(job.linesProcessed())
                        .totalBatches(job.currentBatch())
                        .build());
                log.debug("Job {} reached end of file after {} batches", job.id(), job.currentBatch());
                return;
            }

            BatchResult result = batchProcessor.process(job, batchNumber, lines);
            boolean reachedEnd = batch.last()
                    || (job.maxBatches() != null && batchNumber >= job.maxBatches());
            commit(batchNumber, result, reachedEnd);
        }

        private void applyTotals(int fileLines) {
            int batchSize = job.batchSize();
            int totalBatches = (fileLines + batchSize - 1) / batchSize;
            if (job.maxBatches() != null) {
                totalBatches = Math.min(totalBatches, job.maxBatches());
            }
            int totalLines = (int) Math.min(fileLines, (long) totalBatches * batchSize);
            job = jobRepository.update(job.toBuilder()
                    .totalLines(totalLines)
                    .totalBatches(totalBatches)
                    .build());
            log.info("Job {}: {} lines in {} batches", job.id(), totalLines, totalBatches);
        }

        private void commit(int batchNumber, BatchResult result, boolean reachedEnd) {
            Instant now = clock.instant();
            int linesProcessed = job.linesProcessed() + result.linesAnalyzed();

            AnalysisJob.Builder builder = job.toBuilder()
                    .currentBatch(batchNumber)
                    .linesProcessed(linesProcessed)
                    .issuesFound(job.issuesFound() + result.issuesFound())
                    .alertsCreated(job.alertsCreated() + result.alertsCreated())
                    .putMetadata("lastBatchCompletedAt", now.toString())
                    .putMetadata("lastBatchProcessingTimeMs", result.elapsed().toMillis())
                    .putMetadata("batchHistory", appendBounded(job.metadata().get("batchHistory"),
                            historyEntry(batchNumber, result, now), BATCH_HISTORY_SIZE));

            Integer totalBatches = job.totalBatches();
            if (totalBatches == null && reachedEnd) {
                totalBatches = batchNumber;
                builder.totalBatches(batchNumber).totalLines(linesProcessed);
            }
            builder.estimatedEndTime(estimateEnd(job.startTime(), batchNumber, totalBatches, now));

            job = jobRepository.update(builder.build());
            log.debug("Job {} committed batch {}/{} ({} lines processed)",
                    job.id(), batchNumber, totalBatches != null ? totalBatches : "?", linesProcessed);
            eventBus.publish(JobEvent.of(JobEvent.Type.BATCH_COMPLETED, job));
        }

        private void recordFailure(int batchNumber, int attempt, BatchFailureException e) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("batch", batchNumber);
            entry.put("attempt", attempt);
            entry.put("error", e.getMessage());
            entry.put("timestamp", clock.instant().toString());
            job = jobRepository.update(job.toBuilder()
                    .putMetadata("errors", appendBounded(job.metadata().get("errors"), entry, ERROR_HISTORY_SIZE))
                    .build());
            eventBus.publish(JobEvent.of(JobEvent.Type.BATCH_FAILED, job, e.getMessage()));
        }

        private LineReader reader() throws LineSourceException {
            if (reader == null) {
                reader = lineSource.open(job.fileId());
            }
            return reader;
        }

        private void closeReader() {
            if (reader != null) {
                reader.close();
                reader = null;
            }
        }

        @Override
        public void close() {
            closeReader();
        }
    }

    static Instant estimateEnd(Instant startTime, int currentBatch, Integer totalBatches, Instant now) {
        if (startTime == null || totalBatches == null || currentBatch <= 0) {
            return null;
        }
        Duration elapsed = Duration.between(startTime, now);
        return startTime.plus(elapsed.dividedBy(currentBatch).multipliedBy(totalBatches));
    }

    private static Map<String, Object> historyEntry(int batchNumber, BatchResult result, Instant now) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("batch", batchNumber);
        entry.put("lines", result.linesAnalyzed());
        entry.put("issues", result.issuesFound());
        entry.put("alerts", result.alertsCreated());
        entry.put("processingTimeMs", result.elapsed().toMillis());
        entry.put("completedAt", now.toString());
        return entry;
    }

    private static List<Object> appendBounded(Object existing, Object entry, int limit) {
        List<Object> list = new ArrayList<>();
        if (existing instanceof List<?> previous) {
            list.addAll(previous);
        }
        list.add(entry);
        if (list.size() > limit) {
            return new ArrayList<>(list.subList(list.size() - limit, list.size()));
        }
        return list;
    }
}
