package loganalyzer.engine.scheduler;

import loganalyzer.engine.config.EngineConfig;
import loganalyzer.engine.error.InvalidStateException;
import loganalyzer.engine.error.JobNotFoundException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.ControlResult;
import loganalyzer.engine.model.JobSpec;
import loganalyzer.engine.model.JobStatus;
import loganalyzer.engine.repository.JobRepository;
import loganalyzer.engine.service.JobController;
import loganalyzer.engine.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits jobs to a fixed pool of workers and routes control requests.
 *
 * A job id is held in the {@link WorkerRegistry} from admission until its
 * worker returns, so no job ever runs on two workers. Admission, control
 * requests and worker release all happen under this object's monitor.
 *
 * Usage:
 *
 * <pre>
 * JobScheduler scheduler = deps.jobScheduler();
 * scheduler.start(); // recovers RUNNING and QUEUED jobs
 * AnalysisJob job = scheduler.submit(spec);
 * scheduler.requestPause(job.id());
 * </pre>
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobRepository jobRepository;
    private final JobService jobService;
    private final JobController controller;
    private final ExecutorService workers;
    private final WorkerRegistry registry = new WorkerRegistry();
    private final Set<String> pendingResumes = new HashSet<>();
    private final int workerCount;

    private volatile boolean running = false;

    public JobScheduler(JobRepository jobRepository, JobService jobService, JobController controller,
            EngineConfig config) {
        this.jobRepository = jobRepository;
        this.jobService = jobService;
        this.controller = controller;
        this.workerCount = config.workerCount();
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "analysis-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start admitting jobs and recover the ones a previous process left behind.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Job scheduler already running");
            return;
        }
        running = true;
        int recovered = recover();
        log.info("Job scheduler started with {} workers ({} jobs recovered)", workerCount, recovered);
    }

    /**
     * Re-admit RUNNING jobs (interrupted by a crash or shutdown) and then QUEUED ones.
     *
     * @return number of jobs admitted
     */
    synchronized int recover() {
        int admitted = 0;
        List<AnalysisJob> interrupted = jobRepository.findByStatus(JobStatus.RUNNING);
        for (AnalysisJob job : interrupted) {
            if (admit(job.id())) {
                admitted++;
                log.info("Recovering job {} at batch {}", job.id(), job.currentBatch() + 1);
            }
        }
        for (AnalysisJob job : jobRepository.findByStatus(JobStatus.QUEUED)) {
            if (admit(job.id())) {
                admitted++;
            }
        }
        return admitted;
    }

    /**
     * Create a job and queue it for execution.
     */
    public AnalysisJob submit(JobSpec spec) {
        AnalysisJob job = jobService.createJob(spec);
        synchronized (this) {
            if (!admit(job.id())) {
                log.debug("Job {} stays queued until the scheduler starts", job.id());
            }
        }
        return job;
    }

    /**
     * Ask a queued or running job to pause at its next batch boundary.
     */
    public synchronized ControlResult requestPause(String jobId) {
        AnalysisJob job = load(jobId);
        if (job.isTerminal()) {
            throw InvalidStateException.forOperation("paused", jobId, job.status());
        }
        if (job.status() == JobStatus.PAUSED) {
            if (pendingResumes.remove(jobId)) {
                return ControlResult.ACCEPTED;
            }
            if (!registry.isHeld(jobId)) {
                return ControlResult.NO_OP;
            }
            // resumed but not yet picked up by a worker: pause again at its first boundary
        }
        pendingResumes.remove(jobId);
        if (job.pauseRequested() || !jobRepository.requestPause(jobId)) {
            return noOpUnlessFinished(jobId, "paused");
        }
        log.info("Pause requested for job {}", jobId);
        return ControlResult.ACCEPTED;
    }

    /**
     * Continue a paused job from its next uncommitted batch. A no-op for
     * jobs that already finished.
     */
    public synchronized ControlResult requestResume(String jobId) {
        AnalysisJob job = load(jobId);
        if (job.isTerminal()) {
            log.debug("Job {} is already {}, nothing to resume", jobId, job.status());
            return ControlResult.NO_OP;
        }
        if (job.status() != JobStatus.PAUSED) {
            // a pause that is still pending would leave the job paused once honored
            if (job.pauseRequested() && registry.isHeld(jobId)) {
                return pendingResumes.add(jobId) ? ControlResult.ACCEPTED : ControlResult.NO_OP;
            }
            return ControlResult.NO_OP;
        }
        if (!running) {
            throw new IllegalStateException("Job scheduler is not running");
        }
        if (registry.isHeld(jobId)) {
            // the pausing worker has not returned yet
            return pendingResumes.add(jobId) ? ControlResult.ACCEPTED : ControlResult.NO_OP;
        }
        resume(job);
        return ControlResult.APPLIED;
    }

    /**
     * Cancel a job. A paused job that no worker holds is cancelled right away;
     * otherwise its worker stops at the next batch boundary.
     */
    public synchronized ControlResult requestCancel(String jobId) {
        AnalysisJob job = load(jobId);
        if (job.status() == JobStatus.CANCELLED) {
            return ControlResult.NO_OP;
        }
        if (job.isTerminal()) {
            throw InvalidStateException.forOperation("cancelled", jobId, job.status());
        }
        pendingResumes.remove(jobId);
        if (job.cancelRequested() || !jobRepository.requestCancel(jobId)) {
            return noOpUnlessFinished(jobId, "cancelled");
        }
        log.info("Cancel requested for job {}", jobId);
        if (job.status() == JobStatus.PAUSED && !registry.isHeld(jobId)) {
            controller.cancelIdle(jobId);
            return ControlResult.APPLIED;
        }
        return ControlResult.ACCEPTED;
    }

    /**
     * Current snapshot of a job.
     *
     * @throws JobNotFoundException if no such job exists
     */
    public AnalysisJob getStatus(String jobId) {
        return jobService.getJob(jobId);
    }

    /**
     * Ids of jobs currently held by a worker, queued in the pool or executing.
     */
    public Set<String> activeJobIds() {
        return registry.snapshot();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop the pool. Workers are interrupted and leave their jobs RUNNING
     * for the next start to recover.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }

        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Job scheduler workers did not stop in time");
            } else {
                log.info("Job scheduler stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        synchronized (this) {
            registry.clear();
            pendingResumes.clear();
        }
    }

    @Override
    public void close() {
        stop();
        workers.shutdownNow();
    }

    private AnalysisJob load(String jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * A flag could not be raised: either it is already set or the job
     * finished since it was loaded. Caller holds the monitor.
     */
    private ControlResult noOpUnlessFinished(String jobId, String operation) {
        AnalysisJob current = load(jobId);
        if (current.isTerminal()
                && !(current.status() == JobStatus.CANCELLED && "cancelled".equals(operation))) {
            throw InvalidStateException.forOperation(operation, jobId, current.status());
        }
        return ControlResult.NO_OP;
    }

    /**
     * Admit a PAUSED job again. A pause request raised after it paused is
     * dropped first. Caller holds the monitor.
     */
    private void resume(AnalysisJob job) {
        if (jobRepository.withdrawPause(job.id())) {
            log.debug("Dropped stale pause request of job {}", job.id());
        }
        admit(job.id());
        log.info("Resumed job {} at batch {}", job.id(), job.currentBatch() + 1);
    }

    /**
     * Hand a job to the pool unless a worker already holds it. Caller holds the monitor.
     */
    private boolean admit(String jobId) {
        if (!running) {
            return false;
        }
        if (!registry.tryAcquire(jobId)) {
            log.debug("Job {} is already held by a worker", jobId);
            return false;
        }
        try {
            workers.execute(() -> work(jobId));
            return true;
        } catch (RejectedExecutionException e) {
            registry.release(jobId);
            log.warn("Worker pool rejected job {}: {}", jobId, e.getMessage());
            return false;
        }
    }

    private void work(String jobId) {
        try {
            controller.run(jobId);
        } catch (RuntimeException e) {
            log.error("Worker failed on job {}", jobId, e);
        } finally {
            onWorkerFinished(jobId);
        }
    }

    private synchronized void onWorkerFinished(String jobId) {
        registry.release(jobId);
        boolean resumePending = pendingResumes.remove(jobId);
        if (!running) {
            return;
        }
        try {
            AnalysisJob job = jobRepository.findById(jobId).orElse(null);
            if (job == null || job.status() != JobStatus.PAUSED) {
                return;
            }
            if (job.cancelRequested()) {
                controller.cancelIdle(jobId);
            } else if (resumePending) {
                resume(job);
            }
        } catch (RuntimeException e) {
            log.error("Failed to apply pending requests for job {}", jobId, e);
        }
    }
}
