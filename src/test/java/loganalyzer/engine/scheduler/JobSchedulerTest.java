package loganalyzer.engine.scheduler;

import loganalyzer.engine.config.Dependencies;
import loganalyzer.engine.config.EngineConfig;
import loganalyzer.engine.error.InvalidStateException;
import loganalyzer.engine.error.JobNotFoundException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.ControlResult;
import loganalyzer.engine.model.JobSpec;
import loganalyzer.engine.model.JobStatus;
import loganalyzer.engine.model.Severity;
import loganalyzer.engine.support.InMemoryLineSource;
import loganalyzer.engine.support.ScriptedAnalysisClient;
import loganalyzer.engine.support.TestDatabases;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scheduler behavior through the fully wired engine.
 */
class JobSchedulerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private EngineConfig config;
    private InMemoryLineSource lines;
    private ScriptedAnalysisClient analysis;
    private Dependencies deps;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = TestDatabases.config("scheduler").withWorkerCount(2);
        lines = new InMemoryLineSource()
                .addFile("a.log", 250)
                .addFile("b.log", 100);
        analysis = new ScriptedAnalysisClient();
        deps = Dependencies.create(config, lines, analysis);
        scheduler = deps.jobScheduler();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private AnalysisJob submit(String fileId) {
        return scheduler.submit(new JobSpec(fileId, "org-1", "user-1", 50));
    }

    private void awaitStatus(String jobId, JobStatus status) {
        TestDatabases.await(jobId + " to be " + status, TIMEOUT,
                () -> scheduler.getStatus(jobId).status() == status);
    }

    private void awaitIdle(String jobId, JobStatus status) {
        awaitStatus(jobId, status);
        TestDatabases.await(jobId + " to be released", TIMEOUT,
                () -> !scheduler.activeJobIds().contains(jobId));
    }

    /** Block every job on a batch until the returned latch is released */
    private CountDownLatch blockBatch(int batchNumber, CountDownLatch reached) {
        CountDownLatch release = new CountDownLatch(1);
        analysis.onBatch(batchNumber, request -> {
            reached.countDown();
            release.await(10, TimeUnit.SECONDS);
        });
        return release;
    }

    @Test
    void submittedJobRunsToCompletion() {
        scheduler.start();
        AnalysisJob job = submit("a.log");

        awaitIdle(job.id(), JobStatus.COMPLETED);

        AnalysisJob done = scheduler.getStatus(job.id());
        assertEquals(5, done.totalBatches());
        assertEquals(250, done.linesProcessed());
        assertTrue(scheduler.activeJobIds().isEmpty());
    }

    @Test
    void poolSizeBoundsConcurrentJobs() throws Exception {
        deps.close();
        deps = Dependencies.create(TestDatabases.config("single").withWorkerCount(1), lines, analysis);
        scheduler = deps.jobScheduler();
        scheduler.start();

        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(1, reached);
        AnalysisJob first = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));
        AnalysisJob second = submit("b.log");

        Thread.sleep(100);
        assertEquals(JobStatus.RUNNING, scheduler.getStatus(first.id()).status());
        assertEquals(JobStatus.QUEUED, scheduler.getStatus(second.id()).status());
        assertTrue(scheduler.activeJobIds().containsAll(List.of(first.id(), second.id())));
        assertEquals(List.of(first.id()), analysis.jobIdsCalled());

        release.countDown();
        awaitIdle(first.id(), JobStatus.COMPLETED);
        awaitIdle(second.id(), JobStatus.COMPLETED);
    }

    @Test
    void repeatedPauseIsNoOp() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(2, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.ACCEPTED, scheduler.requestPause(job.id()));
        assertEquals(ControlResult.NO_OP, scheduler.requestPause(job.id()));

        release.countDown();
        awaitIdle(job.id(), JobStatus.PAUSED);
        assertEquals(ControlResult.NO_OP, scheduler.requestPause(job.id()));
        assertEquals(2, scheduler.getStatus(job.id()).currentBatch());
        assertEquals(0, analysis.callsForBatch(3));
    }

    @Test
    void pausedJobResumesFromNextBatch() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(2, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.ACCEPTED, scheduler.requestPause(job.id()));
        release.countDown();
        awaitIdle(job.id(), JobStatus.PAUSED);

        AnalysisJob paused = scheduler.getStatus(job.id());
        assertEquals(2, paused.currentBatch());
        assertEquals(ControlResult.NO_OP, scheduler.requestPause(job.id()));

        analysis.clearHooks();
        assertEquals(ControlResult.APPLIED, scheduler.requestResume(job.id()));
        awaitIdle(job.id(), JobStatus.COMPLETED);

        assertEquals(250, scheduler.getStatus(job.id()).linesProcessed());
        assertEquals(1, analysis.callsForBatch(3));
    }

    @Test
    void resumeBeforePauseIsHonoredKeepsJobRunning() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(2, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.ACCEPTED, scheduler.requestPause(job.id()));
        assertEquals(ControlResult.ACCEPTED, scheduler.requestResume(job.id()));
        analysis.clearHooks();
        release.countDown();

        awaitIdle(job.id(), JobStatus.COMPLETED);
        assertEquals(250, scheduler.getStatus(job.id()).linesProcessed());
    }

    @Test
    @DisplayName("A pause arriving while a resumed job waits for a worker is not lost")
    void pauseOfResumedJobWaitingForWorker() throws Exception {
        deps.close();
        deps = Dependencies.create(TestDatabases.config("single").withWorkerCount(1), lines, analysis);
        scheduler = deps.jobScheduler();
        scheduler.start();

        CountDownLatch pausedReached = new CountDownLatch(1);
        CountDownLatch pausedRelease = blockBatch(1, pausedReached);
        AnalysisJob paused = submit("b.log");
        assertTrue(pausedReached.await(10, TimeUnit.SECONDS));
        assertEquals(ControlResult.ACCEPTED, scheduler.requestPause(paused.id()));
        pausedRelease.countDown();
        awaitIdle(paused.id(), JobStatus.PAUSED);

        // occupy the only worker
        CountDownLatch busyReached = new CountDownLatch(1);
        CountDownLatch busyRelease = blockBatch(1, busyReached);
        AnalysisJob busy = submit("a.log");
        assertTrue(busyReached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.APPLIED, scheduler.requestResume(paused.id()));
        assertEquals(JobStatus.PAUSED, scheduler.getStatus(paused.id()).status());
        assertEquals(ControlResult.ACCEPTED, scheduler.requestPause(paused.id()));
        assertEquals(ControlResult.NO_OP, scheduler.requestPause(paused.id()));

        busyRelease.countDown();
        awaitIdle(busy.id(), JobStatus.COMPLETED);
        awaitIdle(paused.id(), JobStatus.PAUSED);

        assertEquals(1, scheduler.getStatus(paused.id()).currentBatch());
        assertEquals(1, analysis.calls().stream().filter(r -> r.jobId().equals(paused.id())).count());

        analysis.clearHooks();
        assertEquals(ControlResult.APPLIED, scheduler.requestResume(paused.id()));
        awaitIdle(paused.id(), JobStatus.COMPLETED);
        assertEquals(100, scheduler.getStatus(paused.id()).linesProcessed());
    }

    @Test
    @DisplayName("Cancel of a paused job is applied immediately")
    void cancelWhilePaused() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(2, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));
        scheduler.requestPause(job.id());
        release.countDown();
        awaitIdle(job.id(), JobStatus.PAUSED);
        int callsBefore = analysis.calls().size();

        assertEquals(ControlResult.APPLIED, scheduler.requestCancel(job.id()));

        AnalysisJob cancelled = scheduler.getStatus(job.id());
        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertEquals(2, cancelled.currentBatch());
        assertNotNull(cancelled.endTime());
        Thread.sleep(100);
        assertEquals(callsBefore, analysis.calls().size());
        assertTrue(scheduler.activeJobIds().isEmpty());
    }

    @Test
    @DisplayName("Cancelling twice gives the same end state as cancelling once")
    void cancelIsIdempotent() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(2, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.ACCEPTED, scheduler.requestCancel(job.id()));
        assertEquals(ControlResult.NO_OP, scheduler.requestCancel(job.id()));
        release.countDown();
        awaitIdle(job.id(), JobStatus.CANCELLED);

        assertEquals(ControlResult.NO_OP, scheduler.requestCancel(job.id()));
        AnalysisJob cancelled = scheduler.getStatus(job.id());
        assertEquals(2, cancelled.currentBatch());
        assertEquals(100, cancelled.linesProcessed());
        assertEquals(0, analysis.callsForBatch(3));
    }

    @Test
    void pauseAndCancelOfFinishedJobAreInvalid() {
        scheduler.start();
        AnalysisJob job = submit("b.log");
        awaitIdle(job.id(), JobStatus.COMPLETED);

        assertThrows(InvalidStateException.class, () -> scheduler.requestPause(job.id()));
        assertThrows(InvalidStateException.class, () -> scheduler.requestCancel(job.id()));
        assertEquals(ControlResult.NO_OP, scheduler.requestResume(job.id()));
        assertEquals(JobStatus.COMPLETED, scheduler.getStatus(job.id()).status());
    }

    @Test
    void unknownJobIsNotFound() {
        scheduler.start();

        assertThrows(JobNotFoundException.class, () -> scheduler.requestPause("missing"));
        assertThrows(JobNotFoundException.class, () -> scheduler.requestResume("missing"));
        assertThrows(JobNotFoundException.class, () -> scheduler.requestCancel("missing"));
        assertThrows(JobNotFoundException.class, () -> scheduler.getStatus("missing"));
    }

    @Test
    void resumeOfRunningJobIsNoOp() throws Exception {
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        CountDownLatch release = blockBatch(1, reached);
        AnalysisJob job = submit("b.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        assertEquals(ControlResult.NO_OP, scheduler.requestResume(job.id()));

        release.countDown();
        awaitIdle(job.id(), JobStatus.COMPLETED);
    }

    @Test
    void jobsSubmittedBeforeStartRunOnStart() {
        AnalysisJob job = submit("b.log");
        assertEquals(JobStatus.QUEUED, scheduler.getStatus(job.id()).status());
        assertTrue(scheduler.activeJobIds().isEmpty());

        scheduler.start();

        awaitIdle(job.id(), JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("After a crash following batch 2, restart resumes at batch 3 without re-creating alerts")
    void recoveryResumesAfterLastCommittedBatch() throws Exception {
        analysis.flag("line 10", Severity.HIGH, "brute_force")
                .flag("line 60", Severity.CRITICAL, "rce")
                .flag("line 120", Severity.HIGH, "xss");
        scheduler.start();
        CountDownLatch reached = new CountDownLatch(1);
        blockBatch(3, reached);
        AnalysisJob job = submit("a.log");
        assertTrue(reached.await(10, TimeUnit.SECONDS));

        // crash: workers are interrupted mid-batch and the pool goes away
        deps.close();

        ScriptedAnalysisClient restarted = new ScriptedAnalysisClient()
                .flag("line 10", Severity.HIGH, "brute_force")
                .flag("line 60", Severity.CRITICAL, "rce")
                .flag("line 120", Severity.HIGH, "xss");
        deps = Dependencies.create(config, lines, restarted);
        scheduler = deps.jobScheduler();

        AnalysisJob interrupted = scheduler.getStatus(job.id());
        assertEquals(JobStatus.RUNNING, interrupted.status());
        assertEquals(2, interrupted.currentBatch());
        assertEquals(2, deps.alertStore().countByJob(job.id()));

        scheduler.start();
        awaitIdle(job.id(), JobStatus.COMPLETED);

        AnalysisJob done = scheduler.getStatus(job.id());
        assertEquals(250, done.linesProcessed());
        assertEquals(3, done.issuesFound());
        assertEquals(3, done.alertsCreated());
        assertEquals(3, deps.alertStore().countByJob(job.id()));
        assertEquals(0, restarted.callsForBatch(1));
        assertEquals(0, restarted.callsForBatch(2));
        assertEquals(1, restarted.callsForBatch(3));
        assertTrue(done.metadata().containsKey("recoveredAt"));
    }
}
