package loganalyzer;

import loganalyzer.engine.config.Dependencies;
import loganalyzer.engine.config.EngineConfig;
import loganalyzer.engine.core.JobEvent;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.JobSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 *
 * Boots the engine, recovers unfinished jobs and runs until the process is
 * stopped. {@code submit <fileId> <organizationId> <userId> [batchSize]}
 * additionally queues a new job.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config = EngineConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            shutdown.countDown();
        }, "loganalyzer-shutdown"));

        deps.eventBus().subscribe(App::logEvent);
        deps.startScheduler();

        if (args.length > 0) {
            if (!"submit".equals(args[0]) || args.length < 4) {
                System.err.println("Usage: App [submit <fileId> <organizationId> <userId> [batchSize]]");
                System.exit(2);
            }
            try {
                Integer batchSize = args.length > 4 ? Integer.valueOf(args[4]) : null;
                AnalysisJob job = deps.jobScheduler().submit(new JobSpec(args[1], args[2], args[3], batchSize, null));
                log.info("Submitted job {}", job.id());
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Submission rejected: {}", e.getMessage());
                System.exit(1);
            }
        }

        shutdown.await();
    }

    private static void logEvent(JobEvent event) {
        AnalysisJob job = event.job();
        switch (event.type()) {
            case BATCH_COMPLETED -> log.info("Job {}: batch {}/{} ({}%), ETA {}", job.id(), job.currentBatch(),
                    job.totalBatches(), job.progressPercent(), job.estimatedEndTime());
            case FAILED -> log.error("Job {} failed: {}", job.id(), event.detail());
            default -> log.info("Job {}: {}", job.id(), event.type());
        }
    }
}
