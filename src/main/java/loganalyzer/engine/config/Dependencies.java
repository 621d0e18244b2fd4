package loganalyzer.engine.config;

import loganalyzer.engine.analysis.AnalysisClient;
import loganalyzer.engine.analysis.HttpAnalysisClient;
import loganalyzer.engine.analysis.TimeLimitedAnalysisClient;
import loganalyzer.engine.core.JobEventBus;
import loganalyzer.engine.repository.JobRepository;
import loganalyzer.engine.scheduler.JobScheduler;
import loganalyzer.engine.service.BatchProcessor;
import loganalyzer.engine.service.JobController;
import loganalyzer.engine.service.JobService;
import loganalyzer.engine.service.RetryPolicy;
import loganalyzer.engine.source.FileSystemLineSource;
import loganalyzer.engine.source.LineSource;
import loganalyzer.engine.store.Database;
import loganalyzer.engine.store.JdbcAlertStore;
import loganalyzer.engine.store.JdbcJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // recover and run jobs
 * AnalysisJob job = deps.jobScheduler().submit(spec);
 * // ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final JdbcAlertStore alertStore;
    private final LineSource lineSource;
    private final TimeLimitedAnalysisClient analysisClient;
    private final JobEventBus eventBus;
    private final BatchProcessor batchProcessor;
    private final JobController jobController;
    private final JobService jobService;
    private final JobScheduler jobScheduler;

    private Dependencies(EngineConfig config, LineSource lineSource, AnalysisClient analysisClient) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Stores
        this.jobRepository = new JdbcJobRepository(database);
        this.alertStore = new JdbcAlertStore(database);

        // Collaborators
        this.lineSource = lineSource;
        this.analysisClient = new TimeLimitedAnalysisClient(analysisClient, config.analysisTimeout());
        this.eventBus = new JobEventBus();

        // Services
        this.batchProcessor = new BatchProcessor(this.analysisClient, alertStore, config.alertThreshold());
        this.jobController = new JobController(jobRepository, lineSource, batchProcessor,
                RetryPolicy.fromConfig(config), eventBus);
        this.jobService = new JobService(jobRepository, lineSource);
        this.jobScheduler = new JobScheduler(jobRepository, jobService, jobController, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, reading log files from
     * {@link EngineConfig#logDirectory()} and classifying over HTTP.
     */
    public static Dependencies create(EngineConfig config) {
        return create(config,
                new FileSystemLineSource(Path.of(config.logDirectory())),
                new HttpAnalysisClient(config.analysisEndpoint(), config.analysisApiKey(), config.analysisTimeout()));
    }

    /**
     * Create dependencies with custom collaborators.
     */
    public static Dependencies create(EngineConfig config, LineSource lineSource, AnalysisClient analysisClient) {
        return new Dependencies(config, lineSource, analysisClient);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public JdbcAlertStore alertStore() {
        return alertStore;
    }

    public LineSource lineSource() {
        return lineSource;
    }

    public JobEventBus eventBus() {
        return eventBus;
    }

    public JobController jobController() {
        return jobController;
    }

    public JobService jobService() {
        return jobService;
    }

    public JobScheduler jobScheduler() {
        return jobScheduler;
    }

    /**
     * Start the worker pool and recover unfinished jobs.
     */
    public void startScheduler() {
        jobScheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop workers first so they do not write to a closed pool
        try {
            jobScheduler.close();
        } catch (Exception e) {
            log.warn("Error stopping job scheduler: {}", e.getMessage());
        }

        analysisClient.close();

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
