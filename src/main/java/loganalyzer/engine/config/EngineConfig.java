package loganalyzer.engine.config;

import loganalyzer.engine.model.Severity;

import java.time.Duration;

/**
 * Configuration holder for the analysis engine.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/loganalyzer;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Worker pool
    private int workerCount = 4;

    // Batch retry settings
    private int maxBatchAttempts = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(1);
    private Duration retryMaxDelay = Duration.ofSeconds(30);

    // Analysis settings
    private Duration analysisTimeout = Duration.ofSeconds(120);
    private String analysisEndpoint = "http://localhost:8090/api/v1/analyze";
    private String analysisApiKey = null;
    private Severity alertThreshold = Severity.MEDIUM;

    // Line source
    private String logDirectory = "./data/logs";

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String dbUrl = System.getenv("LOGANALYZER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String workers = System.getenv("LOGANALYZER_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.workerCount = Integer.parseInt(workers.trim());
        }

        String maxAttempts = System.getenv("LOGANALYZER_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxBatchAttempts = Integer.parseInt(maxAttempts.trim());
        }

        String timeoutSeconds = System.getenv("LOGANALYZER_ANALYSIS_TIMEOUT_SECONDS");
        if (timeoutSeconds != null && !timeoutSeconds.isBlank()) {
            config.analysisTimeout = Duration.ofSeconds(Long.parseLong(timeoutSeconds.trim()));
        }

        String endpoint = System.getenv("LOGANALYZER_ANALYSIS_ENDPOINT");
        if (endpoint != null && !endpoint.isBlank()) {
            config.analysisEndpoint = endpoint;
        }

        String apiKey = System.getenv("LOGANALYZER_ANALYSIS_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.analysisApiKey = apiKey;
        }

        String threshold = System.getenv("LOGANALYZER_ALERT_THRESHOLD");
        if (threshold != null && !threshold.isBlank()) {
            config.alertThreshold = Severity.parse(threshold);
        }

        String logDir = System.getenv("LOGANALYZER_LOG_DIR");
        if (logDir != null && !logDir.isBlank()) {
            config.logDirectory = logDir;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int workerCount() {
        return workerCount;
    }

    public int maxBatchAttempts() {
        return maxBatchAttempts;
    }

    public Duration retryBaseDelay() {
        return retryBaseDelay;
    }

    public Duration retryMaxDelay() {
        return retryMaxDelay;
    }

    public Duration analysisTimeout() {
        return analysisTimeout;
    }

    public String analysisEndpoint() {
        return analysisEndpoint;
    }

    public String analysisApiKey() {
        return analysisApiKey;
    }

    public boolean hasAnalysisApiKey() {
        return analysisApiKey != null && !analysisApiKey.isBlank();
    }

    public Severity alertThreshold() {
        return alertThreshold;
    }

    public String logDirectory() {
        return logDirectory;
    }

    // Fluent setters for testing/customization
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public EngineConfig withWorkerCount(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workers;
        return this;
    }

    public EngineConfig withMaxBatchAttempts(int attempts) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("maxBatchAttempts must be positive");
        }
        this.maxBatchAttempts = attempts;
        return this;
    }

    public EngineConfig withRetryDelays(Duration base, Duration max) {
        this.retryBaseDelay = base;
        this.retryMaxDelay = max;
        return this;
    }

    public EngineConfig withAnalysisTimeout(Duration timeout) {
        this.analysisTimeout = timeout;
        return this;
    }

    public EngineConfig withAnalysisEndpoint(String endpoint) {
        this.analysisEndpoint = endpoint;
        return this;
    }

    public EngineConfig withAnalysisApiKey(String apiKey) {
        this.analysisApiKey = apiKey;
        return this;
    }

    public EngineConfig withAlertThreshold(Severity threshold) {
        this.alertThreshold = threshold;
        return this;
    }

    public EngineConfig withLogDirectory(String directory) {
        this.logDirectory = directory;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", workers=" + workerCount +
                ", maxBatchAttempts=" + maxBatchAttempts +
                ", analysisTimeout=" + analysisTimeout +
                ", alertThreshold=" + alertThreshold +
                ", logDirectory='" + logDirectory + '\'' +
                ", apiKeySet=" + hasAnalysisApiKey() +
                '}';
    }
}
