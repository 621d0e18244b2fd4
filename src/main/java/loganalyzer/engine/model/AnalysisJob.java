package loganalyzer.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of an analysis job record.
 * Progress counters are written only by the worker that owns the job;
 * the request flags may be set by anyone.
 */
public final class AnalysisJob {
    private final String id;
    private final String fileId;
    private final String organizationId;
    private final String userId;
    private final JobStatus status;
    private final int batchSize;
    private final Integer maxBatches;
    private final int currentBatch; // number of committed batches
    private final Integer totalBatches;
    private final int linesProcessed;
    private final Integer totalLines;
    private final int issuesFound;
    private final int alertsCreated;
    private final boolean pauseRequested;
    private final boolean cancelRequested;
    private final Instant startTime;
    private final Instant endTime;
    private final Instant estimatedEndTime;
    private final String errorMessage;
    private final Map<String, Object> metadata;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private AnalysisJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.fileId = Objects.requireNonNull(builder.fileId, "fileId is required");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId is required");
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = builder.batchSize;
        this.maxBatches = builder.maxBatches;
        this.currentBatch = builder.currentBatch;
        this.totalBatches = builder.totalBatches;
        this.linesProcessed = builder.linesProcessed;
        this.totalLines = builder.totalLines;
        this.issuesFound = builder.issuesFound;
        this.alertsCreated = builder.alertsCreated;
        this.pauseRequested = builder.pauseRequested;
        this.cancelRequested = builder.cancelRequested;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.estimatedEndTime = builder.estimatedEndTime;
        this.errorMessage = builder.errorMessage;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.version = builder.version;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String fileId() {
        return fileId;
    }

    public String organizationId() {
        return organizationId;
    }

    public String userId() {
        return userId;
    }

    public JobStatus status() {
        return status;
    }

    public int batchSize() {
        return batchSize;
    }

    public Integer maxBatches() {
        return maxBatches;
    }

    public int currentBatch() {
        return currentBatch;
    }

    public Integer totalBatches() {
        return totalBatches;
    }

    public int linesProcessed() {
        return linesProcessed;
    }

    public Integer totalLines() {
        return totalLines;
    }

    public int issuesFound() {
        return issuesFound;
    }

    public int alertsCreated() {
        return alertsCreated;
    }

    public boolean pauseRequested() {
        return pauseRequested;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public Instant estimatedEndTime() {
        return estimatedEndTime;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public long version() {
        return version;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Progress in percent of known total lines, 0 while the total is unknown */
    public int progressPercent() {
        if (totalLines == null || totalLines == 0) {
            return isTerminal() && status == JobStatus.COMPLETED ? 100 : 0;
        }
        return Math.min(100, (int) Math.round(linesProcessed * 100.0 / totalLines));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True once the total is known and every batch has been committed */
    public boolean allBatchesCommitted() {
        return totalBatches != null && currentBatch >= totalBatches;
    }

    /** First line (0-based) of the next batch to process */
    public long nextStartLine() {
        return (long) currentBatch * batchSize;
    }

    public boolean canBePaused() {
        return status == JobStatus.QUEUED || status == JobStatus.RUNNING;
    }

    public boolean canBeResumed() {
        return status == JobStatus.PAUSED;
    }

    public boolean canBeCancelled() {
        return status.isActive();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .fileId(fileId)
                .organizationId(organizationId)
                .userId(userId)
                .status(status)
                .batchSize(batchSize)
                .maxBatches(maxBatches)
                .currentBatch(currentBatch)
                .totalBatches(totalBatches)
                .linesProcessed(linesProcessed)
                .totalLines(totalLines)
                .issuesFound(issuesFound)
                .alertsCreated(alertsCreated)
                .pauseRequested(pauseRequested)
                .cancelRequested(cancelRequested)
                .startTime(startTime)
                .endTime(endTime)
                .estimatedEndTime(estimatedEndTime)
                .errorMessage(errorMessage)
                .metadata(metadata)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String fileId;
        private String organizationId;
        private String userId;
        private JobStatus status = JobStatus.QUEUED;
        private int batchSize = JobSpec.DEFAULT_BATCH_SIZE;
        private Integer maxBatches;
        private int currentBatch;
        private Integer totalBatches;
        private int linesProcessed;
        private Integer totalLines;
        private int issuesFound;
        private int alertsCreated;
        private boolean pauseRequested;
        private boolean cancelRequested;
        private Instant startTime;
        private Instant endTime;
        private Instant estimatedEndTime;
        private String errorMessage;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder fileId(String fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxBatches(Integer maxBatches) {
            this.maxBatches = maxBatches;
            return this;
        }

        public Builder currentBatch(int currentBatch) {
            this.currentBatch = currentBatch;
            return this;
        }

        public Builder totalBatches(Integer totalBatches) {
            this.totalBatches = totalBatches;
            return this;
        }

        public Builder linesProcessed(int linesProcessed) {
            this.linesProcessed = linesProcessed;
            return this;
        }

        public Builder totalLines(Integer totalLines) {
            this.totalLines = totalLines;
            return this;
        }

        public Builder issuesFound(int issuesFound) {
            this.issuesFound = issuesFound;
            return this;
        }

        public Builder alertsCreated(int alertsCreated) {
            this.alertsCreated = alertsCreated;
            return this;
        }

        public Builder pauseRequested(boolean pauseRequested) {
            this.pauseRequested = pauseRequested;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder estimatedEndTime(Instant estimatedEndTime) {
            this.estimatedEndTime = estimatedEndTime;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        /** Replace the whole metadata bag */
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public AnalysisJob build() {
            return new AnalysisJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnalysisJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AnalysisJob{id='" + id + "', status=" + status
                + ", batch=" + currentBatch + "/" + (totalBatches != null ? totalBatches : "?")
                + ", progress=" + progressPercent() + "%}";
    }
}
