package loganalyzer.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import loganalyzer.engine.error.InvalidSpecException;

import java.util.List;

/**
 * Submission request for a new analysis job.
 */
public record JobSpec(
        @JsonProperty("fileId") String fileId,
        @JsonProperty("organizationId") String organizationId,
        @JsonProperty("userId") String userId,
        @JsonProperty("batchSize") Integer batchSize,
        @JsonProperty("maxBatches") Integer maxBatches) {

    /** Batch sizes accepted by the engine */
    public static final List<Integer> ALLOWED_BATCH_SIZES = List.of(1, 5, 10, 25, 50, 100);

    public static final int DEFAULT_BATCH_SIZE = 50;

    public JobSpec(String fileId, String organizationId, String userId, int batchSize) {
        this(fileId, organizationId, userId, batchSize, null);
    }

    /** Batch size with the default applied when none was given */
    public int effectiveBatchSize() {
        return batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
    }

    /** Validate the request */
    public void validate() {
        if (fileId == null || fileId.isBlank()) {
            throw new InvalidSpecException("fileId is required");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new InvalidSpecException("organizationId is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidSpecException("userId is required");
        }
        if (!ALLOWED_BATCH_SIZES.contains(effectiveBatchSize())) {
            throw new InvalidSpecException(
                    "batchSize must be one of " + ALLOWED_BATCH_SIZES + ", got " + effectiveBatchSize());
        }
        if (maxBatches != null && maxBatches <= 0) {
            throw new InvalidSpecException("maxBatches must be positive");
        }
    }
}
