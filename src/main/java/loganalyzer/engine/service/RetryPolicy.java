package loganalyzer.engine.service;

import loganalyzer.engine.config.EngineConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff for batch attempts:
 * the delay after attempt {@code n} is {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay}.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy fromConfig(EngineConfig config) {
        return new RetryPolicy(config.maxBatchAttempts(), config.retryBaseDelay(), config.retryMaxDelay());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Whether another attempt may follow the given (1-based) failed attempt */
    public boolean canRetry(int attempt) {
        return attempt < maxAttempts;
    }

    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = baseDelay.toMillis() << shift;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    /** Sleep the backoff delay that follows the given failed attempt */
    public void sleep(int attempt) throws InterruptedException {
        long millis = delayFor(attempt).toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
