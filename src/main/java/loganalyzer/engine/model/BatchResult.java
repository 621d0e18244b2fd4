package loganalyzer.engine.model;

import java.time.Duration;

/**
 * Outcome of one successfully processed batch.
 */
public record BatchResult(int linesAnalyzed, int issuesFound, int alertsCreated, Duration elapsed) {

    public BatchResult {
        if (alertsCreated > issuesFound) {
            throw new IllegalArgumentException("alertsCreated cannot exceed issuesFound");
        }
    }
}
