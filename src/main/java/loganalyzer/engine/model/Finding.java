package loganalyzer.engine.model;

import java.util.Objects;

/**
 * A candidate security issue reported by the classifier for one log line.
 */
public record Finding(long lineNumber, Severity severity, String issueType, String description) {

    public Finding {
        Objects.requireNonNull(severity, "severity is required");
        issueType = issueType == null || issueType.isBlank() ? "unknown" : issueType;
        description = description == null || description.isBlank() ? "Security issue detected" : description;
    }
}
