package loganalyzer.engine.model;

/**
 * One line of an ingested log file.
 *
 * @param lineNumber 1-based position in the file
 * @param content    raw line text
 */
public record LogLine(long lineNumber, String content) {
}
