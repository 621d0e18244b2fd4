package loganalyzer.engine.source;

import loganalyzer.engine.model.LogLine;

import java.util.List;

/**
 * Lines returned by one read.
 *
 * @param lines      the lines, in file order
 * @param last       true if no line follows this batch
 * @param totalLines line count of the whole file, or null if not known
 */
public record LineBatch(List<LogLine> lines, boolean last, Integer totalLines) {

    public LineBatch {
        lines = List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
