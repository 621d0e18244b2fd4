package loganalyzer.engine.support;

import loganalyzer.engine.model.LogLine;
import loganalyzer.engine.source.LineBatch;
import loganalyzer.engine.source.LineReader;
import loganalyzer.engine.source.LineSource;
import loganalyzer.engine.source.LineSourceException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Line source over in-memory files. Line {@code i} (1-based) of a generated
 * file reads {@code "line i"}.
 */
public class InMemoryLineSource implements LineSource {

    private final Map<String, List<String>> files = new ConcurrentHashMap<>();
    private final AtomicInteger failingReads = new AtomicInteger();
    private final AtomicInteger opens = new AtomicInteger();
    private volatile boolean reportTotals = true;

    public InMemoryLineSource addFile(String fileId, int lineCount) {
        List<String> lines = new ArrayList<>(lineCount);
        for (int i = 1; i <= lineCount; i++) {
            lines.add("line " + i);
        }
        files.put(fileId, lines);
        return this;
    }

    public InMemoryLineSource addFile(String fileId, List<String> lines) {
        files.put(fileId, List.copyOf(lines));
        return this;
    }

    /** Hide the line count, like a streamed source */
    public InMemoryLineSource withoutTotals() {
        this.reportTotals = false;
        return this;
    }

    /** Make the next {@code count} reads fail with a retryable error */
    public void failNextReads(int count) {
        failingReads.set(count);
    }

    public int opens() {
        return opens.get();
    }

    @Override
    public LineReader open(String fileId) throws LineSourceException {
        List<String> lines = files.get(fileId);
        if (lines == null) {
            throw LineSourceException.notFound(fileId);
        }
        opens.incrementAndGet();
        return new LineReader() {
            @Override
            public LineBatch read(long startLine, int count) throws LineSourceException {
                if (failingReads.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                    throw LineSourceException.readFailure(fileId, new IOException("simulated read failure"));
                }
                int from = (int) Math.min(startLine, lines.size());
                int to = Math.min(from + count, lines.size());
                List<LogLine> batch = new ArrayList<>();
                for (int i = from; i < to; i++) {
                    batch.add(new LogLine(i + 1, lines.get(i)));
                }
                return new LineBatch(batch, to >= lines.size(), reportTotals ? lines.size() : null);
            }

            @Override
            public void close() {
            }
        };
    }
}
