package loganalyzer.engine.source;

/**
 * Open handle on one log file.
 * Identical {@code (startLine, count)} arguments must return identical lines
 * for as long as the file is unchanged, across handles.
 */
public interface LineReader extends AutoCloseable {

    /**
     * Read up to {@code count} lines starting at the 0-based {@code startLine}.
     */
    LineBatch read(long startLine, int count) throws LineSourceException;

    @Override
    void close();
}
