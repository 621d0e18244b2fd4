package loganalyzer.engine.source;

/**
 * Sequential, restartable access to the lines of ingested log files.
 */
public interface LineSource {

    /**
     * Open a file for reading.
     *
     * @param fileId file reference
     * @return a reader positioned at the start of the file
     * @throws LineSourceException NOT_FOUND if the reference is invalid,
     *                             READ_FAILURE on I/O errors
     */
    LineReader open(String fileId) throws LineSourceException;
}
