package loganalyzer.engine.source;

import loganalyzer.engine.model.LogLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serves log files stored under a directory; the file id is the file name
 * relative to that directory.
 */
public class FileSystemLineSource implements LineSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemLineSource.class);

    private final Path root;

    public FileSystemLineSource(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public LineReader open(String fileId) throws LineSourceException {
        Path file = resolve(fileId);
        if (!Files.isRegularFile(file)) {
            throw LineSourceException.notFound(fileId);
        }

        long lineCount = 0;
        try (BufferedReader reader = newReader(file)) {
            while (reader.readLine() != null) {
                lineCount++;
            }
        } catch (IOException e) {
            throw LineSourceException.readFailure(fileId, e);
        }

        Integer total = lineCount <= Integer.MAX_VALUE ? (int) lineCount : null;
        log.debug("Opened {} ({} lines)", file, lineCount);
        return new FileLineReader(fileId, file, total);
    }

    /** UTF-8 reader that substitutes U+FFFD for bytes that do not decode */
    private static BufferedReader newReader(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }

    private Path resolve(String fileId) throws LineSourceException {
        if (fileId == null || fileId.isBlank()) {
            throw LineSourceException.notFound(String.valueOf(fileId));
        }
        try {
            Path file = root.resolve(fileId).normalize();
            if (!file.startsWith(root)) {
                throw LineSourceException.notFound(fileId);
            }
            return file;
        } catch (InvalidPathException e) {
            throw LineSourceException.notFound(fileId);
        }
    }

    /**
     * Reads forward from the current position; a request behind the cursor
     * reopens the file.
     */
    private static final class FileLineReader implements LineReader {

        private final String fileId;
        private final Path file;
        private final Integer totalLines;

        private BufferedReader reader;
        private long cursor;

        FileLineReader(String fileId, Path file, Integer totalLines) {
            this.fileId = fileId;
            this.file = file;
            this.totalLines = totalLines;
        }

        @Override
        public LineBatch read(long startLine, int count) throws LineSourceException {
            if (startLine < 0 || count <= 0) {
                throw new IllegalArgumentException("startLine must be >= 0 and count > 0");
            }
            try {
                if (reader == null || startLine < cursor) {
                    reopen();
                }
                while (cursor < startLine) {
                    if (reader.readLine() == null) {
                        return new LineBatch(List.of(), true, totalLines);
                    }
                    cursor++;
                }

                List<LogLine> lines = new ArrayList<>(count);
                while (lines.size() < count) {
                    String line = reader.readLine();
                    if (line == null) {
                        return new LineBatch(lines, true, totalLines);
                    }
                    cursor++;
                    lines.add(new LogLine(cursor, line));
                }

                boolean last = totalLines != null ? cursor >= totalLines : !reader.ready();
                return new LineBatch(lines, last, totalLines);
            } catch (IOException e) {
                close();
                throw LineSourceException.readFailure(fileId, e);
            }
        }

        private void reopen() throws IOException {
            close();
            reader = newReader(file);
            cursor = 0;
        }

        @Override
        public void close() {
            if (reader != null) {
                try {
                    reader.close();
                } catch (IOException e) {
                    log.warn("Failed to close {}: {}", file, e.getMessage());
                }
                reader = null;
            }
        }
    }
}
