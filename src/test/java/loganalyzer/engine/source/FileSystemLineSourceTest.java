package loganalyzer.engine.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemLineSourceTest {

    @TempDir
    Path dir;

    private void writeLines(String name, int count) throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            lines.add("GET /page/" + i + " 200");
        }
        Files.write(dir.resolve(name), lines, StandardCharsets.UTF_8);
    }

    @Test
    void readsBatchesWithOneBasedLineNumbers() throws Exception {
        writeLines("access.log", 12);
        FileSystemLineSource source = new FileSystemLineSource(dir);

        try (LineReader reader = source.open("access.log")) {
            LineBatch first = reader.read(0, 5);
            assertEquals(5, first.lines().size());
            assertEquals(1, first.lines().get(0).lineNumber());
            assertEquals("GET /page/1 200", first.lines().get(0).content());
            assertEquals(12, first.totalLines());
            assertFalse(first.last());

            LineBatch second = reader.read(5, 5);
            assertEquals(6, second.lines().get(0).lineNumber());

            LineBatch third = reader.read(10, 5);
            assertEquals(2, third.lines().size());
            assertEquals(12, third.lines().get(1).lineNumber());
            assertTrue(third.last());
        }
    }

    @Test
    void undecodableBytesAreReplacedNotFatal() throws Exception {
        byte[] latin1 = {'o', 'k', '\n', 'c', 'a', 'f', (byte) 0xE9, '\n', 'e', 'n', 'd', '\n'};
        Files.write(dir.resolve("legacy.log"), latin1);
        FileSystemLineSource source = new FileSystemLineSource(dir);

        try (LineReader reader = source.open("legacy.log")) {
            LineBatch batch = reader.read(0, 10);
            assertEquals(3, batch.totalLines());
            assertEquals(3, batch.lines().size());
            assertEquals("ok", batch.lines().get(0).content());
            assertEquals("caf\uFFFD", batch.lines().get(1).content());
            assertEquals("end", batch.lines().get(2).content());
            assertTrue(batch.last());
        }
    }

    @Test
    void sameRangeReadsSameLines() throws Exception {
        writeLines("app.log", 30);
        FileSystemLineSource source = new FileSystemLineSource(dir);

        LineBatch viaFirstReader;
        try (LineReader reader = source.open("app.log")) {
            reader.read(0, 10);
            reader.read(10, 10);
            // going back reopens the file
            viaFirstReader = reader.read(10, 10);
        }
        LineBatch viaSecondReader;
        try (LineReader reader = source.open("app.log")) {
            viaSecondReader = reader.read(10, 10);
        }

        assertEquals(viaFirstReader.lines(), viaSecondReader.lines());
        assertEquals(11, viaSecondReader.lines().get(0).lineNumber());
    }

    @Test
    void readPastEndIsEmptyAndLast() throws Exception {
        writeLines("short.log", 3);
        try (LineReader reader = new FileSystemLineSource(dir).open("short.log")) {
            LineBatch batch = reader.read(10, 5);
            assertTrue(batch.isEmpty());
            assertTrue(batch.last());
        }
    }

    @Test
    void emptyFileHasZeroLines() throws Exception {
        Files.createFile(dir.resolve("empty.log"));
        try (LineReader reader = new FileSystemLineSource(dir).open("empty.log")) {
            LineBatch batch = reader.read(0, 50);
            assertTrue(batch.isEmpty());
            assertEquals(0, batch.totalLines());
        }
    }

    @Test
    void missingFileIsNotFound() {
        LineSourceException e = assertThrows(LineSourceException.class,
                () -> new FileSystemLineSource(dir).open("missing.log"));
        assertEquals(LineSourceException.Kind.NOT_FOUND, e.kind());
        assertFalse(e.isRetryable());
    }

    @Test
    void idsEscapingTheDirectoryAreNotFound() throws Exception {
        Path inner = Files.createDirectory(dir.resolve("logs"));
        writeLines("secret.log", 1);

        FileSystemLineSource source = new FileSystemLineSource(inner);
        LineSourceException e = assertThrows(LineSourceException.class, () -> source.open("../secret.log"));
        assertEquals(LineSourceException.Kind.NOT_FOUND, e.kind());
        assertThrows(LineSourceException.class, () -> source.open(""));
    }
}
