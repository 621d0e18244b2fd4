package loganalyzer.engine.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import loganalyzer.engine.error.InvalidSpecException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JobSpecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void deserializeFullRequest() throws Exception {
        String json = """
                {
                    "fileId": "access.log",
                    "organizationId": "org-1",
                    "userId": "user-1",
                    "batchSize": 25,
                    "maxBatches": 4
                }
                """;

        JobSpec spec = MAPPER.readValue(json, JobSpec.class);

        assertEquals("access.log", spec.fileId());
        assertEquals("org-1", spec.organizationId());
        assertEquals("user-1", spec.userId());
        assertEquals(25, spec.effectiveBatchSize());
        assertEquals(4, spec.maxBatches());
        assertDoesNotThrow(spec::validate);
    }

    @Test
    void missingBatchSizeUsesDefault() throws Exception {
        JobSpec spec = MAPPER.readValue(
                "{\"fileId\":\"a.log\",\"organizationId\":\"o\",\"userId\":\"u\"}", JobSpec.class);

        assertNull(spec.batchSize());
        assertEquals(JobSpec.DEFAULT_BATCH_SIZE, spec.effectiveBatchSize());
        assertNull(spec.maxBatches());
        assertDoesNotThrow(spec::validate);
    }

    @Test
    void everyAllowedBatchSizeValidates() {
        for (int size : JobSpec.ALLOWED_BATCH_SIZES) {
            assertDoesNotThrow(() -> new JobSpec("f", "o", "u", size).validate());
        }
    }

    @Test
    void rejectsBatchSizeOutsideAllowedSet() {
        InvalidSpecException e = assertThrows(InvalidSpecException.class,
                () -> new JobSpec("f", "o", "u", 7).validate());
        assertTrue(e.getMessage().contains("batchSize"));
    }

    @Test
    void rejectsMissingIds() {
        assertThrows(InvalidSpecException.class, () -> new JobSpec(null, "o", "u", 50).validate());
        assertThrows(InvalidSpecException.class, () -> new JobSpec("f", " ", "u", 50).validate());
        assertThrows(InvalidSpecException.class, () -> new JobSpec("f", "o", "", 50).validate());
    }

    @Test
    void rejectsNonPositiveMaxBatches() {
        assertThrows(InvalidSpecException.class, () -> new JobSpec("f", "o", "u", 50, 0).validate());
    }
}
