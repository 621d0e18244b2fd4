package loganalyzer.engine.support;

import loganalyzer.engine.config.EngineConfig;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shared helpers for tests that need a database or wait on workers.
 */
public final class TestDatabases {

    private TestDatabases() {
    }

    /** Fresh in-memory H2 database URL */
    public static String memUrl(String name) {
        return "jdbc:h2:mem:test-" + name + "-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    /** Config on a fresh in-memory database with fast retries */
    public static EngineConfig config(String name) {
        return EngineConfig.defaults()
                .withDatabaseUrl(memUrl(name))
                .withDatabasePoolSize(5)
                .withRetryDelays(Duration.ofMillis(5), Duration.ofMillis(20))
                .withAnalysisTimeout(Duration.ofSeconds(10));
    }

    /** Poll until the condition holds or fail after the timeout */
    public static void await(String what, Duration timeout, BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting for " + what);
            }
        }
        if (!condition.getAsBoolean()) {
            fail("Timed out waiting for " + what);
        }
    }
}
