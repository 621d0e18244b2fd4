package loganalyzer.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import loganalyzer.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("loganalyzer-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- ANALYSIS JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS analysis_jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            file_id             VARCHAR(256) NOT NULL,
                            organization_id     VARCHAR(64) NOT NULL,
                            user_id             VARCHAR(64) NOT NULL,
                            status              VARCHAR(20) NOT NULL DEFAULT 'QUEUED',
                            batch_size          INT NOT NULL,
                            max_batches         INT,
                            current_batch       INT NOT NULL DEFAULT 0,
                            total_batches       INT,
                            lines_processed     INT NOT NULL DEFAULT 0,
                            total_lines         INT,
                            issues_found        INT NOT NULL DEFAULT 0,
                            alerts_created      INT NOT NULL DEFAULT 0,
                            pause_requested     BOOLEAN NOT NULL DEFAULT FALSE,
                            cancel_requested    BOOLEAN NOT NULL DEFAULT FALSE,
                            start_time          TIMESTAMP,
                            end_time            TIMESTAMP,
                            estimated_end_time  TIMESTAMP,
                            error_message       CLOB,
                            metadata            CLOB,
                            version             BIGINT NOT NULL DEFAULT 0,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- ALERTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS alerts (
                            id                  VARCHAR(64) PRIMARY KEY,
                            dedup_key           VARCHAR(512) NOT NULL,
                            job_id              VARCHAR(64),
                            organization_id     VARCHAR(64) NOT NULL,
                            file_id             VARCHAR(256),
                            line_number         BIGINT,
                            severity            VARCHAR(20) NOT NULL,
                            issue_type          VARCHAR(256),
                            description         CLOB,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_alerts_dedup_key UNIQUE (dedup_key)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON analysis_jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_org_status ON analysis_jobs(organization_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_file_status ON analysis_jobs(file_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_created ON analysis_jobs(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_alerts_job ON alerts(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
