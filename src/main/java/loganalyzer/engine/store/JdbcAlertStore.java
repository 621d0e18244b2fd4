package loganalyzer.engine.store;

import loganalyzer.engine.analysis.AlertCreationException;
import loganalyzer.engine.analysis.AlertCreator;
import loganalyzer.engine.analysis.AlertRequest;
import loganalyzer.engine.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Alert store backed by the {@code alerts} table.
 *
 * Creation is idempotent on the dedup key: the unique constraint on
 * {@code dedup_key} guarantees one row per key even when two writers race.
 */
public class JdbcAlertStore implements AlertCreator {

    private static final Logger log = LoggerFactory.getLogger(JdbcAlertStore.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcAlertStore(Database db) {
        this.db = db;
    }

    @Override
    public String create(AlertRequest request) throws AlertCreationException {
        try {
            Optional<String> existing = findIdByDedupKey(request.dedupKey());
            if (existing.isPresent()) {
                log.debug("Alert {} already exists for {}", existing.get(), request.dedupKey());
                return existing.get();
            }
            return insert(request);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                // lost the race against a concurrent insert of the same key
                try {
                    Optional<String> winner = findIdByDedupKey(request.dedupKey());
                    if (winner.isPresent()) {
                        return winner.get();
                    }
                } catch (SQLException again) {
                    e.addSuppressed(again);
                }
            }
            throw new AlertCreationException("Failed to create alert " + request.dedupKey(), e);
        }
    }

    private String insert(AlertRequest request) throws SQLException {
        String sql = """
                    INSERT INTO alerts (id, dedup_key, job_id, organization_id, file_id, line_number,
                        severity, issue_type, description, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        String id = UUID.randomUUID().toString();
        Finding finding = request.finding();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            ps.setString(2, request.dedupKey());
            ps.setString(3, request.jobId());
            ps.setString(4, request.organizationId());
            ps.setString(5, request.fileId());
            ps.setLong(6, finding.lineNumber());
            ps.setString(7, finding.severity().name());
            ps.setString(8, finding.issueType());
            ps.setString(9, finding.description());
            ps.setTimestamp(10, Timestamp.from(Instant.now()));
            try {
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }

        log.info("Created {} alert {} for job {} line {} ({})", finding.severity(), id,
                request.jobId(), finding.lineNumber(), finding.issueType());
        return id;
    }

    private Optional<String> findIdByDedupKey(String dedupKey) throws SQLException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT id FROM alerts WHERE dedup_key = ?")) {
            ps.setString(1, dedupKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * Number of alerts stored for a job.
     */
    public int countByJob(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM alerts WHERE job_id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count alerts for job: " + jobId, e);
        }
    }

    /**
     * Whether an alert with the given dedup key exists.
     */
    public boolean exists(String dedupKey) {
        try {
            return findIdByDedupKey(dedupKey).isPresent();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up alert: " + dedupKey, e);
        }
    }
}
