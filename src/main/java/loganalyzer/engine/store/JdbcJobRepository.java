package loganalyzer.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import loganalyzer.engine.error.PersistenceConflictException;
import loganalyzer.engine.model.AnalysisJob;
import loganalyzer.engine.model.JobPage;
import loganalyzer.engine.model.JobQuery;
import loganalyzer.engine.model.JobSignals;
import loganalyzer.engine.model.JobStatus;
import loganalyzer.engine.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String ACTIVE_STATUSES = "('QUEUED', 'RUNNING', 'PAUSED')";

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcJobRepository(Database db) {
        this(db, new ObjectMapper());
    }

    public JdbcJobRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public void save(AnalysisJob job) {
        String sql = """
                    INSERT INTO analysis_jobs (id, file_id, organization_id, user_id, status, batch_size, max_batches,
                        current_batch, total_batches, lines_processed, total_lines, issues_found, alerts_created,
                        pause_requested, cancel_requested, start_time, end_time, estimated_end_time, error_message,
                        metadata, version, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();

            ps.setString(1, job.id());
            ps.setString(2, job.fileId());
            ps.setString(3, job.organizationId());
            ps.setString(4, job.userId());
            ps.setString(5, job.status().name());
            ps.setInt(6, job.batchSize());
            setIntOrNull(ps, 7, job.maxBatches());
            ps.setInt(8, job.currentBatch());
            setIntOrNull(ps, 9, job.totalBatches());
            ps.setInt(10, job.linesProcessed());
            setIntOrNull(ps, 11, job.totalLines());
            ps.setInt(12, job.issuesFound());
            ps.setInt(13, job.alertsCreated());
            ps.setBoolean(14, job.pauseRequested());
            ps.setBoolean(15, job.cancelRequested());
            setInstant(ps, 16, job.startTime());
            setInstant(ps, 17, job.endTime());
            setInstant(ps, 18, job.estimatedEndTime());
            ps.setString(19, job.errorMessage());
            ps.setString(20, writeMetadata(job.metadata()));
            ps.setLong(21, job.version());
            setInstant(ps, 22, createdAt);
            setInstant(ps, 23, job.updatedAt() != null ? job.updatedAt() : createdAt);

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<AnalysisJob> findById(String jobId) {
        String sql = "SELECT * FROM analysis_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();

            if (rs.next()) {
                return Optional.of(mapRow(rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<AnalysisJob> findByStatus(JobStatus... statuses) {
        if (statuses.length == 0) {
            return List.of();
        }
        StringJoiner placeholders = new StringJoiner(", ", "(", ")");
        for (int i = 0; i < statuses.length; i++) {
            placeholders.add("?");
        }
        String sql = "SELECT * FROM analysis_jobs WHERE status IN " + placeholders + " ORDER BY created_at ASC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < statuses.length; i++) {
                ps.setString(i + 1, statuses[i].name());
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status", e);
        }
    }

    @Override
    public JobPage find(JobQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<String> params = new ArrayList<>();
        if (query.organizationId() != null) {
            where.append(" AND organization_id = ?");
            params.add(query.organizationId());
        }
        if (query.status() != null) {
            where.append(" AND status = ?");
            params.add(query.status().name());
        }
        if (query.fileId() != null) {
            where.append(" AND file_id = ?");
            params.add(query.fileId());
        }

        String countSql = "SELECT COUNT(*) FROM analysis_jobs" + where;
        String pageSql = "SELECT * FROM analysis_jobs" + where + " ORDER BY created_at DESC, id LIMIT ? OFFSET ?";

        try (Connection conn = db.getConnection()) {
            long total;
            try (PreparedStatement ps = conn.prepareStatement(countSql)) {
                bindAll(ps, params);
                ResultSet rs = ps.executeQuery();
                rs.next();
                total = rs.getLong(1);
            }

            List<AnalysisJob> jobs;
            try (PreparedStatement ps = conn.prepareStatement(pageSql)) {
                bindAll(ps, params);
                ps.setInt(params.size() + 1, query.limit());
                ps.setInt(params.size() + 2, query.offset());
                jobs = executeQuery(ps);
            }

            return new JobPage(jobs, query.page(), query.limit(), total);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs", e);
        }
    }

    @Override
    public Optional<AnalysisJob> findActiveForFile(String fileId) {
        String sql = "SELECT * FROM analysis_jobs WHERE file_id = ? AND status IN " + ACTIVE_STATUSES
                + " ORDER BY created_at DESC LIMIT 1";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, fileId);
            List<AnalysisJob> jobs = executeQuery(ps);
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find active job for file: " + fileId, e);
        }
    }

    @Override
    public AnalysisJob update(AnalysisJob job, boolean clearPause, boolean clearCancel) {
        String sql = """
                    UPDATE analysis_jobs
                    SET status = ?, current_batch = ?, total_batches = ?, lines_processed = ?, total_lines = ?,
                        issues_found = ?, alerts_created = ?, start_time = ?, end_time = ?, estimated_end_time = ?,
                        error_message = ?, metadata = ?, updated_at = ?, version = version + 1,
                        pause_requested = CASE WHEN CAST(? AS BOOLEAN) THEN FALSE ELSE pause_requested END,
                        cancel_requested = CASE WHEN CAST(? AS BOOLEAN) THEN FALSE ELSE cancel_requested END
                    WHERE id = ? AND version = ?
                """;

        Instant now = Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.status().name());
            ps.setInt(2, job.currentBatch());
            setIntOrNull(ps, 3, job.totalBatches());
            ps.setInt(4, job.linesProcessed());
            setIntOrNull(ps, 5, job.totalLines());
            ps.setInt(6, job.issuesFound());
            ps.setInt(7, job.alertsCreated());
            setInstant(ps, 8, job.startTime());
            setInstant(ps, 9, job.endTime());
            setInstant(ps, 10, job.estimatedEndTime());
            ps.setString(11, job.errorMessage());
            ps.setString(12, writeMetadata(job.metadata()));
            setInstant(ps, 13, now);
            ps.setBoolean(14, clearPause);
            ps.setBoolean(15, clearCancel);
            ps.setString(16, job.id());
            ps.setLong(17, job.version());

            int updated = ps.executeUpdate();
            if (updated == 0) {
                conn.rollback();
                throw new PersistenceConflictException(job.id(), job.version());
            }
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + job.id(), e);
        }

        return job.toBuilder()
                .version(job.version() + 1)
                .updatedAt(now)
                .pauseRequested(!clearPause && job.pauseRequested())
                .cancelRequested(!clearCancel && job.cancelRequested())
                .build();
    }

    @Override
    public Optional<JobSignals> findSignals(String jobId) {
        String sql = "SELECT pause_requested, cancel_requested FROM analysis_jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ResultSet rs = ps.executeQuery();
            if (rs.next()) {
                return Optional.of(new JobSignals(rs.getBoolean("pause_requested"), rs.getBoolean("cancel_requested")));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read signals of job: " + jobId, e);
        }
    }

    @Override
    public boolean requestPause(String jobId) {
        return raiseFlag(jobId, "pause_requested");
    }

    @Override
    public boolean requestCancel(String jobId) {
        return raiseFlag(jobId, "cancel_requested");
    }

    @Override
    public boolean withdrawPause(String jobId) {
        String sql = """
                    UPDATE analysis_jobs SET pause_requested = FALSE, updated_at = ?
                    WHERE id = ? AND pause_requested = TRUE AND status = 'PAUSED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear pause request on job: " + jobId, e);
        }
    }

    @Override
    public boolean forceError(String jobId, String errorMessage) {
        String sql = """
                    UPDATE analysis_jobs
                    SET status = 'ERROR', error_message = ?, end_time = COALESCE(end_time, ?),
                        estimated_end_time = NULL, updated_at = ?, version = version + 1
                    WHERE id = ? AND status IN
                """ + ACTIVE_STATUSES;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Timestamp now = Timestamp.from(Instant.now());
            ps.setString(1, errorMessage);
            ps.setTimestamp(2, now);
            ps.setTimestamp(3, now);
            ps.setString(4, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to force error on job: " + jobId, e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM analysis_jobs WHERE id = ?")) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete job: " + jobId, e);
        }
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    // --- Helpers ---

    private boolean raiseFlag(String jobId, String column) {
        // column is one of two constants, never user input
        String sql = "UPDATE analysis_jobs SET " + column + " = TRUE, updated_at = ? "
                + "WHERE id = ? AND " + column + " = FALSE AND status IN " + ACTIVE_STATUSES;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set " + column + " on job: " + jobId, e);
        }
    }

    private List<AnalysisJob> executeQuery(PreparedStatement ps) throws SQLException {
        List<AnalysisJob> jobs = new ArrayList<>();
        ResultSet rs = ps.executeQuery();
        while (rs.next()) {
            jobs.add(mapRow(rs));
        }
        return jobs;
    }

    private AnalysisJob mapRow(ResultSet rs) throws SQLException {
        return AnalysisJob.builder()
                .id(rs.getString("id"))
                .fileId(rs.getString("file_id"))
                .organizationId(rs.getString("organization_id"))
                .userId(rs.getString("user_id"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .batchSize(rs.getInt("batch_size"))
                .maxBatches(rs.getObject("max_batches", Integer.class))
                .currentBatch(rs.getInt("current_batch"))
                .totalBatches(rs.getObject("total_batches", Integer.class))
                .linesProcessed(rs.getInt("lines_processed"))
                .totalLines(rs.getObject("total_lines", Integer.class))
                .issuesFound(rs.getInt("issues_found"))
                .alertsCreated(rs.getInt("alerts_created"))
                .pauseRequested(rs.getBoolean("pause_requested"))
                .cancelRequested(rs.getBoolean("cancel_requested"))
                .startTime(toInstant(rs.getTimestamp("start_time")))
                .endTime(toInstant(rs.getTimestamp("end_time")))
                .estimatedEndTime(toInstant(rs.getTimestamp("estimated_end_time")))
                .errorMessage(rs.getString("error_message"))
                .metadata(readMetadata(rs.getString("metadata")))
                .version(rs.getLong("version"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job metadata is not serializable", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable job metadata: {}", e.getMessage());
            return Map.of();
        }
    }

    private void bindAll(PreparedStatement ps, List<String> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setString(i + 1, params.get(i));
        }
    }

    private void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
