package tgp.scheduler.store;

import tgp.scheduler.exception.DuplicateJobException;
import tgp.scheduler.exception.JobStoreException;
import tgp.scheduler.model.Assignment;
import tgp.scheduler.model.CostBreakdown;
import tgp.scheduler.model.FailureReason;
import tgp.scheduler.model.Job;
import tgp.scheduler.model.JobStatus;
import tgp.scheduler.model.JobType;
import tgp.scheduler.model.Resources;
import tgp.scheduler.model.SlaConstraints;
import tgp.scheduler.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRepository. Transitions are single
 * {@code UPDATE ... WHERE status ...} statements so the database arbitrates
 * concurrent reporters.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, type, cpu_cores, memory_gb, gpu_count, max_latency_ms, budget_usd, deadline,
                                      duration_hours, data_gb, preferred_zone, image, command, submitted_at, status,
                                      pending_since)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            ps.setString(2, job.type().name());
            ps.setInt(3, job.resources().cpuCores());
            ps.setInt(4, job.resources().memoryGb());
            ps.setInt(5, job.resources().gpuCount());
            ps.setLong(6, job.sla().maxLatencyMs());
            setDoubleOrNull(ps, 7, job.sla().budgetUsd());
            setTimestamp(ps, 8, job.sla().deadline());
            ps.setDouble(9, job.estimatedDurationHours());
            ps.setDouble(10, job.estimatedDataGb());
            ps.setString(11, job.preferredZone());
            ps.setString(12, job.image());
            ps.setString(13, job.command());
            Instant submittedAt = job.submittedAt() != null ? job.submittedAt() : Instant.now();
            setTimestamp(ps, 14, submittedAt);
            ps.setString(15, job.status().name());
            setTimestamp(ps, 16, submittedAt);

            ps.executeUpdate();
            conn.commit();
            log.debug("Saved job {}", job.id());
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new DuplicateJobException(job.id());
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new DuplicateJobException(job.id());
            }
            throw new JobStoreException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY submitted_at DESC, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list jobs", e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY submitted_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<Job> findActiveOnNode(String nodeId) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE assigned_node = ? AND status IN ('SCHEDULED', 'RUNNING')
                    ORDER BY scheduled_at, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, nodeId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find jobs on node: " + nodeId, e);
        }
    }

    @Override
    public List<Job> findScheduledBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status IN ('SCHEDULED', 'RUNNING') AND scheduled_at < ?
                    ORDER BY scheduled_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find overdue jobs", e);
        }
    }

    @Override
    public List<Job> findPendingBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status = 'PENDING' AND pending_since < ?
                    ORDER BY pending_since
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find stale pending jobs", e);
        }
    }

    @Override
    public boolean markScheduled(Assignment assignment) {
        String sql = """
                    UPDATE jobs
                    SET status = 'SCHEDULED', assigned_node = ?, compute_usd = ?, data_usd = ?, idle_usd = ?,
                        total_usd = ?, latency_ms = ?, reservation_epoch = ?, scheduled_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        CostBreakdown cost = assignment.cost();
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, assignment.nodeId());
            ps.setDouble(2, cost.computeUsd());
            ps.setDouble(3, cost.dataTransferUsd());
            ps.setDouble(4, cost.idleOpportunityUsd());
            ps.setDouble(5, cost.totalUsd());
            ps.setLong(6, assignment.estimatedLatencyMs());
            ps.setLong(7, assignment.reservationEpoch());
            setTimestamp(ps, 8, assignment.assignedAt());
            ps.setString(9, assignment.jobId());

            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to schedule job: " + assignment.jobId(), e);
        }
    }

    @Override
    public boolean markRunning(String jobId, String nodeId, Instant startedAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'RUNNING', started_at = ?
                    WHERE id = ? AND assigned_node = ? AND status = 'SCHEDULED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, startedAt);
            ps.setString(2, jobId);
            ps.setString(3, nodeId);

            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to start job: " + jobId, e);
        }
    }

    @Override
    public boolean markCompleted(String jobId, String nodeId, Integer exitCode, String output, Instant endedAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'COMPLETED', exit_code = ?, output = ?, ended_at = ?,
                        started_at = COALESCE(started_at, ?)
                    WHERE id = ? AND assigned_node = ? AND status IN ('SCHEDULED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setIntOrNull(ps, 1, exitCode);
            ps.setString(2, output);
            setTimestamp(ps, 3, endedAt);
            setTimestamp(ps, 4, endedAt);
            ps.setString(5, jobId);
            ps.setString(6, nodeId);

            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to complete job: " + jobId, e);
        }
    }

    @Override
    public boolean markFailed(String jobId, String nodeId, FailureReason reason, Integer exitCode, String error,
            Instant endedAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'FAILED', failure_reason = ?, exit_code = ?, error_message = ?, ended_at = ?
                    WHERE id = ? AND assigned_node = ? AND status IN ('SCHEDULED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason.name());
            setIntOrNull(ps, 2, exitCode);
            ps.setString(3, truncate(error));
            setTimestamp(ps, 4, endedAt);
            ps.setString(5, jobId);
            ps.setString(6, nodeId);

            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to fail job: " + jobId, e);
        }
    }

    @Override
    public boolean failPending(String jobId, FailureReason reason, String error, Instant endedAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'FAILED', failure_reason = ?, error_message = ?, ended_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason.name());
            ps.setString(2, truncate(error));
            setTimestamp(ps, 3, endedAt);
            ps.setString(4, jobId);

            return commitUpdate(conn, ps);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to fail pending job: " + jobId, e);
        }
    }

    @Override
    public boolean requeue(String jobId, String nodeId, Instant requeuedAt) {
        String sql = """
                    UPDATE jobs
                    SET status = 'PENDING', assigned_node = NULL, compute_usd = NULL, data_usd = NULL,
                        idle_usd = NULL, total_usd = NULL, latency_ms = NULL, scheduled_at = NULL,
                        started_at = NULL, requeue_count = requeue_count + 1, pending_since = ?
                    WHERE id = ? AND assigned_node = ? AND status IN ('SCHEDULED', 'RUNNING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, requeuedAt);
            ps.setString(2, jobId);
            ps.setString(3, nodeId);

            boolean updated = commitUpdate(conn, ps);
            if (updated) {
                log.debug("Job {} returned to PENDING from node {}", jobId, nodeId);
            }
            return updated;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to requeue job: " + jobId, e);
        }
    }

    @Override
    public int count() {
        return countWhere("SELECT COUNT(*) FROM jobs", null);
    }

    @Override
    public int countByStatus(JobStatus status) {
        return countWhere("SELECT COUNT(*) FROM jobs WHERE status = ?", status.name());
    }

    // Helper methods

    private int countWhere(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    private static boolean commitUpdate(Connection conn, PreparedStatement ps) throws SQLException {
        int updated = ps.executeUpdate();
        conn.commit();
        return updated > 0;
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        Double total = getDoubleOrNull(rs, "total_usd");
        CostBreakdown cost = total == null ? null
                : new CostBreakdown(rs.getDouble("compute_usd"), rs.getDouble("data_usd"),
                        rs.getDouble("idle_usd"), total);
        String failure = rs.getString("failure_reason");

        return Job.builder()
                .id(rs.getString("id"))
                .type(JobType.valueOf(rs.getString("type")))
                .resources(new Resources(rs.getInt("cpu_cores"), rs.getInt("memory_gb"), rs.getInt("gpu_count")))
                .sla(new SlaConstraints(rs.getLong("max_latency_ms"), getDoubleOrNull(rs, "budget_usd"),
                        toInstant(rs.getTimestamp("deadline"))))
                .estimatedDurationHours(rs.getDouble("duration_hours"))
                .estimatedDataGb(rs.getDouble("data_gb"))
                .preferredZone(rs.getString("preferred_zone"))
                .image(rs.getString("image"))
                .command(rs.getString("command"))
                .submittedAt(toInstant(rs.getTimestamp("submitted_at")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .assignedNode(rs.getString("assigned_node"))
                .cost(cost)
                .estimatedLatencyMs(getLongOrNull(rs, "latency_ms"))
                .reservationEpoch(rs.getLong("reservation_epoch"))
                .requeueCount(rs.getInt("requeue_count"))
                .failureReason(failure != null ? FailureReason.valueOf(failure) : null)
                .errorMessage(rs.getString("error_message"))
                .exitCode(getIntOrNull(rs, "exit_code"))
                .output(rs.getString("output"))
                .scheduledAt(toInstant(rs.getTimestamp("scheduled_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .endedAt(toInstant(rs.getTimestamp("ended_at")))
                .build();
    }

    private static String truncate(String error) {
        return error != null && error.length() > 2048 ? error.substring(0, 2048) : error;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private static void setDoubleOrNull(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value != null) {
            ps.setDouble(index, value);
        } else {
            ps.setNull(index, Types.DOUBLE);
        }
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getDoubleOrNull(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
