package taskworker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import taskworker.exception.InvalidPayloadException;
import taskworker.exception.StorageUnavailableException;
import taskworker.model.CompleteResult;
import taskworker.model.ExecutionRecord;
import taskworker.model.JobStatus;
import taskworker.model.PushbackResult;
import taskworker.model.ScheduledJob;
import taskworker.model.TriggerKind;
import taskworker.repository.JobStore;
import taskworker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JDBC implementation of JobStore shared by every backend.
 *
 * <p>Claiming is a conditional update: candidates are selected in due order,
 * then {@code UPDATE ... WHERE id = ? AND status = 'PENDING'} moves one of them
 * to RUNNING. A zero-row update means another claimer got there first and the
 * next candidate is tried. Claimers inside this process are also serialized
 * on a lock, so the database only has to arbitrate between processes.
 *
 * <p>Subclasses supply backend-specific DDL, row-lock hints and, where the
 * backend needs it, their own claim statement.
 */
public abstract class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    static final String STALE_CLAIM_MESSAGE = "Claim abandoned: job was still RUNNING past the stale claim threshold";

    private static final int CLAIM_CANDIDATES = 5;

    protected final Database db;
    private final Clock clock;
    private final ReentrantLock claimLock = new ReentrantLock();

    private final Object seqMonitor = new Object();
    private long lastSeq = -1; // -1 until loaded from the table

    protected JdbcJobStore(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    /**
     * DDL statements, each idempotent.
     */
    protected abstract List<String> schemaStatements();

    /**
     * Suffix appended to the candidate select, e.g. {@code FOR UPDATE SKIP LOCKED}.
     */
    protected String candidateLockClause() {
        return "";
    }

    @Override
    public void createTables() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {

            for (String ddl : schemaStatements()) {
                st.execute(ddl);
            }
            conn.commit();

            synchronized (seqMonitor) {
                lastSeq = loadMaxSeq(conn);
            }

            log.info("Job store schema ready ({})", db.backend());
        } catch (SQLException e) {
            throw storageError("create job store tables", e);
        }
    }

    @Override
    public String apply(String taskName, Map<String, Object> payload, Instant scheduledDate) {
        String payloadJson;
        try {
            payloadJson = Jsons.toJson(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload for task " + taskName + " is not serializable", e);
        }

        String sql = """
                    INSERT INTO scheduled_job (id, task_name, payload, status, scheduled_at_ms, enqueue_seq,
                                               attempts, created_at_ms)
                    VALUES (?, ?, ?, ?, ?, ?, 0, ?)
                """;

        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Instant due = scheduledDate != null ? scheduledDate : now;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.setString(2, taskName);
            ps.setString(3, payloadJson);
            ps.setString(4, JobStatus.PENDING.name());
            ps.setLong(5, due.toEpochMilli());
            ps.setLong(6, nextSeq(conn));
            ps.setLong(7, now.toEpochMilli());

            ps.executeUpdate();
            conn.commit();

            log.debug("Enqueued job {} for task {} due {}", id, taskName, due);
            return id;
        } catch (SQLException e) {
            throw storageError("enqueue job for task " + taskName, e);
        }
    }

    @Override
    public Optional<ScheduledJob> claimNext(Instant now) {
        claimLock.lock();
        try (Connection conn = db.getConnection()) {
            try {
                String claimedId = claimOne(conn, now.toEpochMilli());
                if (claimedId == null) {
                    conn.commit();
                    return Optional.empty();
                }

                ScheduledJob claimed = findById(conn, claimedId)
                        .orElseThrow(() -> new SQLException("Claimed job vanished: " + claimedId));
                conn.commit();
                log.debug("Claimed job {} ({})", claimedId, claimed.taskName());
                return Optional.of(claimed);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw storageError("claim next job", e);
        } finally {
            claimLock.unlock();
        }
    }

    /**
     * Move the earliest due PENDING job to RUNNING inside the caller's
     * transaction.
     *
     * @return the claimed id, or null when nothing is due
     */
    protected String claimOne(Connection conn, long nowMs) throws SQLException {
        String selectSql = """
                    SELECT id FROM scheduled_job
                    WHERE status = 'PENDING' AND scheduled_at_ms <= ?
                    ORDER BY scheduled_at_ms, enqueue_seq
                    LIMIT ?
                """ + candidateLockClause();

        String updateSql = """
                    UPDATE scheduled_job
                    SET status = 'RUNNING', claimed_at_ms = ?, attempts = attempts + 1
                    WHERE id = ? AND status = 'PENDING' AND scheduled_at_ms <= ?
                """;

        List<String> candidates = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
            ps.setLong(1, nowMs);
            ps.setInt(2, CLAIM_CANDIDATES);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    candidates.add(rs.getString("id"));
                }
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
            for (String id : candidates) {
                ps.setLong(1, nowMs);
                ps.setString(2, id);
                ps.setLong(3, nowMs);

                if (ps.executeUpdate() == 1) {
                    return id;
                }
                log.debug("Job {} was claimed elsewhere, trying next candidate", id);
            }
        }
        return null;
    }

    @Override
    public CompleteResult complete(ScheduledJob job, String resultJson) {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'COMPLETED', result = ?, fail_message = NULL, finished_at_ms = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        int updated = finish(sql, job.id(), resultJson, "complete");
        if (updated > 0) {
            log.debug("Job {} completed", job.id());
            return CompleteResult.COMPLETED;
        }
        return findById(job.id()).isPresent() ? CompleteResult.ALREADY_FINISHED : CompleteResult.NOT_FOUND;
    }

    @Override
    public PushbackResult pushback(ScheduledJob job, String failMessage) {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'FAILED', fail_message = ?, finished_at_ms = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        int updated = finish(sql, job.id(), failMessage, "push back");
        if (updated > 0) {
            log.debug("Job {} pushed back: {}", job.id(), failMessage);
            return PushbackResult.FAILED;
        }
        return findById(job.id()).isPresent() ? PushbackResult.ALREADY_FINISHED : PushbackResult.NOT_FOUND;
    }

    private int finish(String sql, String jobId, String text, String action) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setStringOrNull(ps, 1, text);
            ps.setLong(2, clock.millis());
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw storageError(action + " job " + jobId, e);
        }
    }

    @Override
    public boolean release(ScheduledJob job) {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'PENDING', claimed_at_ms = NULL, attempts = attempts - 1
                    WHERE id = ? AND status = 'RUNNING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, job.id());
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} released back to PENDING", job.id());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw storageError("release job " + job.id(), e);
        }
    }

    @Override
    public boolean resubmit(String jobId, Instant scheduledDate) {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'PENDING', scheduled_at_ms = ?, enqueue_seq = ?, fail_message = NULL,
                        claimed_at_ms = NULL, finished_at_ms = NULL
                    WHERE id = ? AND status = 'FAILED'
                """;

        Instant due = scheduledDate != null ? scheduledDate : clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, due.toEpochMilli());
            ps.setLong(2, nextSeq(conn));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Job {} resubmitted, due {}", jobId, due);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw storageError("resubmit job " + jobId, e);
        }
    }

    @Override
    public int failStaleClaims(Instant claimedBefore) {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'FAILED', fail_message = ?, finished_at_ms = ?
                    WHERE status = 'RUNNING' AND claimed_at_ms < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, STALE_CLAIM_MESSAGE);
            ps.setLong(2, clock.millis());
            ps.setLong(3, claimedBefore.toEpochMilli());

            int failed = ps.executeUpdate();
            conn.commit();
            return failed;
        } catch (SQLException e) {
            throw storageError("fail stale claims", e);
        }
    }

    @Override
    public Optional<ScheduledJob> findById(String jobId) {
        try (Connection conn = db.getConnection()) {
            Optional<ScheduledJob> job = findById(conn, jobId);
            conn.commit();
            return job;
        } catch (SQLException e) {
            throw storageError("find job " + jobId, e);
        }
    }

    private Optional<ScheduledJob> findById(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM scheduled_job WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapJob(rs));
                }
            }
            return Optional.empty();
        }
    }

    @Override
    public List<ScheduledJob> findByStatus(JobStatus status, int limit) {
        String sql = "SELECT * FROM scheduled_job WHERE status = ? ORDER BY scheduled_at_ms, enqueue_seq LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            List<ScheduledJob> jobs = queryJobs(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw storageError("find jobs by status " + status, e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM scheduled_job WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            int count = 0;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    count = rs.getInt(1);
                }
            }
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw storageError("count jobs", e);
        }
    }

    @Override
    public List<ScheduledJob> findRecent(int limit) {
        String sql = """
                    SELECT * FROM scheduled_job
                    ORDER BY COALESCE(finished_at_ms, claimed_at_ms, created_at_ms) DESC, enqueue_seq DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<ScheduledJob> jobs = queryJobs(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw storageError("find recent jobs", e);
        }
    }

    @Override
    public void saveExecution(ExecutionRecord record) {
        String sql = """
                    INSERT INTO execution_audit (id, task_name, trigger_kind, started_at_ms, finished_at_ms,
                                                 output, fail_message)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.id());
            ps.setString(2, record.taskName());
            ps.setString(3, record.triggerKind().name());
            ps.setLong(4, record.startedAt().toEpochMilli());
            ps.setLong(5, record.finishedAt().toEpochMilli());
            setStringOrNull(ps, 6, record.output());
            setStringOrNull(ps, 7, record.failMessage());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw storageError("save execution record for " + record.taskName(), e);
        }
    }

    @Override
    public List<ExecutionRecord> findExecutions(String taskName, int limit) {
        String sql = taskName != null
                ? "SELECT * FROM execution_audit WHERE task_name = ? ORDER BY started_at_ms DESC LIMIT ?"
                : "SELECT * FROM execution_audit ORDER BY started_at_ms DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            if (taskName != null) {
                ps.setString(i++, taskName);
            }
            ps.setInt(i, limit);

            List<ExecutionRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapExecution(rs));
                }
            }
            conn.commit();
            return records;
        } catch (SQLException e) {
            throw storageError("find execution records", e);
        }
    }

    @Override
    public int countExecutions(String taskName) {
        String sql = taskName != null
                ? "SELECT COUNT(*) FROM execution_audit WHERE task_name = ?"
                : "SELECT COUNT(*) FROM execution_audit";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (taskName != null) {
                ps.setString(1, taskName);
            }
            int count = 0;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    count = rs.getInt(1);
                }
            }
            conn.commit();
            return count;
        } catch (SQLException e) {
            throw storageError("count execution records", e);
        }
    }

    @Override
    public boolean isHealthy() {
        return db.isHealthy();
    }

    // Helper methods

    private long nextSeq(Connection conn) throws SQLException {
        synchronized (seqMonitor) {
            if (lastSeq < 0) {
                lastSeq = loadMaxSeq(conn);
            }
            return ++lastSeq;
        }
    }

    private static long loadMaxSeq(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(enqueue_seq), 0) FROM scheduled_job")) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private List<ScheduledJob> queryJobs(PreparedStatement ps) throws SQLException {
        List<ScheduledJob> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapJob(rs));
            }
        }
        return results;
    }

    private ScheduledJob mapJob(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        Map<String, Object> payload;
        try {
            payload = Jsons.toMap(rs.getString("payload"));
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt payload for job " + id, e);
        }

        return ScheduledJob.builder()
                .id(id)
                .taskName(rs.getString("task_name"))
                .payload(payload)
                .status(JobStatus.valueOf(rs.getString("status")))
                .scheduledDate(Instant.ofEpochMilli(rs.getLong("scheduled_at_ms")))
                .enqueueSeq(rs.getLong("enqueue_seq"))
                .result(rs.getString("result"))
                .failMessage(rs.getString("fail_message"))
                .attempts(rs.getInt("attempts"))
                .claimedAt(getInstantOrNull(rs, "claimed_at_ms"))
                .createdAt(getInstantOrNull(rs, "created_at_ms"))
                .finishedAt(getInstantOrNull(rs, "finished_at_ms"))
                .build();
    }

    private static ExecutionRecord mapExecution(ResultSet rs) throws SQLException {
        return new ExecutionRecord(
                rs.getString("id"),
                rs.getString("task_name"),
                TriggerKind.valueOf(rs.getString("trigger_kind")),
                Instant.ofEpochMilli(rs.getLong("started_at_ms")),
                Instant.ofEpochMilli(rs.getLong("finished_at_ms")),
                rs.getString("output"),
                rs.getString("fail_message"));
    }

    private static Instant getInstantOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static void setStringOrNull(PreparedStatement ps, int index, String value) throws SQLException {
        if (value != null) {
            ps.setString(index, value);
        } else {
            ps.setNull(index, Types.VARCHAR);
        }
    }

    /**
     * Connection-level failures become StorageUnavailableException, the rest
     * are programming or data errors.
     */
    protected static RuntimeException storageError(String action, SQLException e) {
        if (Database.isConnectionFailure(e)) {
            return new StorageUnavailableException("Failed to " + action + ": database unavailable", e);
        }
        return new IllegalStateException("Failed to " + action, e);
    }
}
