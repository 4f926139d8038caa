package taskworker.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;

/**
 * Embedded SQLite job store.
 *
 * SQLite has no row locks, and in WAL mode a transaction that reads first
 * cannot upgrade to a writer once another connection has committed. The
 * claim is therefore one {@code UPDATE ... RETURNING} statement, which takes
 * the write lock before it reads and waits on {@code busy_timeout} when
 * another process holds it.
 */
public class SqliteJobStore extends JdbcJobStore {

    public SqliteJobStore(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected List<String> schemaStatements() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS scheduled_job (
                    id              TEXT PRIMARY KEY,
                    task_name       TEXT NOT NULL,
                    payload         TEXT NOT NULL,
                    status          TEXT NOT NULL,
                    scheduled_at_ms INTEGER NOT NULL,
                    enqueue_seq     INTEGER NOT NULL,
                    result          TEXT,
                    fail_message    TEXT,
                    attempts        INTEGER NOT NULL DEFAULT 0,
                    claimed_at_ms   INTEGER,
                    created_at_ms   INTEGER NOT NULL,
                    finished_at_ms  INTEGER
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS execution_audit (
                    id             TEXT PRIMARY KEY,
                    task_name      TEXT NOT NULL,
                    trigger_kind   TEXT NOT NULL,
                    started_at_ms  INTEGER NOT NULL,
                    finished_at_ms INTEGER NOT NULL,
                    output         TEXT,
                    fail_message   TEXT
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_scheduled_job_due ON scheduled_job(status, scheduled_at_ms, enqueue_seq)",
                "CREATE INDEX IF NOT EXISTS idx_execution_audit_task ON execution_audit(task_name, started_at_ms)");
    }

    @Override
    protected String claimOne(Connection conn, long nowMs) throws SQLException {
        String sql = """
                    UPDATE scheduled_job
                    SET status = 'RUNNING', claimed_at_ms = ?, attempts = attempts + 1
                    WHERE id = (
                        SELECT id FROM scheduled_job
                        WHERE status = 'PENDING' AND scheduled_at_ms <= ?
                        ORDER BY scheduled_at_ms, enqueue_seq
                        LIMIT 1)
                    RETURNING id
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
