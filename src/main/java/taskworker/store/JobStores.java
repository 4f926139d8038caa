package taskworker.store;

import taskworker.repository.JobStore;

import java.time.Clock;
import java.util.List;

/**
 * Picks the job store implementation for the pool's backend.
 */
public final class JobStores {

    private JobStores() {
    }

    public static JobStore create(Database db, Clock clock) {
        return switch (db.backend()) {
            case SQLITE -> new SqliteJobStore(db, clock);
            case H2 -> new H2JobStore(db, clock);
            case POSTGRES -> new PostgresJobStore(db, clock);
            case MYSQL -> new MysqlJobStore(db, clock);
        };
    }

    /** DDL shared by H2 and PostgreSQL */
    static List<String> standardSchema() {
        return List.of(
                """
                CREATE TABLE IF NOT EXISTS scheduled_job (
                    id              VARCHAR(64) PRIMARY KEY,
                    task_name       VARCHAR(255) NOT NULL,
                    payload         TEXT NOT NULL,
                    status          VARCHAR(16) NOT NULL,
                    scheduled_at_ms BIGINT NOT NULL,
                    enqueue_seq     BIGINT NOT NULL,
                    result          TEXT,
                    fail_message    TEXT,
                    attempts        INT NOT NULL DEFAULT 0,
                    claimed_at_ms   BIGINT,
                    created_at_ms   BIGINT NOT NULL,
                    finished_at_ms  BIGINT
                )
                """,
                """
                CREATE TABLE IF NOT EXISTS execution_audit (
                    id             VARCHAR(64) PRIMARY KEY,
                    task_name      VARCHAR(255) NOT NULL,
                    trigger_kind   VARCHAR(16) NOT NULL,
                    started_at_ms  BIGINT NOT NULL,
                    finished_at_ms BIGINT NOT NULL,
                    output         TEXT,
                    fail_message   TEXT
                )
                """,
                "CREATE INDEX IF NOT EXISTS idx_scheduled_job_due ON scheduled_job(status, scheduled_at_ms, enqueue_seq)",
                "CREATE INDEX IF NOT EXISTS idx_execution_audit_task ON execution_audit(task_name, started_at_ms)");
    }
}
