package taskworker.store;

import java.time.Clock;
import java.util.List;

/**
 * MySQL / MariaDB job store.
 * MySQL has no {@code CREATE INDEX IF NOT EXISTS}, so indexes are declared
 * inline with the tables.
 */
public class MysqlJobStore extends JdbcJobStore {

    public MysqlJobStore(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected List<String> schemaStatements() {
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
                    finished_at_ms  BIGINT,
                    INDEX idx_scheduled_job_due (status, scheduled_at_ms, enqueue_seq)
                ) ENGINE=InnoDB
                """,
                """
                CREATE TABLE IF NOT EXISTS execution_audit (
                    id             VARCHAR(64) PRIMARY KEY,
                    task_name      VARCHAR(255) NOT NULL,
                    trigger_kind   VARCHAR(16) NOT NULL,
                    started_at_ms  BIGINT NOT NULL,
                    finished_at_ms BIGINT NOT NULL,
                    output         TEXT,
                    fail_message   TEXT,
                    INDEX idx_execution_audit_task (task_name, started_at_ms)
                ) ENGINE=InnoDB
                """);
    }

    @Override
    protected String candidateLockClause() {
        return " FOR UPDATE SKIP LOCKED";
    }
}
