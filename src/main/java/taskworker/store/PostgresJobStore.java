package taskworker.store;

import java.time.Clock;
import java.util.List;

/**
 * PostgreSQL job store. Candidate rows held by another dispatcher's open
 * claim are skipped instead of waited on.
 */
public class PostgresJobStore extends JdbcJobStore {

    public PostgresJobStore(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected List<String> schemaStatements() {
        return JobStores.standardSchema();
    }

    @Override
    protected String candidateLockClause() {
        return " FOR UPDATE SKIP LOCKED";
    }
}
