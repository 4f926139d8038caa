package taskworker.store;

import java.time.Clock;
import java.util.List;

/**
 * H2 job store, used embedded and in tests. The pool opens H2 in PostgreSQL
 * mode so the shared DDL applies unchanged.
 */
public class H2JobStore extends JdbcJobStore {

    public H2JobStore(Database db, Clock clock) {
        super(db, clock);
    }

    @Override
    protected List<String> schemaStatements() {
        return JobStores.standardSchema();
    }

    @Override
    protected String candidateLockClause() {
        return " FOR UPDATE";
    }
}
