package taskworker.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import taskworker.config.BackendKind;
import taskworker.config.WorkerConfig;
import taskworker.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;

/**
 * Database connection pool.
 * Uses HikariCP for connection pooling. Schema creation belongs to the job
 * store so that it can use backend-specific DDL.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final BackendKind backend;

    public Database(WorkerConfig config) {
        this(config.requireDatabaseUrl(), config.backend(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, BackendKind backend, int poolSize) {
        this.backend = backend;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskworker-db-pool");
        hikariConfig.setAutoCommit(false);

        switch (backend) {
            case H2 -> hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
            case SQLITE -> {
                // Read by the sqlite driver as connection pragmas
                hikariConfig.addDataSourceProperty("journal_mode", "WAL");
                hikariConfig.addDataSourceProperty("journal_size_limit", "1024");
                hikariConfig.addDataSourceProperty("cache_size", String.valueOf(-1024 * 64));
                hikariConfig.addDataSourceProperty("foreign_keys", "true");
                hikariConfig.addDataSourceProperty("synchronous", "NORMAL");
                hikariConfig.addDataSourceProperty("busy_timeout", "5000");
            }
            default -> {
            }
        }

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (HikariPool.PoolInitializationException e) {
            throw new StorageUnavailableException("Failed to open database pool for " + backend, e);
        }

        log.info("Database pool initialized: {} ({})", jdbcUrl, backend);

        if (backend == BackendKind.SQLITE) {
            validateSqlitePragmas();
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public BackendKind backend() {
        return backend;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * True when the error means the backend cannot be reached, as opposed to a
     * bad statement or constraint violation.
     */
    public static boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private void validateSqlitePragmas() {
        try (Connection conn = getConnection(); Statement st = conn.createStatement()) {
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
            conn.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to validate SQLite pragmas", e);
        }
    }

    private static void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual);
            }
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
