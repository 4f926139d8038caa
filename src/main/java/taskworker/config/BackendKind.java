package taskworker.config;

import java.util.Locale;

/**
 * Relational backends the job store can run on.
 * Selected once when the worker is initialized.
 */
public enum BackendKind {
    /** Embedded file database, WAL journal */
    SQLITE("jdbc:sqlite:"),
    /** Embedded or server H2 */
    H2("jdbc:h2:"),
    POSTGRES("jdbc:postgresql:"),
    MYSQL("jdbc:mysql:");

    private final String urlPrefix;

    BackendKind(String urlPrefix) {
        this.urlPrefix = urlPrefix;
    }

    public String urlPrefix() {
        return urlPrefix;
    }

    /**
     * Parse a driver name as written in configuration.
     */
    public static BackendKind fromDriverName(String driver) {
        String d = driver.trim().toLowerCase(Locale.ROOT);
        return switch (d) {
            case "sqlite", "sqlite3" -> SQLITE;
            case "h2" -> H2;
            case "postgres", "postgresql" -> POSTGRES;
            case "mysql", "mariadb" -> MYSQL;
            default -> throw new IllegalArgumentException("Unsupported database driver: " + driver);
        };
    }

    /**
     * Infer the backend from a JDBC url.
     */
    public static BackendKind fromJdbcUrl(String jdbcUrl) {
        for (BackendKind kind : values()) {
            if (jdbcUrl.startsWith(kind.urlPrefix)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Cannot infer database driver from url: " + jdbcUrl);
    }
}
