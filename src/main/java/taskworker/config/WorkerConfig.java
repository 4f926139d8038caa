package taskworker.config;

import taskworker.exception.MissingDatabaseUriException;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Configuration holder for worker settings.
 * Everything except the database uri has a default.
 */
public final class WorkerConfig {

    public static final String DATABASE_URI = "TASKER_DATABASE_URI";
    /** Host-wide datasource url, consulted when no worker-specific uri is set */
    public static final String FALLBACK_DATABASE_URI = "DATABASE_URL";
    public static final String DRIVER = "TASKER_DRIVER";
    public static final String INTERVAL_TIME = "TASKER_INTERVAL_TIME";
    public static final String POOL_SIZE = "TASKER_POOL_SIZE";
    public static final String DRAIN = "TASKER_DRAIN";
    public static final String TIMEZONE = "TASKER_TIMEZONE";
    public static final String STALE_CLAIM_MINUTES = "TASKER_STALE_CLAIM_MINUTES";
    public static final String ADMIN_PORT = "TASKER_ADMIN_PORT";
    public static final String ADMIN_KEY = "TASKER_ADMIN_KEY";

    // Database settings
    private String databaseUrl = null;
    private BackendKind backend = null; // inferred from the url when unset
    private int databasePoolSize = 4;

    // Dispatch settings
    private Duration pollInterval = Duration.ofSeconds(5);
    private boolean drainMode = false;
    private Duration staleClaimThreshold = Duration.ofMinutes(30);
    private Duration staleClaimCheckInterval = Duration.ofMinutes(1);

    // Trigger settings
    private ZoneId timezone = ZoneOffset.UTC;

    // Admin server settings
    private int adminPort = 0; // 0 = disabled
    private String adminHost = "127.0.0.1";
    private String adminKey = null; // If set, mutating admin calls must send X-Tasker-Key

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    /**
     * Read settings from the host application config.
     * The database uri is resolved from {@value #DATABASE_URI}, then
     * {@value #FALLBACK_DATABASE_URI}.
     */
    public static WorkerConfig fromProperties(Map<String, String> appConfig) {
        WorkerConfig config = new WorkerConfig();

        String dbUrl = firstNonBlank(appConfig.get(DATABASE_URI), appConfig.get(FALLBACK_DATABASE_URI));
        if (dbUrl != null) {
            config.databaseUrl = normalizeUrl(dbUrl);
        }

        String driver = appConfig.get(DRIVER);
        if (driver != null && !driver.isBlank()) {
            config.backend = BackendKind.fromDriverName(driver);
        }

        String interval = appConfig.get(INTERVAL_TIME);
        if (interval != null && !interval.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Integer.parseInt(interval.trim()));
        }

        String poolSize = appConfig.get(POOL_SIZE);
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize.trim());
        }

        String drain = appConfig.get(DRAIN);
        if (drain != null && !drain.isBlank()) {
            config.drainMode = Boolean.parseBoolean(drain.trim());
        }

        String zone = appConfig.get(TIMEZONE);
        if (zone != null && !zone.isBlank()) {
            config.timezone = ZoneId.of(zone.trim());
        }

        String staleMinutes = appConfig.get(STALE_CLAIM_MINUTES);
        if (staleMinutes != null && !staleMinutes.isBlank()) {
            config.staleClaimThreshold = Duration.ofMinutes(Long.parseLong(staleMinutes.trim()));
        }

        String adminPort = appConfig.get(ADMIN_PORT);
        if (adminPort != null && !adminPort.isBlank()) {
            config.adminPort = Integer.parseInt(adminPort.trim());
        }

        String adminKey = appConfig.get(ADMIN_KEY);
        if (adminKey != null && !adminKey.isBlank()) {
            config.adminKey = adminKey;
        }

        return config;
    }

    public static WorkerConfig fromEnv() {
        return fromProperties(System.getenv());
    }

    /**
     * Accepts JDBC urls as-is and rewrites the {@code sqlite:///path} form.
     */
    static String normalizeUrl(String url) {
        String u = url.trim();
        if (u.startsWith("sqlite:///")) {
            u = "jdbc:sqlite:" + u.substring("sqlite:///".length());
        }
        if (u.startsWith("jdbc:sqlite:")) {
            u = u.replace("\\", "/");
        }
        return u;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public boolean hasDatabaseUrl() {
        return databaseUrl != null && !databaseUrl.isBlank();
    }

    /**
     * The configured database url.
     *
     * @throws MissingDatabaseUriException when none was configured
     */
    public String requireDatabaseUrl() {
        if (!hasDatabaseUrl()) {
            throw new MissingDatabaseUriException();
        }
        return databaseUrl;
    }

    public BackendKind backend() {
        if (backend != null) {
            return backend;
        }
        return BackendKind.fromJdbcUrl(requireDatabaseUrl());
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public boolean drainMode() {
        return drainMode;
    }

    public Duration staleClaimThreshold() {
        return staleClaimThreshold;
    }

    public boolean hasStaleClaimReaper() {
        return !staleClaimThreshold.isZero() && !staleClaimThreshold.isNegative();
    }

    public Duration staleClaimCheckInterval() {
        return staleClaimCheckInterval;
    }

    public ZoneId timezone() {
        return timezone;
    }

    public int adminPort() {
        return adminPort;
    }

    public boolean hasAdminServer() {
        return adminPort > 0;
    }

    public String adminHost() {
        return adminHost;
    }

    public String adminKey() {
        return adminKey;
    }

    public boolean hasAdminKey() {
        return adminKey != null && !adminKey.isBlank();
    }

    // Fluent setters for testing/customization
    public WorkerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url != null ? normalizeUrl(url) : null;
        return this;
    }

    public WorkerConfig withBackend(BackendKind backend) {
        this.backend = backend;
        return this;
    }

    public WorkerConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public WorkerConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public WorkerConfig withDrainMode(boolean drainMode) {
        this.drainMode = drainMode;
        return this;
    }

    public WorkerConfig withStaleClaimThreshold(Duration threshold) {
        this.staleClaimThreshold = threshold;
        return this;
    }

    public WorkerConfig withStaleClaimCheckInterval(Duration interval) {
        this.staleClaimCheckInterval = interval;
        return this;
    }

    public WorkerConfig withTimezone(ZoneId timezone) {
        this.timezone = timezone;
        return this;
    }

    public WorkerConfig withAdminPort(int port) {
        this.adminPort = port;
        return this;
    }

    public WorkerConfig withAdminHost(String host) {
        this.adminHost = host;
        return this;
    }

    public WorkerConfig withAdminKey(String key) {
        this.adminKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", backend=" + backend +
                ", pollInterval=" + pollInterval +
                ", drainMode=" + drainMode +
                ", timezone=" + timezone +
                ", adminPort=" + adminPort +
                ", adminKeySet=" + hasAdminKey() +
                '}';
    }
}
