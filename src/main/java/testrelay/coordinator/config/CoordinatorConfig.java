package testrelay.coordinator.config;

import java.time.Duration;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/testrelay;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Job settings
    private int defaultMaxRetries = 3;

    // Dispatcher tick
    private Duration dispatchInterval = Duration.ofMinutes(1);

    // Worker settings
    private Duration workerHeartbeatTimeout = Duration.ofMinutes(3);
    private Duration workerReaperInterval = Duration.ofSeconds(30);

    // Retention
    private Duration retentionInterval = Duration.ofHours(1);

    // Auth settings (optional)
    private String agentKey = null; // If set, agents must provide X-Agent-Key header

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("RELAY_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("RELAY_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String agentKey = System.getenv("RELAY_AGENT_KEY");
        if (agentKey != null && !agentKey.isBlank()) {
            config.agentKey = agentKey;
        }

        String maxRetries = System.getenv("RELAY_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.defaultMaxRetries = Integer.parseInt(maxRetries);
        }

        String heartbeatTimeout = System.getenv("RELAY_WORKER_TIMEOUT_SECONDS");
        if (heartbeatTimeout != null && !heartbeatTimeout.isBlank()) {
            config.workerHeartbeatTimeout = Duration.ofSeconds(Long.parseLong(heartbeatTimeout));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public Duration workerHeartbeatTimeout() {
        return workerHeartbeatTimeout;
    }

    public Duration workerReaperInterval() {
        return workerReaperInterval;
    }

    public Duration retentionInterval() {
        return retentionInterval;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public CoordinatorConfig withMaxRetries(int retries) {
        this.defaultMaxRetries = retries;
        return this;
    }

    public CoordinatorConfig withDispatchInterval(Duration interval) {
        this.dispatchInterval = interval;
        return this;
    }

    public CoordinatorConfig withWorkerHeartbeatTimeout(Duration timeout) {
        this.workerHeartbeatTimeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxRetries=" + defaultMaxRetries +
                ", dispatchInterval=" + dispatchInterval +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
