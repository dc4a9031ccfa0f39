package testrelay.agent;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration holder for the worker agent.
 * Required values come from the environment; everything else has a default.
 */
public final class AgentConfig {

    public static final String DEFAULT_CAPABILITY = "performance";

    private String apiUrl;
    private String agentId;
    private String agentKey = null; // Sent as X-Agent-Key when set
    private String agentName;
    private String projectId = null;
    private int capacity = 1;
    private Set<String> capabilities = Set.of(DEFAULT_CAPABILITY);

    // JMeter lookup
    private String jmeterHome = null;
    private String jmeterPath = null;

    private Path workDir = Path.of(System.getProperty("java.io.tmpdir"));
    private String workDirPrefix = "testrelay";

    // Subprocess ceiling, unset means wait for exit
    private Duration toolTimeout = null;

    private Duration requestTimeout = Duration.ofSeconds(30);

    private AgentConfig() {
    }

    /**
     * Minimal config for tests and embedding.
     */
    public static AgentConfig of(String apiUrl, String agentId) {
        AgentConfig config = new AgentConfig();
        config.apiUrl = stripTrailingSlash(requireValue("RELAY_API_URL", apiUrl));
        config.agentId = requireValue("RELAY_AGENT_ID", agentId);
        config.agentName = agentId;
        return config;
    }

    public static AgentConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build from an environment map.
     *
     * @throws IllegalArgumentException when a required variable is missing or a number is malformed
     */
    public static AgentConfig fromEnv(Map<String, String> env) {
        AgentConfig config = of(env.get("RELAY_API_URL"), env.get("RELAY_AGENT_ID"));

        String key = env.get("RELAY_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            config.agentKey = key;
        }

        String name = env.get("RELAY_AGENT_NAME");
        if (name != null && !name.isBlank()) {
            config.agentName = name;
        }

        String projectId = env.get("RELAY_PROJECT_ID");
        if (projectId != null && !projectId.isBlank()) {
            config.projectId = projectId;
        }

        String capacity = env.get("RELAY_CAPACITY");
        if (capacity != null && !capacity.isBlank()) {
            config.capacity = parsePositive("RELAY_CAPACITY", capacity);
        }

        String capabilities = env.get("RELAY_CAPABILITIES");
        if (capabilities != null && !capabilities.isBlank()) {
            config.capabilities = parseCapabilities(capabilities);
        }

        String jmeterHome = env.get("JMETER_HOME");
        if (jmeterHome != null && !jmeterHome.isBlank()) {
            config.jmeterHome = jmeterHome;
        }

        String jmeterPath = env.get("RELAY_JMETER_PATH");
        if (jmeterPath != null && !jmeterPath.isBlank()) {
            config.jmeterPath = jmeterPath;
        }

        String workDir = env.get("RELAY_WORK_DIR");
        if (workDir != null && !workDir.isBlank()) {
            config.workDir = Path.of(workDir);
        }

        String timeout = env.get("RELAY_TOOL_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.toolTimeout = Duration.ofSeconds(parsePositive("RELAY_TOOL_TIMEOUT_SECONDS", timeout));
        }

        return config;
    }

    // Getters
    public String apiUrl() {
        return apiUrl;
    }

    public String agentId() {
        return agentId;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public String agentName() {
        return agentName;
    }

    public String projectId() {
        return projectId;
    }

    public int capacity() {
        return capacity;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public String jmeterHome() {
        return jmeterHome;
    }

    public String jmeterPath() {
        return jmeterPath;
    }

    public Path workDir() {
        return workDir;
    }

    public String workDirPrefix() {
        return workDirPrefix;
    }

    public Duration toolTimeout() {
        return toolTimeout;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    // Builder-style setters for testing
    public AgentConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public AgentConfig withProjectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    public AgentConfig withCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        return this;
    }

    public AgentConfig withCapabilities(Set<String> capabilities) {
        this.capabilities = Set.copyOf(capabilities);
        return this;
    }

    public AgentConfig withJMeterHome(String jmeterHome) {
        this.jmeterHome = jmeterHome;
        return this;
    }

    public AgentConfig withJMeterPath(String jmeterPath) {
        this.jmeterPath = jmeterPath;
        return this;
    }

    public AgentConfig withWorkDir(Path workDir) {
        this.workDir = workDir;
        return this;
    }

    public AgentConfig withToolTimeout(Duration toolTimeout) {
        this.toolTimeout = toolTimeout;
        return this;
    }

    private static String requireValue(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value.trim();
    }

    private static int parsePositive(String name, String raw) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be a positive number");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + raw);
        }
    }

    private static Set<String> parseCapabilities(String raw) {
        Set<String> result = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        return result.isEmpty() ? Set.of(DEFAULT_CAPABILITY) : result;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "AgentConfig{" +
                "apiUrl='" + apiUrl + '\'' +
                ", agentId='" + agentId + '\'' +
                ", projectId='" + projectId + '\'' +
                ", capacity=" + capacity +
                ", capabilities=" + capabilities +
                ", workDir=" + workDir +
                ", toolTimeout=" + toolTimeout +
                ", agentKey=" + (agentKey != null ? "***" : "null") +
                '}';
    }
}
