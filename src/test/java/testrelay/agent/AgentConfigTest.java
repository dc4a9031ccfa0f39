package testrelay.agent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentConfigTest {

    @Test
    @DisplayName("Only API URL and agent id are required")
    void defaults() {
        AgentConfig config = AgentConfig.fromEnv(Map.of(
                "RELAY_API_URL", "http://coordinator:8081/",
                "RELAY_AGENT_ID", "agent-1"));

        assertEquals("http://coordinator:8081", config.apiUrl());
        assertEquals("agent-1", config.agentId());
        assertEquals("agent-1", config.agentName());
        assertNull(config.projectId());
        assertEquals(1, config.capacity());
        assertEquals(Set.of(AgentConfig.DEFAULT_CAPABILITY), config.capabilities());
        assertFalse(config.hasAgentKey());
        assertNull(config.toolTimeout());
    }

    @Test
    @DisplayName("Optional variables override the defaults")
    void fullEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("RELAY_API_URL", "https://relay.example.com");
        env.put("RELAY_AGENT_ID", "agent-7");
        env.put("RELAY_AGENT_KEY", "secret");
        env.put("RELAY_AGENT_NAME", "Build box");
        env.put("RELAY_PROJECT_ID", "proj-1");
        env.put("RELAY_CAPACITY", " 4 ");
        env.put("RELAY_CAPABILITIES", "performance, smoke,,");
        env.put("JMETER_HOME", "/opt/jmeter");
        env.put("RELAY_JMETER_PATH", "/usr/bin/jmeter");
        env.put("RELAY_WORK_DIR", "/var/tmp/relay");
        env.put("RELAY_TOOL_TIMEOUT_SECONDS", "900");

        AgentConfig config = AgentConfig.fromEnv(env);

        assertTrue(config.hasAgentKey());
        assertEquals("secret", config.agentKey());
        assertEquals("Build box", config.agentName());
        assertEquals("proj-1", config.projectId());
        assertEquals(4, config.capacity());
        assertEquals(Set.of("performance", "smoke"), config.capabilities());
        assertEquals("/opt/jmeter", config.jmeterHome());
        assertEquals("/usr/bin/jmeter", config.jmeterPath());
        assertEquals(Path.of("/var/tmp/relay"), config.workDir());
        assertEquals(Duration.ofSeconds(900), config.toolTimeout());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    @DisplayName("Missing required variables and bad numbers are rejected")
    void invalidEnvironment() {
        assertThrows(IllegalArgumentException.class,
                () -> AgentConfig.fromEnv(Map.of("RELAY_AGENT_ID", "agent-1")));
        assertThrows(IllegalArgumentException.class,
                () -> AgentConfig.fromEnv(Map.of("RELAY_API_URL", "http://x", "RELAY_AGENT_ID", " ")));

        IllegalArgumentException notANumber = assertThrows(IllegalArgumentException.class,
                () -> AgentConfig.fromEnv(Map.of("RELAY_API_URL", "http://x", "RELAY_AGENT_ID", "a",
                        "RELAY_CAPACITY", "lots")));
        assertTrue(notANumber.getMessage().contains("RELAY_CAPACITY"));

        assertThrows(IllegalArgumentException.class,
                () -> AgentConfig.fromEnv(Map.of("RELAY_API_URL", "http://x", "RELAY_AGENT_ID", "a",
                        "RELAY_TOOL_TIMEOUT_SECONDS", "0")));
        assertThrows(IllegalArgumentException.class, () -> AgentConfig.of("http://x", "a").withCapacity(0));
    }

    @Test
    void blankCapabilitiesFallBackToDefault() {
        AgentConfig config = AgentConfig.fromEnv(Map.of("RELAY_API_URL", "http://x", "RELAY_AGENT_ID", "a",
                "RELAY_CAPABILITIES", " , "));

        assertEquals(Set.of(AgentConfig.DEFAULT_CAPABILITY), config.capabilities());
    }
}
