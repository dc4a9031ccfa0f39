package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of POST /internal/v1/agents/heartbeat.
 */
public record AgentHeartbeat(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("currentCapacity") int currentCapacity,
        @JsonProperty("maxCapacity") int maxCapacity,
        @JsonProperty("runningJobs") int runningJobs,
        @JsonProperty("systemInfo") Map<String, Object> systemInfo) {
}
