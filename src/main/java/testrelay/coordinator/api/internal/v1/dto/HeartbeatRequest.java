package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for agent heartbeat.
 * POST /internal/v1/agents/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("currentCapacity") int currentCapacity,
        @JsonProperty("maxCapacity") int maxCapacity,
        @JsonProperty("runningJobs") int runningJobs,
        @JsonProperty("systemInfo") JsonNode systemInfo) {

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("maxCapacity must be positive");
        }
        if (runningJobs < 0) {
            throw new IllegalArgumentException("runningJobs must be non-negative");
        }
    }

    public String systemInfoJson() {
        return systemInfo != null && !systemInfo.isNull() ? systemInfo.toString() : null;
    }
}
