package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for claim and start.
 * POST /internal/v1/jobs/{jobId}/claim, POST /internal/v1/jobs/{jobId}/start
 */
public record AgentActionRequest(
        @JsonProperty("agentId") String agentId) {

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
    }
}
