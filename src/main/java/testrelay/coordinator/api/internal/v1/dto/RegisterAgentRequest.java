package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import testrelay.coordinator.model.Worker;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for agent registration.
 * POST /internal/v1/agents/register
 */
public record RegisterAgentRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("capacity") Integer capacity,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("systemInfo") JsonNode systemInfo) {

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (capacity != null && capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
    }

    public Worker toWorker() {
        Set<String> caps = new LinkedHashSet<>();
        if (capabilities != null) {
            capabilities.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(String::trim)
                    .forEach(caps::add);
        }

        return Worker.builder()
                .id(agentId)
                .name(name != null && !name.isBlank() ? name : agentId)
                .projectId(projectId != null && !projectId.isBlank() ? projectId : null)
                .capacity(capacity != null ? capacity : 1)
                .capabilities(caps)
                .systemInfo(systemInfo != null ? systemInfo.toString() : null)
                .build();
    }
}
