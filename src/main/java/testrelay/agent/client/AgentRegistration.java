package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Body of POST /internal/v1/agents/register.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentRegistration(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("name") String name,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("systemInfo") Map<String, Object> systemInfo) {
}
