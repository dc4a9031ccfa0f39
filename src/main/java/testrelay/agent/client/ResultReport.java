package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of POST /internal/v1/jobs/{jobId}/result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultReport(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("status") String status,
        @JsonProperty("summary") JsonNode summary,
        @JsonProperty("resultLogBase64") String resultLogBase64,
        @JsonProperty("reportBase64") String reportBase64,
        @JsonProperty("errorMessage") String errorMessage) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public static ResultReport completed(String agentId, JsonNode summary, String resultLogBase64,
            String reportBase64) {
        return new ResultReport(agentId, COMPLETED, summary, resultLogBase64, reportBase64, null);
    }

    public static ResultReport failed(String agentId, JsonNode summary, String errorMessage) {
        return new ResultReport(agentId, FAILED, summary, null, null, errorMessage);
    }
}
