package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import testrelay.coordinator.model.JobOutcome;

/**
 * Request DTO for the final report of a job run.
 * POST /internal/v1/jobs/{jobId}/result
 */
public record JobResultRequest(
        @JsonProperty("agentId") String agentId,
        @JsonProperty("status") String status,
        @JsonProperty("summary") JsonNode summary, // stored as-is
        @JsonProperty("resultLogBase64") String resultLogBase64,
        @JsonProperty("reportBase64") String reportBase64,
        @JsonProperty("errorMessage") String errorMessage) {

    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public void validate() {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (!COMPLETED.equals(status) && !FAILED.equals(status)) {
            throw new IllegalArgumentException("status must be 'completed' or 'failed'");
        }
    }

    public JobOutcome toOutcome() {
        String summaryJson = summary != null && !summary.isNull() ? summary.toString() : null;
        if (COMPLETED.equals(status)) {
            return JobOutcome.completed(summaryJson, resultLogBase64, reportBase64);
        }
        String error = errorMessage != null && !errorMessage.isBlank() ? errorMessage : "Job failed";
        return new JobOutcome(false, summaryJson, resultLogBase64, reportBase64, error);
    }
}
