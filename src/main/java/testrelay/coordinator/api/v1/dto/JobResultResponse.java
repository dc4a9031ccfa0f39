package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import testrelay.coordinator.model.JobResult;

import java.time.Instant;

/**
 * Response DTO for a stored job result.
 * GET /api/v1/jobs/{jobId}/result
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("status") String status,
        @JsonRawValue @JsonProperty("summary") String summary,
        @JsonProperty("resultLogBase64") String resultLogBase64,
        @JsonProperty("reportBase64") String reportBase64,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("createdAt") Instant createdAt) {

    public static JobResultResponse from(JobResult result) {
        return new JobResultResponse(
                result.jobId(),
                result.status().name(),
                result.summaryJson(),
                result.resultLogBase64(),
                result.reportBase64(),
                result.errorMessage(),
                result.createdAt());
    }
}
