package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import testrelay.coordinator.model.TriggerExecution;

import java.time.Instant;

/**
 * Response DTO for one trigger firing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("triggerId") String triggerId,
        @JsonProperty("source") String source,
        @JsonProperty("status") String status,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("jobId") String jobId,
        @JsonProperty("jobsCreated") int jobsCreated,
        @JsonProperty("triggeredAt") Instant triggeredAt,
        @JsonProperty("completedAt") Instant completedAt) {

    public static ExecutionResponse from(TriggerExecution execution) {
        return new ExecutionResponse(
                execution.id(),
                execution.triggerId(),
                execution.source().name(),
                execution.status().name(),
                execution.errorMessage(),
                execution.jobId(),
                execution.jobsCreated(),
                execution.triggeredAt(),
                execution.completedAt());
    }
}
