package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import testrelay.coordinator.model.Job;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("testId") String testId,
        @JsonProperty("runId") String runId,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("targetWorkerId") String targetWorkerId,
        @JsonProperty("priority") int priority,
        @JsonProperty("retries") int retries,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("triggerExecutionId") String triggerExecutionId,
        @JsonRawValue @JsonProperty("payload") String payload,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("assignedAt") Instant assignedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt) {

    /** Create response from domain model */
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.projectId(),
                job.testId(),
                job.runId(),
                job.jobType(),
                job.status().name(),
                job.workerId(),
                job.targetWorkerId(),
                job.priority(),
                job.retries(),
                job.maxRetries(),
                job.errorMessage(),
                job.triggerExecutionId(),
                job.payload(),
                job.createdAt(),
                job.assignedAt(),
                job.startedAt(),
                job.completedAt());
    }
}
