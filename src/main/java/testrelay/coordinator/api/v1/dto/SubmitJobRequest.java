package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobStatus;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Request DTO for submitting a job directly.
 * POST /api/v1/jobs
 */
public record SubmitJobRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("testId") String testId,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("payload") JsonNode payload, // Stored as raw JSON
        @JsonProperty("priority") Integer priority,
        @JsonProperty("targetWorkerId") String targetWorkerId,
        @JsonProperty("maxRetries") Integer maxRetries) {

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("payload must be a JSON object");
        }
        if (maxRetries != null && maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
    }

    public Job toJob(int defaultMaxRetries) {
        String hex = UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
        return Job.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .testId(testId)
                .runId("RUN-" + hex)
                .jobType(jobType != null && !jobType.isBlank() ? jobType : Job.DEFAULT_JOB_TYPE)
                .payload(payload.toString())
                .targetWorkerId(targetWorkerId != null && !targetWorkerId.isBlank() ? targetWorkerId : null)
                .status(JobStatus.PENDING)
                .priority(priority != null ? priority : 0)
                .maxRetries(maxRetries != null ? maxRetries : defaultMaxRetries)
                .createdAt(Instant.now())
                .build();
    }
}
