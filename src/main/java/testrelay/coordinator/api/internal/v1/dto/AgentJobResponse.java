package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import testrelay.coordinator.model.Job;

/**
 * Job as seen by an agent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentJobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("runId") String runId,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("testId") String testId,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("priority") int priority,
        @JsonProperty("retries") int retries,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonRawValue @JsonProperty("payload") String payload // Raw JSON, not re-serialized
) {
    public static AgentJobResponse from(Job job) {
        return new AgentJobResponse(
                job.id(),
                job.runId(),
                job.projectId(),
                job.testId(),
                job.jobType(),
                job.status().name(),
                job.workerId(),
                job.priority(),
                job.retries(),
                job.maxRetries(),
                job.payload());
    }
}
