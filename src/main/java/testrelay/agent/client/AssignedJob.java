package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job as the coordinator hands it to an agent.
 */
public record AssignedJob(
        @JsonProperty("id") String id,
        @JsonProperty("runId") String runId,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("testId") String testId,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("payload") JsonNode payload) {

    public static final String RUNNING = "RUNNING";

    /** Whether the coordinator still has this job running under the given agent. */
    public boolean isRunningFor(String agentId) {
        return RUNNING.equals(status) && agentId != null && agentId.equals(workerId);
    }
}
