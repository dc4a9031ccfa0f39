package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import testrelay.coordinator.model.Worker;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for worker (agent) information.
 * GET /api/v1/workers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("capabilities") List<String> capabilities,
        @JsonProperty("status") String status,
        @JsonProperty("capacity") int capacity,
        @JsonProperty("runningJobs") int runningJobs,
        @JsonRawValue @JsonProperty("systemInfo") String systemInfo,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
        @JsonProperty("registeredAt") Instant registeredAt) {

    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.name(),
                worker.projectId(),
                worker.capabilities().stream().sorted().toList(),
                worker.status().name(),
                worker.capacity(),
                worker.runningJobs(),
                worker.systemInfo(),
                worker.lastHeartbeat(),
                worker.registeredAt());
    }
}
