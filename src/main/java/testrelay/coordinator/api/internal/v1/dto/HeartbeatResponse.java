package testrelay.coordinator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testrelay.coordinator.service.WorkerService.HeartbeatReply;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for agent heartbeat.
 */
public record HeartbeatResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("serverTime") Instant serverTime,
        @JsonProperty("pendingJobs") int pendingJobs,
        @JsonProperty("commands") List<String> commands) {

    public static HeartbeatResponse from(HeartbeatReply reply) {
        return new HeartbeatResponse(true, reply.serverTime(), reply.pendingJobs(), reply.commands());
    }
}
