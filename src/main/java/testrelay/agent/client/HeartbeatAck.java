package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Coordinator reply to a heartbeat.
 */
public record HeartbeatAck(
        @JsonProperty("success") boolean success,
        @JsonProperty("serverTime") Instant serverTime,
        @JsonProperty("pendingJobs") int pendingJobs,
        @JsonProperty("commands") List<String> commands) {
}
