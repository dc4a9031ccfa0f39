package testrelay.agent.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Coordinator reply to a result report.
 */
public record ReportAck(
        @JsonProperty("success") boolean success,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("willRetry") boolean willRetry) {
}
