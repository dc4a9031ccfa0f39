package testrelay.coordinator.model;

import java.time.Instant;

/**
 * Stored artifacts of a terminal job run.
 */
public record JobResult(
        String jobId,
        JobStatus status,
        String summaryJson,
        String resultLogBase64,
        String reportBase64,
        String errorMessage,
        Instant createdAt) {
}
