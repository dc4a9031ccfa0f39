package testrelay.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a queued job.
 * <pre>
 * PENDING -> ASSIGNED -> RUNNING -> COMPLETED | FAILED
 *                                -> PENDING (retry)
 * any non-terminal -> CANCELLED
 * </pre>
 */
public enum JobStatus {
    /** Waiting in the queue to be claimed */
    PENDING,
    /** Claimed by a worker, not yet started */
    ASSIGNED,
    /** Being executed by the owning worker */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Failed with no retries left */
    FAILED,
    /** Cancelled externally */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    private Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(ASSIGNED, CANCELLED);
            case ASSIGNED -> EnumSet.of(RUNNING, PENDING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, PENDING, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
