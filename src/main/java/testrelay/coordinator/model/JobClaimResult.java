package testrelay.coordinator.model;

/**
 * Result of a claim attempt.
 */
public enum JobClaimResult {
    /** Job moved PENDING -> ASSIGNED for the caller */
    CLAIMED,

    /** Another worker got there first, or the job is no longer pending */
    ALREADY_CLAIMED,

    /** Job not found */
    NOT_FOUND
}
