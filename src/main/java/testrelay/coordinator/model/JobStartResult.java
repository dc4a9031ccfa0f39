package testrelay.coordinator.model;

/**
 * Result of moving a claimed job to RUNNING.
 */
public enum JobStartResult {
    STARTED,
    /** The job is held by a different worker */
    NOT_OWNER,
    /** The job is not ASSIGNED (cancelled, released, ...) */
    INVALID_STATE,
    NOT_FOUND
}
