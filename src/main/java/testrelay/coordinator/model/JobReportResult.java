package testrelay.coordinator.model;

/**
 * Result of a worker's terminal report for a job.
 */
public enum JobReportResult {
    /** Job marked COMPLETED */
    COMPLETED,

    /** Job failed and went back to PENDING */
    RETRIED,

    /** Job failed with no retries left */
    FAILED,

    /** Job already terminal - idempotent no-op */
    ALREADY_TERMINAL,

    /** Job is not held by the reporting worker */
    NOT_OWNER,

    /** Job was never started, so it cannot finish */
    INVALID_STATE,

    /** Job not found */
    NOT_FOUND
}
