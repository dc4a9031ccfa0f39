package testrelay.coordinator.model;

/**
 * Status of one trigger firing attempt.
 */
public enum ExecutionStatus {
    /** Firing in progress; only visible while the attempt runs */
    PENDING,
    /** Jobs were created */
    QUEUED,
    /** Target could not be resolved or the attempt errored */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return this == PENDING && next != PENDING;
    }
}
