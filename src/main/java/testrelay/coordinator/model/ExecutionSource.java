package testrelay.coordinator.model;

/**
 * Origin of a trigger execution.
 */
public enum ExecutionSource {
    SCHEDULE("SCHED"),
    EXTERNAL_EVENT("EVENT"),
    MANUAL("MANUAL");

    private final String runPrefix;

    ExecutionSource(String runPrefix) {
        this.runPrefix = runPrefix;
    }

    /** Prefix used for run ids of jobs created by this source */
    public String runPrefix() {
        return runPrefix;
    }
}
