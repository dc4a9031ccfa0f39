package testrelay.coordinator.model;

/**
 * Worker (agent) liveness status.
 */
public enum WorkerStatus {
    /** Sending heartbeats and has spare capacity */
    ONLINE,
    /** Sending heartbeats, every capacity unit in use */
    BUSY,
    /** Missed heartbeats, considered gone */
    OFFLINE;

    /** Status implied by a fresh heartbeat */
    public static WorkerStatus forLoad(int runningJobs, int capacity) {
        return runningJobs >= capacity ? BUSY : ONLINE;
    }
}
