package testrelay.agent;

/**
 * Lifecycle of a worker process.
 */
public enum AgentState {
    /** Registered, nothing in flight */
    IDLE,
    /** Asking the coordinator for work */
    POLLING,
    /** At least one job running */
    EXECUTING,
    /** Shut down, no further polls */
    STOPPED
}
