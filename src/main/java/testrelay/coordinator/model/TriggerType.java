package testrelay.coordinator.model;

/**
 * What causes a trigger to fire.
 */
public enum TriggerType {
    /** Fires on its recurrence rule via the dispatcher */
    SCHEDULE,
    /** Fires only when an external event (e.g. a deployment) is posted */
    EXTERNAL_EVENT
}
