package testrelay.coordinator.dispatch;

/**
 * Outcome of one dispatch pass.
 *
 * @param enabled           false when the kill switch is off
 * @param acquired          whether this pass held the dispatch lock
 * @param triggersProcessed due triggers handled
 * @param jobsCreated       jobs enqueued across all triggers
 * @param failures          executions that ended FAILED
 */
public record DispatchSummary(
        boolean enabled,
        boolean acquired,
        int triggersProcessed,
        int jobsCreated,
        int failures) {

    public static DispatchSummary disabled() {
        return new DispatchSummary(false, false, 0, 0, 0);
    }

    public static DispatchSummary notAcquired() {
        return new DispatchSummary(true, false, 0, 0, 0);
    }
}
