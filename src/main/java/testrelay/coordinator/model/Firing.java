package testrelay.coordinator.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything one trigger firing writes.
 *
 * @param trigger      the trigger as read at the start of the firing
 * @param executionId  the PENDING execution to finalize
 * @param jobs         jobs to enqueue, in order; empty when resolution failed
 * @param errorMessage non-null when the target could not be resolved
 * @param firedAt      "now" for the firing
 * @param nextFireAt   new next fire time, or null to leave the schedule alone
 * @param event        audit event to append
 */
public record Firing(
        Trigger trigger,
        String executionId,
        List<Job> jobs,
        String errorMessage,
        Instant firedAt,
        Instant nextFireAt,
        ActivityEvent event) {

    public Firing {
        jobs = List.copyOf(jobs);
    }

    public boolean failed() {
        return errorMessage != null;
    }

    public boolean advancesSchedule() {
        return nextFireAt != null;
    }
}
