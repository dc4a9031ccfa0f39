package testrelay.coordinator.model;

import java.time.Instant;

/**
 * Audit log entry. {@code details} is a JSON object.
 */
public record ActivityEvent(
        long id,
        String projectId,
        String eventType,
        String entityId,
        String details,
        Instant createdAt) {

    public static final String SCHEDULED_TRIGGER_EXECUTED = "scheduled_trigger_executed";
    public static final String TRIGGER_FIRED = "trigger_fired";
    public static final String AGENT_REGISTERED = "agent_registered";
    public static final String JOB_STARTED = "job_started";
    public static final String JOB_FINISHED = "job_finished";
    public static final String JOB_CANCELLED = "job_cancelled";

    public static ActivityEvent of(String projectId, String eventType, String entityId, String details) {
        return new ActivityEvent(0, projectId, eventType, entityId, details, null);
    }
}
