package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import testrelay.coordinator.model.ScheduleRule;
import testrelay.coordinator.model.TargetType;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerType;

import java.util.Locale;

/**
 * Request DTO for creating or replacing a trigger.
 * POST /api/v1/triggers, PUT /api/v1/triggers/{triggerId}
 *
 * Schedule fields that are missing or malformed fall back to the rule
 * defaults (daily, 09:00, Monday, UTC).
 */
public record TriggerRequest(
        @JsonProperty("projectId") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("active") Boolean active,
        @JsonProperty("triggerType") String triggerType,
        @JsonProperty("targetType") String targetType,
        @JsonProperty("targetId") String targetId,
        @JsonProperty("assignedWorkerId") String assignedWorkerId,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("scheduleType") String scheduleType,
        @JsonProperty("scheduleTime") String scheduleTime,
        @JsonProperty("scheduleDay") Integer scheduleDay,
        @JsonProperty("timezone") String timezone) {

    public void validate() {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId is required");
        }
        parseTriggerType();
        parseTargetType();
    }

    public Trigger toTrigger(String id) {
        return Trigger.builder()
                .id(id)
                .projectId(projectId)
                .name(name)
                .active(active == null || active)
                .triggerType(parseTriggerType())
                .targetType(parseTargetType())
                .targetId(targetId)
                .assignedWorkerId(assignedWorkerId != null && !assignedWorkerId.isBlank() ? assignedWorkerId : null)
                .priority(priority != null ? priority : 0)
                .scheduleRule(ScheduleRule.parse(scheduleType, scheduleTime, scheduleDay, timezone))
                .build();
    }

    private TriggerType parseTriggerType() {
        if (triggerType == null || triggerType.isBlank()) {
            return TriggerType.SCHEDULE;
        }
        try {
            return TriggerType.valueOf(triggerType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("triggerType must be SCHEDULE or EXTERNAL_EVENT");
        }
    }

    private TargetType parseTargetType() {
        if (targetType == null || targetType.isBlank()) {
            return TargetType.SINGLE_TEST;
        }
        try {
            return TargetType.valueOf(targetType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("targetType must be SINGLE_TEST or SUITE");
        }
    }
}
