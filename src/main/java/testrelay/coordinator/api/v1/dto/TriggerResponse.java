package testrelay.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import testrelay.coordinator.model.ScheduleRule;
import testrelay.coordinator.model.Trigger;

import java.time.Instant;

/**
 * Response DTO for trigger details.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(
        @JsonProperty("id") String id,
        @JsonProperty("projectId") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("active") boolean active,
        @JsonProperty("triggerType") String triggerType,
        @JsonProperty("targetType") String targetType,
        @JsonProperty("targetId") String targetId,
        @JsonProperty("assignedWorkerId") String assignedWorkerId,
        @JsonProperty("priority") int priority,
        @JsonProperty("scheduleType") String scheduleType,
        @JsonProperty("scheduleTime") String scheduleTime,
        @JsonProperty("scheduleDay") int scheduleDay,
        @JsonProperty("timezone") String timezone,
        @JsonProperty("nextFireAt") Instant nextFireAt,
        @JsonProperty("lastFiredAt") Instant lastFiredAt,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static TriggerResponse from(Trigger trigger) {
        ScheduleRule rule = trigger.scheduleRule();
        return new TriggerResponse(
                trigger.id(),
                trigger.projectId(),
                trigger.name(),
                trigger.active(),
                trigger.triggerType().name(),
                trigger.targetType().name(),
                trigger.targetId(),
                trigger.assignedWorkerId(),
                trigger.priority(),
                rule.type().name(),
                rule.timeOfDay().toString(),
                rule.dayOfWeek(),
                rule.timezone().getId(),
                trigger.nextFireAt(),
                trigger.lastFiredAt(),
                trigger.createdAt(),
                trigger.updatedAt());
    }
}
