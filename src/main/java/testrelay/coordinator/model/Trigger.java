package testrelay.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a stored trigger.
 * {@code nextFireAt} is null when the trigger is inactive or not a schedule
 * trigger.
 */
public final class Trigger {
    private final String id;
    private final String projectId;
    private final String name;
    private final boolean active;
    private final TriggerType triggerType;
    private final TargetType targetType;
    private final String targetId;
    private final String assignedWorkerId;
    private final ScheduleRule scheduleRule;
    private final int priority;
    private final Instant nextFireAt;
    private final Instant lastFiredAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Trigger(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId is required");
        this.name = builder.name;
        this.active = builder.active;
        this.triggerType = Objects.requireNonNull(builder.triggerType, "triggerType is required");
        this.targetType = Objects.requireNonNull(builder.targetType, "targetType is required");
        this.targetId = Objects.requireNonNull(builder.targetId, "targetId is required");
        this.assignedWorkerId = builder.assignedWorkerId;
        this.scheduleRule = builder.scheduleRule != null ? builder.scheduleRule : ScheduleRule.defaults();
        this.priority = builder.priority;
        this.nextFireAt = builder.nextFireAt;
        this.lastFiredAt = builder.lastFiredAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String name() {
        return name;
    }

    public boolean active() {
        return active;
    }

    public TriggerType triggerType() {
        return triggerType;
    }

    public TargetType targetType() {
        return targetType;
    }

    public String targetId() {
        return targetId;
    }

    public String assignedWorkerId() {
        return assignedWorkerId;
    }

    public ScheduleRule scheduleRule() {
        return scheduleRule;
    }

    public int priority() {
        return priority;
    }

    public Instant nextFireAt() {
        return nextFireAt;
    }

    public Instant lastFiredAt() {
        return lastFiredAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** True when the dispatcher is responsible for firing this trigger */
    public boolean isRecurring() {
        return active && triggerType == TriggerType.SCHEDULE;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectId(projectId)
                .name(name)
                .active(active)
                .triggerType(triggerType)
                .targetType(targetType)
                .targetId(targetId)
                .assignedWorkerId(assignedWorkerId)
                .scheduleRule(scheduleRule)
                .priority(priority)
                .nextFireAt(nextFireAt)
                .lastFiredAt(lastFiredAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String projectId;
        private String name;
        private boolean active = true;
        private TriggerType triggerType = TriggerType.SCHEDULE;
        private TargetType targetType = TargetType.SINGLE_TEST;
        private String targetId;
        private String assignedWorkerId;
        private ScheduleRule scheduleRule;
        private int priority = 0;
        private Instant nextFireAt;
        private Instant lastFiredAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder triggerType(TriggerType triggerType) {
            this.triggerType = triggerType;
            return this;
        }

        public Builder targetType(TargetType targetType) {
            this.targetType = targetType;
            return this;
        }

        public Builder targetId(String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder assignedWorkerId(String assignedWorkerId) {
            this.assignedWorkerId = assignedWorkerId;
            return this;
        }

        public Builder scheduleRule(ScheduleRule scheduleRule) {
            this.scheduleRule = scheduleRule;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder nextFireAt(Instant nextFireAt) {
            this.nextFireAt = nextFireAt;
            return this;
        }

        public Builder lastFiredAt(Instant lastFiredAt) {
            this.lastFiredAt = lastFiredAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Trigger build() {
            return new Trigger(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Trigger trigger))
            return false;
        return Objects.equals(id, trigger.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Trigger{id='" + id + "', name='" + name + "', " + targetType + ":" + targetId
                + ", nextFireAt=" + nextFireAt + "}";
    }
}
