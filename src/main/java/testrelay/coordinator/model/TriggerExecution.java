package testrelay.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One firing attempt of a trigger.
 */
public final class TriggerExecution {
    private final String id;
    private final String triggerId;
    private final String projectId;
    private final Instant triggeredAt;
    private final ExecutionSource source;
    private final ExecutionStatus status;
    private final String errorMessage;
    private final String jobId; // first job created, if any
    private final int jobsCreated;
    private final Instant completedAt;

    private TriggerExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.triggerId = Objects.requireNonNull(builder.triggerId, "triggerId is required");
        this.projectId = builder.projectId;
        this.triggeredAt = builder.triggeredAt;
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.errorMessage = builder.errorMessage;
        this.jobId = builder.jobId;
        this.jobsCreated = builder.jobsCreated;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String triggerId() {
        return triggerId;
    }

    public String projectId() {
        return projectId;
    }

    public Instant triggeredAt() {
        return triggeredAt;
    }

    public ExecutionSource source() {
        return source;
    }

    public ExecutionStatus status() {
        return status;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String jobId() {
        return jobId;
    }

    public int jobsCreated() {
        return jobsCreated;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String triggerId;
        private String projectId;
        private Instant triggeredAt;
        private ExecutionSource source = ExecutionSource.SCHEDULE;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String errorMessage;
        private String jobId;
        private int jobsCreated;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder triggerId(String triggerId) {
            this.triggerId = triggerId;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder source(ExecutionSource source) {
            this.source = source;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder jobsCreated(int jobsCreated) {
            this.jobsCreated = jobsCreated;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public TriggerExecution build() {
            return new TriggerExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TriggerExecution that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TriggerExecution{id='" + id + "', triggerId='" + triggerId + "', status=" + status + "}";
    }
}
