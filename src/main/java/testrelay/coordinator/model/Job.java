package testrelay.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a queue entry: one test run.
 */
public final class Job {

    public static final String DEFAULT_JOB_TYPE = "performance";

    private final String id;
    private final String projectId;
    private final String testId;
    private final String runId;
    private final String jobType;
    private final String payload; // opaque JSON handed to the worker
    private final String targetWorkerId; // preferred worker, from the trigger
    private final String workerId; // owner once claimed
    private final JobStatus status;
    private final int priority;
    private final int retries;
    private final int maxRetries;
    private final String errorMessage;
    private final String triggerExecutionId;
    private final Instant createdAt;
    private final Instant assignedAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.projectId = Objects.requireNonNull(builder.projectId, "projectId is required");
        this.testId = builder.testId;
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.jobType = builder.jobType != null ? builder.jobType : DEFAULT_JOB_TYPE;
        this.payload = builder.payload != null ? builder.payload : "{}";
        this.targetWorkerId = builder.targetWorkerId;
        this.workerId = builder.workerId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.retries = builder.retries;
        this.maxRetries = builder.maxRetries;
        this.errorMessage = builder.errorMessage;
        this.triggerExecutionId = builder.triggerExecutionId;
        this.createdAt = builder.createdAt;
        this.assignedAt = builder.assignedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
    }

    public String id() {
        return id;
    }

    public String projectId() {
        return projectId;
    }

    public String testId() {
        return testId;
    }

    public String runId() {
        return runId;
    }

    public String jobType() {
        return jobType;
    }

    public String payload() {
        return payload;
    }

    public String targetWorkerId() {
        return targetWorkerId;
    }

    public String workerId() {
        return workerId;
    }

    public JobStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public int retries() {
        return retries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String triggerExecutionId() {
        return triggerExecutionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant assignedAt() {
        return assignedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    /**
     * Whether one more failure would still leave the job in the queue.
     * The counter is incremented before this check is applied.
     */
    public boolean canRetryAfterFailure() {
        return retries + 1 < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isOwnedBy(String worker) {
        return workerId != null && workerId.equals(worker);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectId(projectId)
                .testId(testId)
                .runId(runId)
                .jobType(jobType)
                .payload(payload)
                .targetWorkerId(targetWorkerId)
                .workerId(workerId)
                .status(status)
                .priority(priority)
                .retries(retries)
                .maxRetries(maxRetries)
                .errorMessage(errorMessage)
                .triggerExecutionId(triggerExecutionId)
                .createdAt(createdAt)
                .assignedAt(assignedAt)
                .startedAt(startedAt)
                .completedAt(completedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String projectId;
        private String testId;
        private String runId;
        private String jobType;
        private String payload;
        private String targetWorkerId;
        private String workerId;
        private JobStatus status = JobStatus.PENDING;
        private int priority = 0;
        private int retries = 0;
        private int maxRetries = 3;
        private String errorMessage;
        private String triggerExecutionId;
        private Instant createdAt;
        private Instant assignedAt;
        private Instant startedAt;
        private Instant completedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder testId(String testId) {
            this.testId = testId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder targetWorkerId(String targetWorkerId) {
            this.targetWorkerId = targetWorkerId;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder triggerExecutionId(String triggerExecutionId) {
            this.triggerExecutionId = triggerExecutionId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder assignedAt(Instant assignedAt) {
            this.assignedAt = assignedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', runId='" + runId + "', status=" + status + ", workerId='" + workerId + "'}";
    }
}
