package testrelay.coordinator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model of a registered worker (agent).
 */
public final class Worker {
    private final String id;
    private final String name;
    private final String projectId;
    private final Set<String> capabilities;
    private final WorkerStatus status;
    private final int capacity;
    private final int runningJobs;
    private final String systemInfo;
    private final Instant lastHeartbeat;
    private final Instant registeredAt;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.projectId = builder.projectId;
        this.capabilities = builder.capabilities != null ? Set.copyOf(builder.capabilities) : Set.of();
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.capacity = builder.capacity;
        this.runningJobs = builder.runningJobs;
        this.systemInfo = builder.systemInfo;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.registeredAt = builder.registeredAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String projectId() {
        return projectId;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public WorkerStatus status() {
        return status;
    }

    public int capacity() {
        return capacity;
    }

    public int runningJobs() {
        return runningJobs;
    }

    public String systemInfo() {
        return systemInfo;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public int availableCapacity() {
        return Math.max(0, capacity - runningJobs);
    }

    /** Empty capability set means the worker accepts any job type */
    public boolean accepts(String jobType) {
        return capabilities.isEmpty() || capabilities.contains(jobType);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .projectId(projectId)
                .capabilities(capabilities)
                .status(status)
                .capacity(capacity)
                .runningJobs(runningJobs)
                .systemInfo(systemInfo)
                .lastHeartbeat(lastHeartbeat)
                .registeredAt(registeredAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String projectId;
        private Set<String> capabilities;
        private WorkerStatus status = WorkerStatus.ONLINE;
        private int capacity = 1;
        private int runningJobs = 0;
        private String systemInfo;
        private Instant lastHeartbeat;
        private Instant registeredAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder status(WorkerStatus status) {
            this.status = status;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder runningJobs(int runningJobs) {
            this.runningJobs = runningJobs;
            return this;
        }

        public Builder systemInfo(String systemInfo) {
            this.systemInfo = systemInfo;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id='" + id + "', status=" + status + ", running=" + runningJobs + "/" + capacity + "}";
    }
}
