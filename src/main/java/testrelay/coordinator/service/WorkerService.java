package testrelay.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.model.WorkerStatus;
import testrelay.coordinator.repository.JobRepository;
import testrelay.coordinator.repository.WorkerRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for worker (agent) registrations.
 * Handles registration, heartbeats and staleness detection.
 */
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    static final String OFFLINE_REASON = "Worker stopped sending heartbeats";

    private final WorkerRepository workerRepository;
    private final JobRepository jobRepository;
    private final ActivityService activity;
    private final CoordinatorConfig config;
    private final Clock clock;

    public WorkerService(WorkerRepository workerRepository, JobRepository jobRepository, ActivityService activity,
            CoordinatorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.jobRepository = jobRepository;
        this.activity = activity;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Register or re-register a worker. Re-registration keeps the running
     * job count.
     */
    public Worker register(Worker worker) {
        if (worker.capacity() < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }

        workerRepository.register(worker);
        log.info("Registered worker {} ({}) project={} capacity={} capabilities={}",
                worker.id(), worker.name(), worker.projectId(), worker.capacity(), worker.capabilities());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agent_id", worker.id());
        details.put("name", worker.name());
        details.put("capacity", worker.capacity());
        details.put("capabilities", worker.capabilities());
        activity.record(worker.projectId(), ActivityEvent.AGENT_REGISTERED, worker.id(), details);

        return workerRepository.findById(worker.id()).orElse(worker);
    }

    /**
     * Process a heartbeat.
     *
     * @return the reply for the worker, or empty if it is not registered
     */
    public Optional<HeartbeatReply> heartbeat(String workerId, int runningJobs, int capacity, String systemInfo) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }

        Instant now = clock.instant();
        if (!workerRepository.heartbeat(workerId, runningJobs, capacity, systemInfo, now)) {
            log.warn("Heartbeat from unknown worker {}", workerId);
            return Optional.empty();
        }

        log.debug("Heartbeat from worker {} (running={}, capacity={})", workerId, runningJobs, capacity);

        int pending = workerRepository.findById(workerId)
                .map(jobRepository::countClaimable)
                .orElse(0);
        return Optional.of(new HeartbeatReply(now, pending, List.of()));
    }

    public Optional<Worker> findById(String workerId) {
        return workerRepository.findById(workerId);
    }

    public List<Worker> findAll() {
        return workerRepository.findAll();
    }

    public int countByStatus(WorkerStatus status) {
        return workerRepository.countByStatus(status);
    }

    /**
     * Mark workers with stale heartbeats OFFLINE and release their jobs
     * through the retry counter.
     *
     * @return number of workers marked OFFLINE
     */
    public int reapStaleWorkers() {
        Instant cutoff = clock.instant().minus(config.workerHeartbeatTimeout());
        List<String> staleIds = workerRepository.markStaleOffline(cutoff);

        int released = 0;
        for (String workerId : staleIds) {
            released += jobRepository.releaseJobsForWorker(workerId, OFFLINE_REASON);
        }

        if (!staleIds.isEmpty()) {
            log.info("Reaped {} stale workers, released {} jobs", staleIds.size(), released);
        }
        return staleIds.size();
    }

    /**
     * What the coordinator tells a worker after a heartbeat.
     *
     * @param serverTime  coordinator clock
     * @param pendingJobs jobs currently claimable by the worker
     * @param commands    control commands (none defined yet)
     */
    public record HeartbeatReply(Instant serverTime, int pendingJobs, List<String> commands) {
    }
}
