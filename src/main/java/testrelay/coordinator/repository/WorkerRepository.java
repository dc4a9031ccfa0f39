package testrelay.coordinator.repository;

import testrelay.coordinator.model.Worker;
import testrelay.coordinator.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker registrations.
 */
public interface WorkerRepository {

    /**
     * Insert or replace a registration. Running jobs are preserved for an
     * existing worker.
     */
    void register(Worker worker);

    Optional<Worker> findById(String workerId);

    List<Worker> findAll();

    /**
     * Record a heartbeat. Running jobs are clamped to [0, capacity] and the
     * status is derived from the load.
     *
     * @return false if the worker is not registered
     */
    boolean heartbeat(String workerId, int runningJobs, int capacity, String systemInfo, Instant at);

    /**
     * Mark workers whose last heartbeat is older than the cutoff OFFLINE.
     *
     * @return ids of workers that changed to OFFLINE
     */
    List<String> markStaleOffline(Instant cutoff);

    int countByStatus(WorkerStatus status);
}
