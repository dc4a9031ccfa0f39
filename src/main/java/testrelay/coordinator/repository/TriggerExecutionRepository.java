package testrelay.coordinator.repository;

import testrelay.coordinator.model.TriggerExecution;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for trigger execution records.
 */
public interface TriggerExecutionRepository {

    /**
     * Insert a new execution row (normally PENDING) and commit it.
     */
    void create(TriggerExecution execution);

    Optional<TriggerExecution> findById(String executionId);

    /**
     * Most recent executions of a trigger, newest first.
     */
    List<TriggerExecution> findByTrigger(String triggerId, int limit);

    /**
     * Move a PENDING execution to FAILED.
     *
     * @return true if the execution was still pending
     */
    boolean markFailed(String executionId, String errorMessage);

    /**
     * Delete finalized executions triggered before the cutoff.
     *
     * @return number of rows deleted
     */
    int deleteFinalizedBefore(Instant cutoff);
}
