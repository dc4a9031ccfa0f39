package testrelay.coordinator.repository;

import testrelay.coordinator.model.Trigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Trigger persistence.
 * Callers are responsible for computing {@code nextFireAt} before writing.
 */
public interface TriggerRepository {

    /**
     * Save a new trigger.
     *
     * @param trigger the trigger to save
     */
    void save(Trigger trigger);

    /**
     * Overwrite all mutable fields of an existing trigger.
     *
     * @param trigger the updated trigger
     * @return true if a row was updated
     */
    boolean update(Trigger trigger);

    Optional<Trigger> findById(String triggerId);

    List<Trigger> findByProject(String projectId);

    /**
     * Active schedule triggers whose next fire time is at or before
     * {@code now}, oldest first.
     *
     * @param now reference instant
     * @return due triggers ordered by next fire time ascending
     */
    List<Trigger> findDue(Instant now);

    boolean delete(String triggerId);
}
