package testrelay.coordinator.repository;

import testrelay.coordinator.model.Firing;

/**
 * Writes the outcome of one trigger firing in a single transaction: the
 * created jobs, the finalized execution, the trigger's advanced schedule
 * and the audit event.
 */
public interface DispatchStore {

    /**
     * Persist a firing.
     *
     * @param firing what to write
     * @return false if the trigger was already advanced by someone else; in
     *         that case nothing was written
     */
    boolean recordFiring(Firing firing);
}
