package testrelay.coordinator.dispatch;

import java.util.Optional;

/**
 * Named mutual-exclusion lock shared by every coordinator instance.
 */
public interface DispatchLock {

    /**
     * Try to take the lock without waiting.
     *
     * @param name lock name
     * @return a handle to release, or empty if someone else holds it
     */
    Optional<Handle> tryAcquire(String name);

    /**
     * A held lock. Closing it releases the lock.
     */
    interface Handle extends AutoCloseable {

        String name();

        @Override
        void close();
    }
}
