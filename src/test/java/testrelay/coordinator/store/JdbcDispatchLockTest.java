package testrelay.coordinator.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.dispatch.DispatchLock;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcDispatchLockTest {

    private Database db;
    private JdbcDispatchLock lock;

    @BeforeEach
    void setUp() {
        db = new Database(CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-lock-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE"));
        lock = new JdbcDispatchLock(db);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    @DisplayName("Second acquire fails fast while the lock is held")
    void heldLockIsNotReacquired() {
        Optional<DispatchLock.Handle> first = lock.tryAcquire("nightly");
        assertTrue(first.isPresent());

        try {
            long started = System.nanoTime();
            assertTrue(lock.tryAcquire("nightly").isEmpty());
            assertTrue(System.nanoTime() - started < 5_000_000_000L, "acquire should not wait");
        } finally {
            first.get().close();
        }
    }

    @Test
    @DisplayName("Released lock can be taken again")
    void releaseAllowsReacquire() {
        DispatchLock.Handle handle = lock.tryAcquire("nightly").orElseThrow();
        assertEquals("nightly", handle.name());
        handle.close();
        handle.close();

        Optional<DispatchLock.Handle> again = lock.tryAcquire("nightly");
        assertTrue(again.isPresent());
        again.get().close();
    }

    @Test
    @DisplayName("Locks with different names are independent")
    void independentNames() {
        DispatchLock.Handle a = lock.tryAcquire("a").orElseThrow();
        try {
            Optional<DispatchLock.Handle> b = lock.tryAcquire("b");
            assertTrue(b.isPresent());
            b.get().close();
        } finally {
            a.close();
        }
    }

    @Test
    @DisplayName("Blank names are rejected")
    void blankName() {
        assertThrows(IllegalArgumentException.class, () -> lock.tryAcquire(" "));
    }
}
