package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.dispatch.DispatchLock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.isLockConflict;

/**
 * DispatchLock backed by a row lock on {@code dispatch_locks}.
 *
 * The holder keeps a transaction open on a dedicated connection with the
 * lock row selected FOR UPDATE. Releasing rolls back and returns the
 * connection; if the process dies the database drops the lock with the
 * session.
 */
public class JdbcDispatchLock implements DispatchLock {

    private static final Logger log = LoggerFactory.getLogger(JdbcDispatchLock.class);

    private static final String DUPLICATE_KEY_STATE = "23505";

    private final Database db;

    public JdbcDispatchLock(Database db) {
        this.db = db;
    }

    @Override
    public Optional<Handle> tryAcquire(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name is required");
        }

        ensureRow(name);

        Connection conn = null;
        try {
            conn = db.getConnection();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT name FROM dispatch_locks WHERE name = ? FOR UPDATE NOWAIT")) {
                ps.setString(1, name);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new IllegalStateException("Lock row missing: " + name);
                    }
                }
            }
            log.debug("Acquired lock {}", name);
            return Optional.of(new RowLockHandle(name, conn));
        } catch (SQLException e) {
            closeQuietly(conn, name);
            if (isLockConflict(e)) {
                log.debug("Lock {} is held elsewhere", name);
                return Optional.empty();
            }
            throw new RuntimeException("Failed to acquire lock: " + name, e);
        } catch (RuntimeException e) {
            closeQuietly(conn, name);
            throw e;
        }
    }

    private void ensureRow(String name) {
        String sql = """
                    INSERT INTO dispatch_locks (name)
                    SELECT ? WHERE NOT EXISTS (SELECT 1 FROM dispatch_locks WHERE name = ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            ps.setString(2, name);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            // Another instance created the row first
            if (!DUPLICATE_KEY_STATE.equals(e.getSQLState())) {
                throw new RuntimeException("Failed to create lock row: " + name, e);
            }
            log.debug("Lock row {} created concurrently", name);
        }
    }

    private static void closeQuietly(Connection conn, String name) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to release connection for lock {}: {}", name, e.getMessage());
        }
    }

    private static final class RowLockHandle implements Handle {

        private final String name;
        private final Connection conn;
        private boolean released;

        RowLockHandle(String name, Connection conn) {
            this.name = name;
            this.conn = conn;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            closeQuietly(conn, name);
            log.debug("Released lock {}", name);
        }
    }
}
