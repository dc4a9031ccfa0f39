package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ExecutionStatus;
import testrelay.coordinator.model.Firing;
import testrelay.coordinator.repository.DispatchStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of DispatchStore.
 * The trigger row is advanced with a compare-and-set on its previous
 * next_fire_at, so a firing is recorded at most once per due time.
 */
public class JdbcDispatchStore implements DispatchStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDispatchStore.class);

    private final Database db;

    public JdbcDispatchStore(Database db) {
        this.db = db;
    }

    @Override
    public boolean recordFiring(Firing firing) {
        String triggerId = firing.trigger().id();

        try (Connection conn = db.getConnection()) {
            try {
                if (!touchTrigger(conn, firing)) {
                    conn.rollback();
                    log.debug("Trigger {} was advanced concurrently, firing discarded", triggerId);
                    return false;
                }

                JdbcJobRepository.insertAll(conn, firing.jobs());

                String firstJobId = firing.jobs().isEmpty() ? null : firing.jobs().get(0).id();
                boolean finalized = JdbcTriggerExecutionRepository.finalizeExecution(
                        conn,
                        firing.executionId(),
                        firing.failed() ? ExecutionStatus.FAILED : ExecutionStatus.QUEUED,
                        firing.errorMessage(),
                        firstJobId,
                        firing.jobs().size(),
                        firing.firedAt());

                if (!finalized) {
                    conn.rollback();
                    log.warn("Execution {} for trigger {} is no longer pending", firing.executionId(), triggerId);
                    return false;
                }

                if (firing.event() != null) {
                    JdbcActivityLogRepository.insert(conn, firing.event());
                }

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record firing of trigger: " + triggerId, e);
        }
    }

    private boolean touchTrigger(Connection conn, Firing firing) throws SQLException {
        if (!firing.advancesSchedule()) {
            String sql = "UPDATE triggers SET last_fired_at = ?, updated_at = ? WHERE id = ?";
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, firing.firedAt());
                setTimestamp(ps, 2, firing.firedAt());
                ps.setString(3, firing.trigger().id());
                return ps.executeUpdate() > 0;
            }
        }

        String sql = """
                    UPDATE triggers
                    SET next_fire_at = ?, last_fired_at = ?, updated_at = ?
                    WHERE id = ? AND next_fire_at = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, firing.nextFireAt());
            setTimestamp(ps, 2, firing.firedAt());
            setTimestamp(ps, 3, firing.firedAt());
            ps.setString(4, firing.trigger().id());
            setTimestamp(ps, 5, firing.trigger().nextFireAt());
            return ps.executeUpdate() > 0;
        }
    }
}
