package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ExecutionSource;
import testrelay.coordinator.model.ExecutionStatus;
import testrelay.coordinator.model.TriggerExecution;
import testrelay.coordinator.repository.TriggerExecutionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;
import static testrelay.coordinator.store.JdbcSupport.toInstant;
import static testrelay.coordinator.store.JdbcSupport.truncate;

/**
 * JDBC implementation of TriggerExecutionRepository.
 */
public class JdbcTriggerExecutionRepository implements TriggerExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerExecutionRepository.class);

    // Width of trigger_executions.error_message
    static final int MAX_ERROR_LENGTH = 2048;

    private final Database db;

    public JdbcTriggerExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(TriggerExecution execution) {
        String sql = """
                    INSERT INTO trigger_executions (id, trigger_id, project_id, triggered_at, source, status,
                                                    error_message, job_id, jobs_created, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, execution.id());
            ps.setString(2, execution.triggerId());
            ps.setString(3, execution.projectId());
            setTimestamp(ps, 4, execution.triggeredAt() != null ? execution.triggeredAt() : Instant.now());
            ps.setString(5, execution.source().name());
            ps.setString(6, execution.status().name());
            ps.setString(7, truncate(execution.errorMessage(), MAX_ERROR_LENGTH));
            ps.setString(8, execution.jobId());
            ps.setInt(9, execution.jobsCreated());
            setTimestamp(ps, 10, execution.completedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create trigger execution: " + execution.id(), e);
        }
    }

    @Override
    public Optional<TriggerExecution> findById(String executionId) {
        String sql = "SELECT * FROM trigger_executions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find trigger execution: " + executionId, e);
        }
    }

    @Override
    public List<TriggerExecution> findByTrigger(String triggerId, int limit) {
        String sql = """
                    SELECT * FROM trigger_executions
                    WHERE trigger_id = ?
                    ORDER BY triggered_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            ps.setInt(2, limit);

            List<TriggerExecution> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find executions for trigger: " + triggerId, e);
        }
    }

    @Override
    public boolean markFailed(String executionId, String errorMessage) {
        String sql = """
                    UPDATE trigger_executions
                    SET status = 'FAILED', error_message = ?, completed_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, truncate(errorMessage, MAX_ERROR_LENGTH));
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, executionId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Execution {} marked FAILED: {}", executionId, errorMessage);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark execution as failed: " + executionId, e);
        }
    }

    @Override
    public int deleteFinalizedBefore(Instant cutoff) {
        String sql = "DELETE FROM trigger_executions WHERE status <> 'PENDING' AND triggered_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete old trigger executions", e);
        }
    }

    /**
     * Finalize a PENDING execution inside a caller-owned transaction.
     *
     * @return true if the execution was still pending
     */
    static boolean finalizeExecution(Connection conn, String executionId, ExecutionStatus status, String errorMessage,
            String jobId, int jobsCreated, Instant at) throws SQLException {
        if (!ExecutionStatus.PENDING.canTransitionTo(status)) {
            throw new IllegalArgumentException("Execution cannot be finalized as " + status);
        }
        String sql = """
                    UPDATE trigger_executions
                    SET status = ?, error_message = ?, job_id = ?, jobs_created = ?, completed_at = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, truncate(errorMessage, MAX_ERROR_LENGTH));
            ps.setString(3, jobId);
            ps.setInt(4, jobsCreated);
            setTimestamp(ps, 5, at);
            ps.setString(6, executionId);
            return ps.executeUpdate() > 0;
        }
    }

    private TriggerExecution mapRow(ResultSet rs) throws SQLException {
        return TriggerExecution.builder()
                .id(rs.getString("id"))
                .triggerId(rs.getString("trigger_id"))
                .projectId(rs.getString("project_id"))
                .triggeredAt(toInstant(rs.getTimestamp("triggered_at")))
                .source(ExecutionSource.valueOf(rs.getString("source")))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .errorMessage(rs.getString("error_message"))
                .jobId(rs.getString("job_id"))
                .jobsCreated(rs.getInt("jobs_created"))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }
}
