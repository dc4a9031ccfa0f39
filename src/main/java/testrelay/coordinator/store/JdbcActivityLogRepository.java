package testrelay.coordinator.store;

import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.repository.ActivityLogRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;
import static testrelay.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of ActivityLogRepository.
 */
public class JdbcActivityLogRepository implements ActivityLogRepository {

    private final Database db;

    public JdbcActivityLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(ActivityEvent event) {
        try (Connection conn = db.getConnection()) {
            insert(conn, event);
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append activity event: " + event.eventType(), e);
        }
    }

    /**
     * Append inside a caller-owned transaction.
     */
    static void insert(Connection conn, ActivityEvent event) throws SQLException {
        String sql = """
                    INSERT INTO activity_log (project_id, event_type, entity_id, details, created_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, event.projectId());
            ps.setString(2, event.eventType());
            ps.setString(3, event.entityId());
            ps.setString(4, event.details());
            setTimestamp(ps, 5, event.createdAt() != null ? event.createdAt() : Instant.now());
            ps.executeUpdate();
        }
    }

    @Override
    public List<ActivityEvent> findRecent(String eventType, int limit) {
        String sql = eventType == null
                ? "SELECT * FROM activity_log ORDER BY created_at DESC, id DESC LIMIT ?"
                : "SELECT * FROM activity_log WHERE event_type = ? ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            if (eventType != null) {
                ps.setString(i++, eventType);
            }
            ps.setInt(i, limit);

            List<ActivityEvent> events = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    events.add(new ActivityEvent(
                            rs.getLong("id"),
                            rs.getString("project_id"),
                            rs.getString("event_type"),
                            rs.getString("entity_id"),
                            rs.getString("details"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return events;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read activity log", e);
        }
    }

    @Override
    public int deleteBefore(Instant cutoff) {
        String sql = "DELETE FROM activity_log WHERE created_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete old activity events", e);
        }
    }
}
