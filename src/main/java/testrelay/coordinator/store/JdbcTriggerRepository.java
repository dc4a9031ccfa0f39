package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ScheduleRule;
import testrelay.coordinator.model.TargetType;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerType;
import testrelay.coordinator.repository.TriggerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.getIntOrNull;
import static testrelay.coordinator.store.JdbcSupport.setTimestamp;
import static testrelay.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TriggerRepository.
 */
public class JdbcTriggerRepository implements TriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerRepository.class);

    private final Database db;

    public JdbcTriggerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Trigger trigger) {
        String sql = """
                    INSERT INTO triggers (id, project_id, name, is_active, trigger_type, target_type, target_id,
                                          assigned_worker_id, schedule_type, schedule_time, schedule_day,
                                          schedule_timezone, priority, next_fire_at, last_fired_at,
                                          created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant now = Instant.now();
            ScheduleRule rule = trigger.scheduleRule();
            ps.setString(1, trigger.id());
            ps.setString(2, trigger.projectId());
            ps.setString(3, trigger.name());
            ps.setBoolean(4, trigger.active());
            ps.setString(5, trigger.triggerType().name());
            ps.setString(6, trigger.targetType().name());
            ps.setString(7, trigger.targetId());
            ps.setString(8, trigger.assignedWorkerId());
            ps.setString(9, rule.type().name());
            ps.setString(10, rule.timeOfDay().toString());
            ps.setInt(11, rule.dayOfWeek());
            ps.setString(12, rule.timezone().getId());
            ps.setInt(13, trigger.priority());
            setTimestamp(ps, 14, trigger.nextFireAt());
            setTimestamp(ps, 15, trigger.lastFiredAt());
            setTimestamp(ps, 16, trigger.createdAt() != null ? trigger.createdAt() : now);
            setTimestamp(ps, 17, trigger.updatedAt() != null ? trigger.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save trigger: " + trigger.id(), e);
        }
    }

    @Override
    public boolean update(Trigger trigger) {
        String sql = """
                    UPDATE triggers
                    SET name = ?, is_active = ?, trigger_type = ?, target_type = ?, target_id = ?,
                        assigned_worker_id = ?, schedule_type = ?, schedule_time = ?, schedule_day = ?,
                        schedule_timezone = ?, priority = ?, next_fire_at = ?, updated_at = ?
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ScheduleRule rule = trigger.scheduleRule();
            ps.setString(1, trigger.name());
            ps.setBoolean(2, trigger.active());
            ps.setString(3, trigger.triggerType().name());
            ps.setString(4, trigger.targetType().name());
            ps.setString(5, trigger.targetId());
            ps.setString(6, trigger.assignedWorkerId());
            ps.setString(7, rule.type().name());
            ps.setString(8, rule.timeOfDay().toString());
            ps.setInt(9, rule.dayOfWeek());
            ps.setString(10, rule.timezone().getId());
            ps.setInt(11, trigger.priority());
            setTimestamp(ps, 12, trigger.nextFireAt());
            setTimestamp(ps, 13, Instant.now());
            ps.setString(14, trigger.id());

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update trigger: " + trigger.id(), e);
        }
    }

    @Override
    public Optional<Trigger> findById(String triggerId) {
        String sql = "SELECT * FROM triggers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find trigger: " + triggerId, e);
        }
    }

    @Override
    public List<Trigger> findByProject(String projectId) {
        String sql = "SELECT * FROM triggers WHERE project_id = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, projectId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find triggers for project: " + projectId, e);
        }
    }

    @Override
    public List<Trigger> findDue(Instant now) {
        String sql = """
                    SELECT * FROM triggers
                    WHERE trigger_type = 'SCHEDULE'
                      AND is_active = TRUE
                      AND next_fire_at IS NOT NULL
                      AND next_fire_at <= ?
                    ORDER BY next_fire_at ASC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            List<Trigger> due = executeQuery(ps);
            if (!due.isEmpty()) {
                log.debug("Found {} due triggers at {}", due.size(), now);
            }
            return due;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find due triggers", e);
        }
    }

    @Override
    public boolean delete(String triggerId) {
        String sql = "DELETE FROM triggers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, triggerId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete trigger: " + triggerId, e);
        }
    }

    // Helper methods

    private List<Trigger> executeQuery(PreparedStatement ps) throws SQLException {
        List<Trigger> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Trigger mapRow(ResultSet rs) throws SQLException {
        return Trigger.builder()
                .id(rs.getString("id"))
                .projectId(rs.getString("project_id"))
                .name(rs.getString("name"))
                .active(rs.getBoolean("is_active"))
                .triggerType(TriggerType.valueOf(rs.getString("trigger_type")))
                .targetType(TargetType.valueOf(rs.getString("target_type")))
                .targetId(rs.getString("target_id"))
                .assignedWorkerId(rs.getString("assigned_worker_id"))
                .scheduleRule(ScheduleRule.parse(
                        rs.getString("schedule_type"),
                        rs.getString("schedule_time"),
                        getIntOrNull(rs, "schedule_day"),
                        rs.getString("schedule_timezone")))
                .priority(rs.getInt("priority"))
                .nextFireAt(toInstant(rs.getTimestamp("next_fire_at")))
                .lastFiredAt(toInstant(rs.getTimestamp("last_fired_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
