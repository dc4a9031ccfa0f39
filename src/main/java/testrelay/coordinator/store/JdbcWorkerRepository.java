package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.model.WorkerStatus;
import testrelay.coordinator.repository.WorkerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;
import static testrelay.coordinator.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of WorkerRepository.
 * Capabilities are stored as a comma-separated list.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final Database db;

    public JdbcWorkerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void register(Worker worker) {
        // UPDATE + INSERT so running_jobs survives a re-registration
        String updateSql = """
                    UPDATE workers
                    SET name = ?, project_id = ?, capabilities = ?, capacity = ?, system_info = ?,
                        status = 'ONLINE', last_heartbeat = ?
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO workers (id, name, project_id, capabilities, status, capacity, running_jobs,
                                         system_info, last_heartbeat, registered_at)
                    VALUES (?, ?, ?, ?, 'ONLINE', ?, 0, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            Instant now = Instant.now();

            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setString(1, worker.name());
                ps.setString(2, worker.projectId());
                ps.setString(3, joinCapabilities(worker.capabilities()));
                ps.setInt(4, worker.capacity());
                ps.setString(5, worker.systemInfo());
                setTimestamp(ps, 6, now);
                ps.setString(7, worker.id());

                if (ps.executeUpdate() == 0) {
                    try (PreparedStatement insertPs = conn.prepareStatement(insertSql)) {
                        insertPs.setString(1, worker.id());
                        insertPs.setString(2, worker.name());
                        insertPs.setString(3, worker.projectId());
                        insertPs.setString(4, joinCapabilities(worker.capabilities()));
                        insertPs.setInt(5, worker.capacity());
                        insertPs.setString(6, worker.systemInfo());
                        setTimestamp(insertPs, 7, now);
                        setTimestamp(insertPs, 8, now);
                        insertPs.executeUpdate();
                    }
                }
            }

            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to register worker: " + worker.id(), e);
        }
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        String sql = "SELECT * FROM workers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find worker: " + workerId, e);
        }
    }

    @Override
    public List<Worker> findAll() {
        String sql = "SELECT * FROM workers ORDER BY last_heartbeat DESC";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<Worker> workers = new ArrayList<>();
            while (rs.next()) {
                workers.add(mapRow(rs));
            }
            return workers;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find all workers", e);
        }
    }

    @Override
    public boolean heartbeat(String workerId, int runningJobs, int capacity, String systemInfo, Instant at) {
        int effectiveCapacity = Math.max(1, capacity);
        int clamped = Math.max(0, Math.min(runningJobs, effectiveCapacity));

        String sql = """
                    UPDATE workers
                    SET running_jobs = ?, capacity = ?, status = ?, last_heartbeat = ?,
                        system_info = COALESCE(?, system_info)
                    WHERE id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, clamped);
            ps.setInt(2, effectiveCapacity);
            ps.setString(3, WorkerStatus.forLoad(clamped, effectiveCapacity).name());
            setTimestamp(ps, 4, at);
            ps.setString(5, systemInfo);
            ps.setString(6, workerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update heartbeat for worker: " + workerId, e);
        }
    }

    @Override
    public List<String> markStaleOffline(Instant cutoff) {
        String selectSql = "SELECT id FROM workers WHERE last_heartbeat < ? AND status <> 'OFFLINE'";
        String updateSql = """
                    UPDATE workers SET status = 'OFFLINE', running_jobs = 0
                    WHERE id = ? AND last_heartbeat < ? AND status <> 'OFFLINE'
                """;

        List<String> staleIds = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            List<String> candidates = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                setTimestamp(ps, 1, cutoff);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("id"));
                    }
                }
            }

            // Per-row so a worker that heartbeats in between is left alone
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                for (String id : candidates) {
                    ps.setString(1, id);
                    setTimestamp(ps, 2, cutoff);
                    if (ps.executeUpdate() > 0) {
                        staleIds.add(id);
                    }
                }
            }

            conn.commit();

            if (!staleIds.isEmpty()) {
                log.info("Marked {} stale workers as OFFLINE: {}", staleIds.size(), staleIds);
            }
            return staleIds;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark stale workers", e);
        }
    }

    @Override
    public int countByStatus(WorkerStatus status) {
        String sql = "SELECT COUNT(*) FROM workers WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count workers", e);
        }
    }

    // Helper methods

    private static String joinCapabilities(Set<String> capabilities) {
        return capabilities == null || capabilities.isEmpty() ? null : String.join(",", capabilities);
    }

    private static Set<String> splitCapabilities(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        return result;
    }

    private Worker mapRow(ResultSet rs) throws SQLException {
        return Worker.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .projectId(rs.getString("project_id"))
                .capabilities(splitCapabilities(rs.getString("capabilities")))
                .status(WorkerStatus.valueOf(rs.getString("status")))
                .capacity(rs.getInt("capacity"))
                .runningJobs(rs.getInt("running_jobs"))
                .systemInfo(rs.getString("system_info"))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .build();
    }
}
