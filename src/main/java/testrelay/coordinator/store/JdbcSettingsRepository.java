package testrelay.coordinator.store;

import testrelay.coordinator.repository.SettingsRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of SettingsRepository.
 */
public class JdbcSettingsRepository implements SettingsRepository {

    private final Database db;

    public JdbcSettingsRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<String> find(String key) {
        String sql = "SELECT setting_value FROM app_settings WHERE setting_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read setting: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        String sql = """
                    MERGE INTO app_settings (setting_key, setting_value, updated_at)
                    KEY (setting_key)
                    VALUES (?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            setTimestamp(ps, 3, Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to write setting: " + key, e);
        }
    }
}
