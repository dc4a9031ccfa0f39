package testrelay.coordinator.store;

import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.SuiteMember;
import testrelay.coordinator.model.TestDefinition;
import testrelay.coordinator.repository.TestCatalog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of TestCatalog.
 */
public class JdbcTestCatalog implements TestCatalog {

    private final Database db;

    public JdbcTestCatalog(Database db) {
        this.db = db;
    }

    @Override
    public Optional<TestDefinition> findTest(String testId) {
        String sql = "SELECT * FROM tests WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, testId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapTest(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find test: " + testId, e);
        }
    }

    @Override
    public List<SuiteMember> findSuiteMembers(String suiteId) {
        // Inner join drops members whose test was deleted
        String sql = """
                    SELECT st.execution_order, t.*
                    FROM suite_tests st
                    JOIN tests t ON t.id = st.test_id
                    WHERE st.suite_id = ?
                    ORDER BY st.execution_order ASC, t.id ASC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, suiteId);
            List<SuiteMember> members = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    members.add(new SuiteMember(rs.getInt("execution_order"), mapTest(rs)));
                }
            }
            return members;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find members of suite: " + suiteId, e);
        }
    }

    @Override
    public void saveTest(TestDefinition test) {
        String sql = """
                    MERGE INTO tests (id, project_id, name, job_type, payload, created_at)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, test.id());
            ps.setString(2, test.projectId());
            ps.setString(3, test.name());
            ps.setString(4, test.jobType() != null ? test.jobType() : Job.DEFAULT_JOB_TYPE);
            ps.setString(5, test.payload() != null ? test.payload() : "{}");
            setTimestamp(ps, 6, Instant.now());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save test: " + test.id(), e);
        }
    }

    @Override
    public void addSuiteMember(String suiteId, String testId, int executionOrder) {
        String sql = """
                    MERGE INTO suite_tests (suite_id, test_id, execution_order)
                    KEY (suite_id, test_id)
                    VALUES (?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, suiteId);
            ps.setString(2, testId);
            ps.setInt(3, executionOrder);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to add test " + testId + " to suite " + suiteId, e);
        }
    }

    private TestDefinition mapTest(ResultSet rs) throws SQLException {
        return new TestDefinition(
                rs.getString("id"),
                rs.getString("project_id"),
                rs.getString("name"),
                rs.getString("job_type"),
                rs.getString("payload"));
    }
}
