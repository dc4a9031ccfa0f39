package testrelay.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.config.CoordinatorConfig;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("testrelay-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TRIGGERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS triggers (
                            id                 VARCHAR(64) PRIMARY KEY,
                            project_id         VARCHAR(64) NOT NULL,
                            name               VARCHAR(256),
                            is_active          BOOLEAN DEFAULT TRUE,
                            trigger_type       VARCHAR(20) NOT NULL,
                            target_type        VARCHAR(20) NOT NULL,
                            target_id          VARCHAR(64) NOT NULL,
                            assigned_worker_id VARCHAR(128),
                            schedule_type      VARCHAR(20),
                            schedule_time      VARCHAR(8),
                            schedule_day       INT,
                            schedule_timezone  VARCHAR(64),
                            priority           INT DEFAULT 0,
                            next_fire_at       TIMESTAMP,
                            last_fired_at      TIMESTAMP,
                            created_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TRIGGER EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS trigger_executions (
                            id              VARCHAR(64) PRIMARY KEY,
                            trigger_id      VARCHAR(64) NOT NULL,
                            project_id      VARCHAR(64),
                            triggered_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            source          VARCHAR(20) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            error_message   VARCHAR(2048),
                            job_id          VARCHAR(64),
                            jobs_created    INT DEFAULT 0,
                            completed_at    TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                   VARCHAR(64) PRIMARY KEY,
                            project_id           VARCHAR(64) NOT NULL,
                            test_id              VARCHAR(64),
                            run_id               VARCHAR(64) NOT NULL UNIQUE,
                            job_type             VARCHAR(64) DEFAULT 'performance',
                            payload              CLOB NOT NULL,
                            target_worker_id     VARCHAR(128),
                            worker_id            VARCHAR(128),
                            status               VARCHAR(20) DEFAULT 'PENDING',
                            priority             INT DEFAULT 0,
                            retries              INT DEFAULT 0,
                            max_retries          INT DEFAULT 3,
                            error_message        VARCHAR(4096),
                            trigger_execution_id VARCHAR(64),
                            created_at           TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            assigned_at          TIMESTAMP,
                            started_at           TIMESTAMP,
                            completed_at         TIMESTAMP
                        );
                    """);

            // ---------- JOB RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_results (
                            job_id            VARCHAR(64) PRIMARY KEY,
                            status            VARCHAR(20) NOT NULL,
                            summary           CLOB,
                            result_log_base64 CLOB,
                            report_base64     CLOB,
                            error_message     VARCHAR(4096),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(256),
                            project_id      VARCHAR(64),
                            capabilities    VARCHAR(1024),
                            status          VARCHAR(20) DEFAULT 'ONLINE',
                            capacity        INT DEFAULT 1,
                            running_jobs    INT DEFAULT 0,
                            system_info     CLOB,
                            last_heartbeat  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            registered_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TEST CATALOG ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tests (
                            id          VARCHAR(64) PRIMARY KEY,
                            project_id  VARCHAR(64) NOT NULL,
                            name        VARCHAR(256),
                            job_type    VARCHAR(64) DEFAULT 'performance',
                            payload     CLOB NOT NULL,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS suite_tests (
                            suite_id        VARCHAR(64) NOT NULL,
                            test_id         VARCHAR(64) NOT NULL,
                            execution_order INT NOT NULL,
                            PRIMARY KEY (suite_id, test_id)
                        );
                    """);

            // ---------- SETTINGS / AUDIT ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS app_settings (
                            setting_key    VARCHAR(128) PRIMARY KEY,
                            setting_value  VARCHAR(1024) NOT NULL,
                            updated_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS activity_log (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            project_id  VARCHAR(64),
                            event_type  VARCHAR(64) NOT NULL,
                            entity_id   VARCHAR(128),
                            details     CLOB,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // One row per named lock; held via row lock, never via a flag
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dispatch_locks (
                            name  VARCHAR(128) PRIMARY KEY
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_triggers_due ON triggers(trigger_type, is_active, next_fire_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_trigger ON trigger_executions(trigger_id, triggered_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_claim ON jobs(status, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_worker_status ON jobs(worker_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_heartbeat ON workers(last_heartbeat);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_suite_tests_order ON suite_tests(suite_id, execution_order);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_activity_created ON activity_log(created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
