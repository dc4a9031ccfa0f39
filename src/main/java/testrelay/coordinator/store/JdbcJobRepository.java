package testrelay.coordinator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobClaimResult;
import testrelay.coordinator.model.JobOutcome;
import testrelay.coordinator.model.JobReportResult;
import testrelay.coordinator.model.JobResult;
import testrelay.coordinator.model.JobStartResult;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.repository.JobRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static testrelay.coordinator.store.JdbcSupport.isLockConflict;
import static testrelay.coordinator.store.JdbcSupport.setTimestamp;
import static testrelay.coordinator.store.JdbcSupport.toInstant;
import static testrelay.coordinator.store.JdbcSupport.truncate;

/**
 * JDBC implementation of JobRepository.
 * Every transition is a conditional UPDATE on the current status, so
 * concurrent callers cannot both win.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    // Width of jobs.error_message and job_results.error_message
    static final int MAX_ERROR_LENGTH = 4096;

    private static final String INSERT_SQL = """
                INSERT INTO jobs (id, project_id, test_id, run_id, job_type, payload, target_worker_id, worker_id,
                                  status, priority, retries, max_retries, error_message, trigger_execution_id,
                                  created_at, assigned_at, started_at, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        try (Connection conn = db.getConnection()) {
            insertAll(conn, List.of(job));
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    /**
     * Insert jobs inside a caller-owned transaction.
     */
    static void insertAll(Connection conn, List<Job> jobs) throws SQLException {
        if (jobs.isEmpty())
            return;

        try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            Instant now = Instant.now();
            for (Job job : jobs) {
                ps.setString(1, job.id());
                ps.setString(2, job.projectId());
                ps.setString(3, job.testId());
                ps.setString(4, job.runId());
                ps.setString(5, job.jobType());
                ps.setString(6, job.payload());
                ps.setString(7, job.targetWorkerId());
                ps.setString(8, job.workerId());
                ps.setString(9, job.status().name());
                ps.setInt(10, job.priority());
                ps.setInt(11, job.retries());
                ps.setInt(12, job.maxRetries());
                ps.setString(13, truncate(job.errorMessage(), MAX_ERROR_LENGTH));
                ps.setString(14, job.triggerExecutionId());
                setTimestamp(ps, 15, job.createdAt() != null ? job.createdAt() : now);
                setTimestamp(ps, 16, job.assignedAt());
                setTimestamp(ps, 17, job.startedAt());
                setTimestamp(ps, 18, job.completedAt());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByStatus(JobStatus status, int limit) {
        String sql = "SELECT * FROM jobs WHERE status = ? ORDER BY priority DESC, created_at, run_id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status: " + status, e);
        }
    }

    @Override
    public List<Job> findByTriggerExecution(String executionId) {
        String sql = "SELECT * FROM jobs WHERE trigger_execution_id = ? ORDER BY run_id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, executionId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs for execution: " + executionId, e);
        }
    }

    @Override
    public Optional<Job> findNextClaimable(Worker worker) {
        List<Job> candidates = findClaimable(worker, 1);
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    @Override
    public List<Job> findClaimable(Worker worker, int limit) {
        ClaimFilter filter = ClaimFilter.of(worker);
        String sql = "SELECT * FROM jobs WHERE " + filter.where()
                + " ORDER BY priority DESC, created_at ASC, run_id ASC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int next = filter.bind(ps, 1);
            ps.setInt(next, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find claimable jobs for worker: " + worker.id(), e);
        }
    }

    @Override
    public JobClaimResult claim(String jobId, String workerId) {
        String sql = """
                    UPDATE jobs
                    SET status = 'ASSIGNED', worker_id = ?, assigned_at = ?
                    WHERE id = ? AND status = 'PENDING'
                      AND (target_worker_id IS NULL OR target_worker_id = ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, workerId);
                setTimestamp(ps, 2, Instant.now());
                ps.setString(3, jobId);
                ps.setString(4, workerId);

                int updated = ps.executeUpdate();
                if (updated == 1) {
                    conn.commit();
                    log.debug("Job {} claimed by worker {}", jobId, workerId);
                    return JobClaimResult.CLAIMED;
                }
                conn.rollback();
            } catch (SQLException e) {
                conn.rollback();
                if (isLockConflict(e)) {
                    log.debug("Job {} claim by {} lost a lock race", jobId, workerId);
                    return JobClaimResult.ALREADY_CLAIMED;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim job: " + jobId, e);
        }

        return findById(jobId).isPresent() ? JobClaimResult.ALREADY_CLAIMED : JobClaimResult.NOT_FOUND;
    }

    @Override
    public JobStartResult start(String jobId, String workerId) {
        String startSql = """
                    UPDATE jobs
                    SET status = 'RUNNING', started_at = ?
                    WHERE id = ? AND worker_id = ? AND status = 'ASSIGNED'
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(startSql)) {
                setTimestamp(ps, 1, Instant.now());
                ps.setString(2, jobId);
                ps.setString(3, workerId);

                if (ps.executeUpdate() == 1) {
                    incrementRunning(conn, workerId);
                    conn.commit();
                    log.debug("Job {} started by worker {}", jobId, workerId);
                    return JobStartResult.STARTED;
                }
                conn.rollback();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to start job: " + jobId, e);
        }

        Optional<Job> job = findById(jobId);
        if (job.isEmpty()) {
            return JobStartResult.NOT_FOUND;
        }
        if (!job.get().isOwnedBy(workerId)) {
            return JobStartResult.NOT_OWNER;
        }
        return JobStartResult.INVALID_STATE;
    }

    @Override
    public JobReportResult report(String jobId, String workerId, JobOutcome outcome) {
        Optional<Job> jobOpt = findById(jobId);
        if (jobOpt.isEmpty()) {
            return JobReportResult.NOT_FOUND;
        }

        Job job = jobOpt.get();

        if (job.isTerminal()) {
            return JobReportResult.ALREADY_TERMINAL;
        }

        if (!job.isOwnedBy(workerId)) {
            log.warn("Worker {} reported job {} but it is held by {}", workerId, jobId, job.workerId());
            return JobReportResult.NOT_OWNER;
        }

        if (job.status() != JobStatus.RUNNING) {
            log.warn("Worker {} reported job {} before starting it", workerId, jobId);
            return JobReportResult.INVALID_STATE;
        }

        try (Connection conn = db.getConnection()) {
            try {
                Instant now = Instant.now();
                JobReportResult result = outcome.success()
                        ? markCompleted(conn, job, now)
                        : applyFailure(conn, job, outcome.errorMessage(), now);

                if (result == null) {
                    // Lost a race against cancel/release
                    conn.rollback();
                    return findById(jobId).map(j -> j.isTerminal()
                            ? JobReportResult.ALREADY_TERMINAL
                            : JobReportResult.NOT_OWNER).orElse(JobReportResult.NOT_FOUND);
                }

                decrementRunning(conn, workerId);

                if (result != JobReportResult.RETRIED) {
                    insertResult(conn, new JobResult(
                            jobId,
                            result == JobReportResult.COMPLETED ? JobStatus.COMPLETED : JobStatus.FAILED,
                            outcome.summaryJson(),
                            outcome.resultLogBase64(),
                            outcome.reportBase64(),
                            outcome.errorMessage(),
                            now));
                }

                conn.commit();
                log.info("Job {} reported by worker {} -> {}", jobId, workerId, result);
                return result;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to report job: " + jobId, e);
        }
    }

    @Override
    public boolean cancel(String jobId) {
        Optional<Job> jobOpt = findById(jobId);
        if (jobOpt.isEmpty() || !jobOpt.get().status().canTransitionTo(JobStatus.CANCELLED)) {
            return false;
        }

        Job job = jobOpt.get();
        String sql = """
                    UPDATE jobs
                    SET status = 'CANCELLED', completed_at = ?
                    WHERE id = ? AND status = ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                setTimestamp(ps, 1, Instant.now());
                ps.setString(2, jobId);
                ps.setString(3, job.status().name());

                if (ps.executeUpdate() == 0) {
                    conn.rollback();
                    return false;
                }
                if (job.status() == JobStatus.RUNNING && job.workerId() != null) {
                    decrementRunning(conn, job.workerId());
                }
                conn.commit();
                log.info("Job {} cancelled (was {})", jobId, job.status());
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel job: " + jobId, e);
        }
    }

    @Override
    public int releaseJobsForWorker(String workerId, String reason) {
        String sql = "SELECT * FROM jobs WHERE worker_id = ? AND status IN ('ASSIGNED', 'RUNNING')";

        List<Job> held;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workerId);
            held = executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs for worker: " + workerId, e);
        }

        int released = 0;
        for (Job job : held) {
            try (Connection conn = db.getConnection()) {
                try {
                    JobReportResult result = applyFailure(conn, job, reason, Instant.now());
                    if (result == null) {
                        conn.rollback();
                        continue;
                    }
                    if (result == JobReportResult.FAILED) {
                        insertResult(conn, new JobResult(job.id(), JobStatus.FAILED, null, null, null,
                                reason, Instant.now()));
                    }
                    conn.commit();
                    released++;
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                throw new RuntimeException("Failed to release job: " + job.id(), e);
            }
        }

        if (released > 0) {
            log.info("Released {} jobs from worker {}", released, workerId);
        }
        return released;
    }

    @Override
    public int countForWorker(String workerId, JobStatus status) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE worker_id = ? AND status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            ps.setString(2, status.name());
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs for worker: " + workerId, e);
        }
    }

    @Override
    public int countClaimable(Worker worker) {
        ClaimFilter filter = ClaimFilter.of(worker);
        String sql = "SELECT COUNT(*) FROM jobs WHERE " + filter.where();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            filter.bind(ps, 1);
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count claimable jobs for worker: " + worker.id(), e);
        }
    }

    @Override
    public int countByStatus(JobStatus status) {
        String sql = "SELECT COUNT(*) FROM jobs WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return count(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    @Override
    public Optional<JobResult> findResult(String jobId) {
        String sql = "SELECT * FROM job_results WHERE job_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new JobResult(
                            rs.getString("job_id"),
                            JobStatus.valueOf(rs.getString("status")),
                            rs.getString("summary"),
                            rs.getString("result_log_base64"),
                            rs.getString("report_base64"),
                            rs.getString("error_message"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find result for job: " + jobId, e);
        }
    }

    @Override
    public int deleteTerminalBefore(Instant cutoff) {
        String deleteResults = """
                    DELETE FROM job_results WHERE job_id IN (
                        SELECT id FROM jobs
                        WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND completed_at < ?
                    )
                """;
        String deleteJobs = """
                    DELETE FROM jobs
                    WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND completed_at < ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement results = conn.prepareStatement(deleteResults);
                    PreparedStatement jobs = conn.prepareStatement(deleteJobs)) {
                setTimestamp(results, 1, cutoff);
                results.executeUpdate();
                setTimestamp(jobs, 1, cutoff);
                int deleted = jobs.executeUpdate();
                conn.commit();
                return deleted;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete old jobs", e);
        }
    }

    // Transition helpers (caller owns the transaction)

    private JobReportResult markCompleted(Connection conn, Job job, Instant now) throws SQLException {
        requireTransition(job, JobStatus.COMPLETED);
        String sql = """
                    UPDATE jobs
                    SET status = 'COMPLETED', completed_at = ?, error_message = NULL
                    WHERE id = ? AND worker_id = ? AND status = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setTimestamp(ps, 1, now);
            ps.setString(2, job.id());
            ps.setString(3, job.workerId());
            ps.setString(4, job.status().name());
            return ps.executeUpdate() == 1 ? JobReportResult.COMPLETED : null;
        }
    }

    /**
     * Count one failure against the job. Returns RETRIED or FAILED, or null
     * if the job changed underneath us.
     */
    private JobReportResult applyFailure(Connection conn, Job job, String errorMessage, Instant now)
            throws SQLException {
        boolean retry = job.canRetryAfterFailure();
        requireTransition(job, retry ? JobStatus.PENDING : JobStatus.FAILED);

        String sql = retry
                ? """
                        UPDATE jobs
                        SET status = 'PENDING', retries = retries + 1, worker_id = NULL, assigned_at = NULL,
                            started_at = NULL, error_message = ?
                        WHERE id = ? AND worker_id = ? AND status = ? AND retries = ?
                    """
                : """
                        UPDATE jobs
                        SET status = 'FAILED', retries = retries + 1, completed_at = ?, error_message = ?
                        WHERE id = ? AND worker_id = ? AND status = ? AND retries = ?
                    """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (!retry) {
                setTimestamp(ps, i++, now);
            }
            ps.setString(i++, truncate(errorMessage, MAX_ERROR_LENGTH));
            ps.setString(i++, job.id());
            ps.setString(i++, job.workerId());
            ps.setString(i++, job.status().name());
            ps.setInt(i, job.retries());

            if (ps.executeUpdate() == 0) {
                return null;
            }
        }

        if (retry) {
            log.debug("Job {} requeued (retry {}/{})", job.id(), job.retries() + 1, job.maxRetries());
            return JobReportResult.RETRIED;
        }
        log.warn("Job {} failed permanently after {} retries: {}", job.id(), job.retries() + 1, errorMessage);
        return JobReportResult.FAILED;
    }

    private static void requireTransition(Job job, JobStatus next) {
        if (!job.status().canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + job.id() + " cannot move from " + job.status() + " to " + next);
        }
    }

    private static void incrementRunning(Connection conn, String workerId) throws SQLException {
        String sql = """
                    UPDATE workers
                    SET running_jobs = LEAST(running_jobs + 1, capacity),
                        status = CASE WHEN running_jobs + 1 >= capacity THEN 'BUSY' ELSE 'ONLINE' END
                    WHERE id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workerId);
            ps.executeUpdate();
        }
    }

    private static void decrementRunning(Connection conn, String workerId) throws SQLException {
        String sql = """
                    UPDATE workers
                    SET running_jobs = GREATEST(running_jobs - 1, 0),
                        status = CASE WHEN status = 'OFFLINE' THEN 'OFFLINE' ELSE 'ONLINE' END
                    WHERE id = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workerId);
            ps.executeUpdate();
        }
    }

    private static void insertResult(Connection conn, JobResult result) throws SQLException {
        String sql = """
                    INSERT INTO job_results (job_id, status, summary, result_log_base64, report_base64,
                                             error_message, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, result.jobId());
            ps.setString(2, result.status().name());
            ps.setString(3, result.summaryJson());
            ps.setString(4, result.resultLogBase64());
            ps.setString(5, result.reportBase64());
            ps.setString(6, truncate(result.errorMessage(), MAX_ERROR_LENGTH));
            setTimestamp(ps, 7, result.createdAt());
            ps.executeUpdate();
        }
    }

    // Helper methods

    private static int count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .projectId(rs.getString("project_id"))
                .testId(rs.getString("test_id"))
                .runId(rs.getString("run_id"))
                .jobType(rs.getString("job_type"))
                .payload(rs.getString("payload"))
                .targetWorkerId(rs.getString("target_worker_id"))
                .workerId(rs.getString("worker_id"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .retries(rs.getInt("retries"))
                .maxRetries(rs.getInt("max_retries"))
                .errorMessage(rs.getString("error_message"))
                .triggerExecutionId(rs.getString("trigger_execution_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .assignedAt(toInstant(rs.getTimestamp("assigned_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .build();
    }

    /**
     * WHERE clause selecting PENDING jobs a worker may take: same project
     * (unless the worker is unscoped), an accepted job type, and no
     * preference for another worker.
     */
    private record ClaimFilter(String where, List<String> params) {

        static ClaimFilter of(Worker worker) {
            StringBuilder where = new StringBuilder("status = 'PENDING'");
            List<String> params = new ArrayList<>();

            if (worker.projectId() != null) {
                where.append(" AND project_id = ?");
                params.add(worker.projectId());
            }

            if (!worker.capabilities().isEmpty()) {
                where.append(" AND job_type IN (");
                int n = 0;
                for (String capability : worker.capabilities()) {
                    where.append(n++ == 0 ? "?" : ", ?");
                    params.add(capability);
                }
                where.append(")");
            }

            where.append(" AND (target_worker_id IS NULL OR target_worker_id = ?)");
            params.add(worker.id());

            return new ClaimFilter(where.toString(), params);
        }

        int bind(PreparedStatement ps, int start) throws SQLException {
            int i = start;
            for (String param : params) {
                ps.setString(i++, param);
            }
            return i;
        }
    }
}
