package testrelay.coordinator.repository;

import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobClaimResult;
import testrelay.coordinator.model.JobOutcome;
import testrelay.coordinator.model.JobReportResult;
import testrelay.coordinator.model.JobResult;
import testrelay.coordinator.model.JobStartResult;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.Worker;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the job queue.
 * Every status change is conditioned on the current status.
 */
public interface JobRepository {

    /**
     * Save a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    Optional<Job> findById(String jobId);

    List<Job> findByStatus(JobStatus status, int limit);

    List<Job> findByTriggerExecution(String executionId);

    /**
     * Peek at the job the given worker would receive next, without claiming
     * it. Highest priority first, then oldest.
     *
     * @param worker the polling worker (scope and capabilities)
     * @return the best candidate, if any
     */
    Optional<Job> findNextClaimable(Worker worker);

    /**
     * Candidates in claim order, used to move past lost races.
     */
    List<Job> findClaimable(Worker worker, int limit);

    /**
     * Atomically move a PENDING job to ASSIGNED for the given worker.
     * Two concurrent claims on the same job never both succeed.
     *
     * @param jobId    the job
     * @param workerId the claiming worker
     * @return claim outcome
     */
    JobClaimResult claim(String jobId, String workerId);

    /**
     * Move an ASSIGNED job held by the worker to RUNNING and count it
     * against the worker's running jobs.
     */
    JobStartResult start(String jobId, String workerId);

    /**
     * Apply a terminal report from the owning worker. Failures go through
     * the retry counter: PENDING again while {@code retries < maxRetries},
     * FAILED afterwards.
     */
    JobReportResult report(String jobId, String workerId, JobOutcome outcome);

    /**
     * Cancel a non-terminal job.
     *
     * @return true if the job was cancelled by this call
     */
    boolean cancel(String jobId);

    /**
     * Release every ASSIGNED or RUNNING job of a worker through the retry
     * counter.
     *
     * @return number of jobs released
     */
    int releaseJobsForWorker(String workerId, String reason);

    /**
     * Jobs held by the worker in the given status.
     */
    int countForWorker(String workerId, JobStatus status);

    /**
     * PENDING jobs the worker would be allowed to claim.
     */
    int countClaimable(Worker worker);

    int countByStatus(JobStatus status);

    Optional<JobResult> findResult(String jobId);

    /**
     * Delete terminal jobs (and their results) completed before the cutoff.
     */
    int deleteTerminalBefore(Instant cutoff);
}
