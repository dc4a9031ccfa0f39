package testrelay.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobClaimResult;
import testrelay.coordinator.model.JobOutcome;
import testrelay.coordinator.model.JobReportResult;
import testrelay.coordinator.model.JobResult;
import testrelay.coordinator.model.JobStartResult;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.repository.JobRepository;
import testrelay.coordinator.repository.WorkerRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for the job queue.
 * Contains the poll/claim/start/report protocol spoken by workers.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    /** Candidates tried by {@link #claimNext} before giving up on this poll */
    static final int MAX_CLAIM_ATTEMPTS = 5;

    private final JobRepository jobRepository;
    private final WorkerRepository workerRepository;
    private final ActivityService activity;

    public JobService(JobRepository jobRepository, WorkerRepository workerRepository, ActivityService activity) {
        this.jobRepository = jobRepository;
        this.workerRepository = workerRepository;
        this.activity = activity;
    }

    /**
     * Enqueue a job submitted directly through the API.
     */
    public Job submit(Job job) {
        if (job.projectId() == null || job.projectId().isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (job.status() != JobStatus.PENDING) {
            throw new IllegalArgumentException("New jobs must be PENDING");
        }

        jobRepository.save(job);
        log.info("Submitted job {} (run {}, type {}, priority {})",
                job.id(), job.runId(), job.jobType(), job.priority());
        return job;
    }

    /**
     * The job a worker should claim next, if it has spare capacity.
     *
     * @throws IllegalArgumentException if the worker is not registered
     */
    public Optional<Job> poll(String workerId) {
        Worker worker = requireWorker(workerId);

        if (!hasSpareCapacity(worker)) {
            log.debug("Worker {} at capacity ({}), no job offered", workerId, worker.capacity());
            return Optional.empty();
        }

        return jobRepository.findNextClaimable(worker);
    }

    /**
     * Peek and claim in one call, moving past candidates lost to other
     * workers.
     */
    public Optional<Job> claimNext(String workerId) {
        Worker worker = requireWorker(workerId);

        if (!hasSpareCapacity(worker)) {
            return Optional.empty();
        }

        for (Job candidate : jobRepository.findClaimable(worker, MAX_CLAIM_ATTEMPTS)) {
            JobClaimResult result = jobRepository.claim(candidate.id(), workerId);
            if (result == JobClaimResult.CLAIMED) {
                return jobRepository.findById(candidate.id());
            }
            log.debug("Lost claim on job {} ({}), trying next", candidate.id(), result);
        }
        return Optional.empty();
    }

    public JobClaimResult claim(String jobId, String workerId) {
        requireIds(jobId, workerId);
        return jobRepository.claim(jobId, workerId);
    }

    public JobStartResult start(String jobId, String workerId) {
        requireIds(jobId, workerId);

        JobStartResult result = jobRepository.start(jobId, workerId);
        if (result == JobStartResult.STARTED) {
            jobRepository.findById(jobId).ifPresent(job -> activity.record(job.projectId(),
                    ActivityEvent.JOB_STARTED, jobId, details(job, workerId)));
        } else {
            log.warn("Worker {} could not start job {}: {}", workerId, jobId, result);
        }
        return result;
    }

    public JobReportResult report(String jobId, String workerId, JobOutcome outcome) {
        requireIds(jobId, workerId);
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }

        JobReportResult result = jobRepository.report(jobId, workerId, outcome);

        switch (result) {
            case COMPLETED, FAILED, RETRIED -> jobRepository.findById(jobId).ifPresent(job -> {
                Map<String, Object> details = details(job, workerId);
                details.put("outcome", result.name().toLowerCase());
                if (outcome.errorMessage() != null) {
                    details.put("error", outcome.errorMessage());
                }
                activity.record(job.projectId(), ActivityEvent.JOB_FINISHED, jobId, details);
            });
            case ALREADY_TERMINAL -> log.debug("Job {} already terminal (idempotent)", jobId);
            default -> log.warn("Report for job {} by worker {} rejected: {}", jobId, workerId, result);
        }
        return result;
    }

    public boolean cancel(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }

        boolean cancelled = jobRepository.cancel(jobId);
        if (cancelled) {
            jobRepository.findById(jobId).ifPresent(job -> activity.record(job.projectId(),
                    ActivityEvent.JOB_CANCELLED, jobId, details(job, job.workerId())));
        }
        return cancelled;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public Optional<JobResult> findResult(String jobId) {
        return jobRepository.findResult(jobId);
    }

    public List<Job> findByStatus(JobStatus status, int limit) {
        return jobRepository.findByStatus(status, Math.max(1, Math.min(limit, 500)));
    }

    public int countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    /**
     * Capacity gate: reported running jobs plus jobs claimed but not yet
     * started must leave room for one more.
     */
    boolean hasSpareCapacity(Worker worker) {
        int assigned = jobRepository.countForWorker(worker.id(), JobStatus.ASSIGNED);
        return worker.runningJobs() + assigned < worker.capacity();
    }

    private Worker requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        return workerRepository.findById(workerId)
                .orElseThrow(() -> new IllegalArgumentException("Agent not registered: " + workerId));
    }

    private static void requireIds(String jobId, String workerId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
    }

    private static Map<String, Object> details(Job job, String workerId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("job_id", job.id());
        details.put("run_id", job.runId());
        details.put("test_id", job.testId());
        details.put("worker_id", workerId);
        return details;
    }
}
