package testrelay.coordinator.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private Dependencies deps;
    private JobRepository jobs;
    private WorkerRepository workers;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config);
        jobs = deps.jobRepository();
        workers = deps.workerRepository();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private Worker registerWorker(String id, int capacity) {
        Worker worker = Worker.builder().id(id).projectId("proj-1").capacity(capacity)
                .capabilities(Set.of("performance")).build();
        workers.register(worker);
        return workers.findById(id).orElseThrow();
    }

    private Job saveJob(String runId, int priority, Instant createdAt) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .projectId("proj-1")
                .runId(runId)
                .payload("{\"threads\":1}")
                .priority(priority)
                .createdAt(createdAt)
                .build();
        jobs.save(job);
        return job;
    }

    private Job saveJob(String runId) {
        return saveJob(runId, 0, Instant.now());
    }

    @Test
    @DisplayName("Saved job is read back with its payload")
    void saveAndFind() {
        Job job = saveJob("RUN-A");

        Job found = jobs.findById(job.id()).orElseThrow();
        assertEquals("RUN-A", found.runId());
        assertEquals("{\"threads\":1}", found.payload());
        assertEquals(JobStatus.PENDING, found.status());
        assertNull(found.workerId());
    }

    @Test
    @DisplayName("Claim succeeds once, then reports already claimed")
    void claimOnce() {
        registerWorker("w-1", 1);
        registerWorker("w-2", 1);
        Job job = saveJob("RUN-A");

        assertEquals(JobClaimResult.CLAIMED, jobs.claim(job.id(), "w-1"));
        assertEquals(JobClaimResult.ALREADY_CLAIMED, jobs.claim(job.id(), "w-2"));
        assertEquals(JobClaimResult.NOT_FOUND, jobs.claim("missing", "w-1"));

        Job claimed = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.ASSIGNED, claimed.status());
        assertEquals("w-1", claimed.workerId());
        assertNotNull(claimed.assignedAt());
    }

    @Test
    @DisplayName("Concurrent claims on one job produce exactly one winner")
    void concurrentClaims() throws Exception {
        Job job = saveJob("RUN-RACE");
        int contenders = 8;
        for (int i = 0; i < contenders; i++) {
            registerWorker("w-" + i, 1);
        }

        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<JobClaimResult>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String workerId = "w-" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    return jobs.claim(job.id(), workerId);
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<JobClaimResult> result : results) {
                JobClaimResult r = result.get(30, TimeUnit.SECONDS);
                if (r == JobClaimResult.CLAIMED) {
                    winners++;
                } else {
                    assertEquals(JobClaimResult.ALREADY_CLAIMED, r);
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(JobStatus.ASSIGNED, jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("Claim order is priority first, then oldest")
    void claimOrder() {
        Worker worker = registerWorker("w-1", 5);
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");

        Job lowOld = saveJob("RUN-LOW-OLD", 0, t0);
        Job highNew = saveJob("RUN-HIGH-NEW", 10, t0.plusSeconds(60));
        Job highOld = saveJob("RUN-HIGH-OLD", 10, t0.plusSeconds(30));
        Job lowNew = saveJob("RUN-LOW-NEW", 0, t0.plusSeconds(90));

        List<String> order = jobs.findClaimable(worker, 10).stream().map(Job::id).toList();
        assertEquals(List.of(highOld.id(), highNew.id(), lowOld.id(), lowNew.id()), order);
        assertEquals(highOld.id(), jobs.findNextClaimable(worker).orElseThrow().id());
    }

    @Test
    @DisplayName("Jobs aimed at another worker, project or job type are not offered")
    void claimFilter() {
        Worker worker = registerWorker("w-1", 1);

        jobs.save(Job.builder().id("j-other-worker").projectId("proj-1").runId("RUN-1")
                .targetWorkerId("w-2").build());
        jobs.save(Job.builder().id("j-other-project").projectId("proj-2").runId("RUN-2").build());
        jobs.save(Job.builder().id("j-other-type").projectId("proj-1").runId("RUN-3").jobType("api").build());

        assertTrue(jobs.findNextClaimable(worker).isEmpty());
        assertEquals(0, jobs.countClaimable(worker));
        assertEquals(JobClaimResult.ALREADY_CLAIMED, jobs.claim("j-other-worker", "w-1"));

        jobs.save(Job.builder().id("j-mine").projectId("proj-1").runId("RUN-4").targetWorkerId("w-1").build());
        assertEquals("j-mine", jobs.findNextClaimable(worker).orElseThrow().id());
        assertEquals(1, jobs.countClaimable(worker));
    }

    @Test
    @DisplayName("Start requires ownership of an ASSIGNED job")
    void startRequiresOwnership() {
        registerWorker("w-1", 1);
        registerWorker("w-2", 1);
        Job job = saveJob("RUN-A");

        assertEquals(JobStartResult.NOT_OWNER, jobs.start(job.id(), "w-1"));
        jobs.claim(job.id(), "w-1");

        assertEquals(JobStartResult.NOT_OWNER, jobs.start(job.id(), "w-2"));
        assertEquals(JobStartResult.STARTED, jobs.start(job.id(), "w-1"));
        assertEquals(JobStartResult.INVALID_STATE, jobs.start(job.id(), "w-1"));
        assertEquals(JobStartResult.NOT_FOUND, jobs.start("missing", "w-1"));

        assertEquals(1, workers.findById("w-1").orElseThrow().runningJobs());
        assertEquals(1, jobs.countForWorker("w-1", JobStatus.RUNNING));
    }

    @Test
    @DisplayName("Successful report completes the job and stores the result")
    void reportSuccess() {
        registerWorker("w-1", 1);
        Job job = saveJob("RUN-A");
        jobs.claim(job.id(), "w-1");
        jobs.start(job.id(), "w-1");

        JobReportResult result = jobs.report(job.id(), "w-1",
                JobOutcome.completed("{\"totalRequests\":10}", "bG9n", "cmVwb3J0"));

        assertEquals(JobReportResult.COMPLETED, result);
        Job done = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertNotNull(done.completedAt());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());

        JobResult stored = jobs.findResult(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, stored.status());
        assertEquals("{\"totalRequests\":10}", stored.summaryJson());
        assertEquals("bG9n", stored.resultLogBase64());

        // Repeated report is a no-op
        assertEquals(JobReportResult.ALREADY_TERMINAL, jobs.report(job.id(), "w-1", JobOutcome.failed("late")));
        assertEquals(JobStatus.COMPLETED, jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("Failures go back to the queue until the retry budget is spent")
    void retryThenFail() {
        registerWorker("w-1", 1);
        Job job = Job.builder().id("j-retry").projectId("proj-1").runId("RUN-R").maxRetries(2).build();
        jobs.save(job);

        jobs.claim(job.id(), "w-1");
        jobs.start(job.id(), "w-1");
        assertEquals(JobReportResult.RETRIED, jobs.report(job.id(), "w-1", JobOutcome.failed("boom 1")));

        Job requeued = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, requeued.status());
        assertEquals(1, requeued.retries());
        assertNull(requeued.workerId());
        assertEquals("boom 1", requeued.errorMessage());
        assertTrue(jobs.findResult(job.id()).isEmpty());

        assertEquals(JobClaimResult.CLAIMED, jobs.claim(job.id(), "w-1"));
        jobs.start(job.id(), "w-1");
        assertEquals(JobReportResult.FAILED, jobs.report(job.id(), "w-1", JobOutcome.failed("boom 2")));

        Job failed = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(2, failed.retries());
        assertEquals(JobStatus.FAILED, jobs.findResult(job.id()).orElseThrow().status());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());
    }

    @Test
    @DisplayName("Oversized failure messages are cut to fit instead of wedging the job")
    void longErrorMessage() {
        registerWorker("w-1", 1);
        Job retried = saveJob("RUN-A");
        jobs.claim(retried.id(), "w-1");
        jobs.start(retried.id(), "w-1");

        assertEquals(JobReportResult.RETRIED, jobs.report(retried.id(), "w-1", JobOutcome.failed("x".repeat(5000))));

        Job requeued = jobs.findById(retried.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, requeued.status());
        assertEquals(JdbcJobRepository.MAX_ERROR_LENGTH, requeued.errorMessage().length());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());

        Job last = Job.builder().id("j-last").projectId("proj-1").runId("RUN-L").maxRetries(1).build();
        jobs.save(last);
        jobs.claim(last.id(), "w-1");
        jobs.start(last.id(), "w-1");

        assertEquals(JobReportResult.FAILED, jobs.report(last.id(), "w-1", JobOutcome.failed("y".repeat(9000))));

        assertEquals(JobStatus.FAILED, jobs.findById(last.id()).orElseThrow().status());
        JobResult stored = jobs.findResult(last.id()).orElseThrow();
        assertEquals(JdbcJobRepository.MAX_ERROR_LENGTH, stored.errorMessage().length());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());
    }

    @Test
    @DisplayName("A claimed job must be started before it can be reported")
    void reportBeforeStart() {
        registerWorker("w-1", 1);
        Job job = saveJob("RUN-A");
        jobs.claim(job.id(), "w-1");

        assertEquals(JobReportResult.INVALID_STATE,
                jobs.report(job.id(), "w-1", JobOutcome.completed("{}", null, null)));
        assertEquals(JobReportResult.INVALID_STATE, jobs.report(job.id(), "w-1", JobOutcome.failed("early")));

        Job unchanged = jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.ASSIGNED, unchanged.status());
        assertEquals(0, unchanged.retries());
        assertTrue(jobs.findResult(job.id()).isEmpty());
    }

    @Test
    @DisplayName("Pending and claimed jobs can be cancelled, finished ones cannot")
    void cancelFollowsTransitions() {
        registerWorker("w-1", 1);
        Job pending = saveJob("RUN-P");
        Job assigned = saveJob("RUN-A");
        Job failed = Job.builder().id("j-failed").projectId("proj-1").runId("RUN-F").maxRetries(1).build();
        jobs.save(failed);
        jobs.claim(failed.id(), "w-1");
        jobs.start(failed.id(), "w-1");
        jobs.report(failed.id(), "w-1", JobOutcome.failed("boom"));
        jobs.claim(assigned.id(), "w-1");

        assertTrue(jobs.cancel(pending.id()));
        assertTrue(jobs.cancel(assigned.id()));
        assertFalse(jobs.cancel(failed.id()));
        assertFalse(jobs.cancel("missing"));

        assertEquals(JobStatus.CANCELLED, jobs.findById(pending.id()).orElseThrow().status());
        assertEquals(JobStatus.CANCELLED, jobs.findById(assigned.id()).orElseThrow().status());
        assertEquals(JobStatus.FAILED, jobs.findById(failed.id()).orElseThrow().status());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());
    }

    @Test
    @DisplayName("Reports from a worker that does not hold the job are rejected")
    void reportByStranger() {
        registerWorker("w-1", 1);
        registerWorker("w-2", 1);
        Job job = saveJob("RUN-A");
        jobs.claim(job.id(), "w-1");

        assertEquals(JobReportResult.NOT_OWNER, jobs.report(job.id(), "w-2", JobOutcome.completed(null, null, null)));
        assertEquals(JobReportResult.NOT_FOUND, jobs.report("missing", "w-1", JobOutcome.failed("x")));
        assertEquals(JobStatus.ASSIGNED, jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    @DisplayName("Cancel stops a running job and frees the worker slot")
    void cancelRunning() {
        registerWorker("w-1", 1);
        Job job = saveJob("RUN-A");
        jobs.claim(job.id(), "w-1");
        jobs.start(job.id(), "w-1");

        assertTrue(jobs.cancel(job.id()));
        assertFalse(jobs.cancel(job.id()));
        assertEquals(JobStatus.CANCELLED, jobs.findById(job.id()).orElseThrow().status());
        assertEquals(0, workers.findById("w-1").orElseThrow().runningJobs());

        assertEquals(JobReportResult.ALREADY_TERMINAL,
                jobs.report(job.id(), "w-1", JobOutcome.completed(null, null, null)));
    }

    @Test
    @DisplayName("Releasing a worker's jobs counts a retry against each")
    void releaseJobsForWorker() {
        registerWorker("w-1", 2);
        Job assigned = saveJob("RUN-A");
        Job running = saveJob("RUN-B");
        jobs.claim(assigned.id(), "w-1");
        jobs.claim(running.id(), "w-1");
        jobs.start(running.id(), "w-1");

        assertEquals(2, jobs.releaseJobsForWorker("w-1", "gone"));

        for (String id : List.of(assigned.id(), running.id())) {
            Job job = jobs.findById(id).orElseThrow();
            assertEquals(JobStatus.PENDING, job.status());
            assertEquals(1, job.retries());
            assertNull(job.workerId());
        }
        assertEquals(0, jobs.releaseJobsForWorker("w-1", "gone"));
    }

    @Test
    @DisplayName("Retention deletes only old terminal jobs")
    void deleteTerminalBefore() {
        registerWorker("w-1", 1);
        Job done = saveJob("RUN-DONE");
        Job pending = saveJob("RUN-PENDING");
        jobs.claim(done.id(), "w-1");
        jobs.start(done.id(), "w-1");
        jobs.report(done.id(), "w-1", JobOutcome.completed("{}", null, null));

        assertEquals(0, jobs.deleteTerminalBefore(Instant.now().minusSeconds(3600)));
        assertEquals(1, jobs.deleteTerminalBefore(Instant.now().plusSeconds(60)));

        assertTrue(jobs.findById(done.id()).isEmpty());
        assertTrue(jobs.findResult(done.id()).isEmpty());
        assertTrue(jobs.findById(pending.id()).isPresent());
    }

    @Test
    @DisplayName("Status counts")
    void countByStatus() {
        registerWorker("w-1", 1);
        Job a = saveJob("RUN-A");
        saveJob("RUN-B");
        jobs.claim(a.id(), "w-1");

        assertEquals(1, jobs.countByStatus(JobStatus.PENDING));
        assertEquals(1, jobs.countByStatus(JobStatus.ASSIGNED));
        assertEquals(1, jobs.countForWorker("w-1", JobStatus.ASSIGNED));
        assertEquals(0, jobs.countByStatus(JobStatus.RUNNING));
    }
}
