package testrelay.coordinator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobClaimResult;
import testrelay.coordinator.model.JobOutcome;
import testrelay.coordinator.model.JobReportResult;
import testrelay.coordinator.model.JobStartResult;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.Worker;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobServiceTest {

    private Dependencies deps;
    private JobService service;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobsvc-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config);
        service = deps.jobService();

        deps.workerService().register(Worker.builder()
                .id("w-1")
                .projectId("proj-1")
                .capacity(1)
                .capabilities(Set.of("performance"))
                .build());
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private Job submit(String id) {
        return service.submit(Job.builder().id(id).projectId("proj-1").runId("RUN-" + id).build());
    }

    @Test
    @DisplayName("Submit validates the new job")
    void submitValidation() {
        assertThrows(IllegalArgumentException.class, () -> service.submit(Job.builder()
                .id("j-x").projectId(" ").runId("RUN-X").build()));
        assertThrows(IllegalArgumentException.class, () -> service.submit(Job.builder()
                .id("j-y").projectId("proj-1").runId("RUN-Y").status(JobStatus.RUNNING).build()));
    }

    @Test
    @DisplayName("Poll requires a registered worker")
    void pollUnknownWorker() {
        assertThrows(IllegalArgumentException.class, () -> service.poll("ghost"));
        assertThrows(IllegalArgumentException.class, () -> service.poll(null));
    }

    @Test
    @DisplayName("Poll offers nothing once claimed jobs fill the worker's capacity")
    void pollRespectsCapacity() {
        submit("j-1");
        submit("j-2");

        Job offered = service.poll("w-1").orElseThrow();
        assertEquals(JobClaimResult.CLAIMED, service.claim(offered.id(), "w-1"));

        assertTrue(service.poll("w-1").isEmpty());
        assertTrue(service.claimNext("w-1").isEmpty());
    }

    @Test
    @DisplayName("A full worker gets nothing until its running job reports")
    void busyWorkerWaitsForReport() {
        Job first = submit("j-1");
        submit("j-2");

        assertEquals(JobClaimResult.CLAIMED, service.claim(first.id(), "w-1"));
        assertEquals(JobStartResult.STARTED, service.start(first.id(), "w-1"));
        assertEquals(1, deps.workerRepository().findById("w-1").orElseThrow().runningJobs());
        assertTrue(service.poll("w-1").isEmpty());

        service.report(first.id(), "w-1", JobOutcome.completed("{}", null, null));

        assertEquals(0, deps.workerRepository().findById("w-1").orElseThrow().runningJobs());
        assertEquals("j-2", service.poll("w-1").orElseThrow().id());
    }

    @Test
    @DisplayName("claimNext peeks and claims in one step")
    void claimNext() {
        submit("j-1");

        Optional<Job> claimed = service.claimNext("w-1");

        assertTrue(claimed.isPresent());
        assertEquals(JobStatus.ASSIGNED, claimed.get().status());
        assertEquals("w-1", claimed.get().workerId());
    }

    @Test
    @DisplayName("Full protocol records start and finish in the activity log")
    void fullProtocol() {
        Job job = submit("j-1");

        assertEquals(JobClaimResult.CLAIMED, service.claim(job.id(), "w-1"));
        assertEquals(JobStartResult.STARTED, service.start(job.id(), "w-1"));
        assertEquals(JobReportResult.COMPLETED,
                service.report(job.id(), "w-1", JobOutcome.completed("{\"totalRequests\":3}", null, null)));

        assertEquals(JobStatus.COMPLETED, service.findById(job.id()).orElseThrow().status());
        assertEquals("{\"totalRequests\":3}", service.findResult(job.id()).orElseThrow().summaryJson());

        List<ActivityEvent> started = deps.activityService().recent(ActivityEvent.JOB_STARTED, 10);
        List<ActivityEvent> finished = deps.activityService().recent(ActivityEvent.JOB_FINISHED, 10);
        assertEquals(1, started.size());
        assertEquals(1, finished.size());
        assertTrue(finished.get(0).details().contains("\"outcome\":\"completed\""), finished.get(0).details());
    }

    @Test
    @DisplayName("Cancel is recorded once")
    void cancel() {
        Job job = submit("j-1");

        assertTrue(service.cancel(job.id()));
        assertFalse(service.cancel(job.id()));
        assertFalse(service.cancel("missing"));
        assertEquals(1, deps.activityService().recent(ActivityEvent.JOB_CANCELLED, 10).size());
        assertThrows(IllegalArgumentException.class, () -> service.cancel(""));
    }

    @Test
    @DisplayName("Report requires identifiers and an outcome")
    void reportValidation() {
        assertThrows(IllegalArgumentException.class, () -> service.report("j-1", "w-1", null));
        assertThrows(IllegalArgumentException.class, () -> service.report("", "w-1", JobOutcome.failed("x")));
        assertThrows(IllegalArgumentException.class, () -> service.start("j-1", " "));
    }
}
