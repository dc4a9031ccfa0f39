package testrelay.coordinator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobOutcome;
import testrelay.coordinator.model.Worker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetentionCleanerTest {

    private Dependencies deps;

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private void start(Instant now) {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-retention-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config, Clock.fixed(now, ZoneOffset.UTC));
    }

    private void seedFinishedAndPendingJobs() {
        deps.workerRepository().register(Worker.builder().id("w-1").capacity(1).build());
        deps.jobRepository().save(Job.builder().id("j-done").projectId("proj-1").runId("RUN-1").build());
        deps.jobRepository().save(Job.builder().id("j-open").projectId("proj-1").runId("RUN-2").build());
        deps.jobRepository().claim("j-done", "w-1");
        deps.jobRepository().start("j-done", "w-1");
        deps.jobRepository().report("j-done", "w-1", JobOutcome.completed("{}", null, null));
        deps.activityService().record("proj-1", ActivityEvent.JOB_FINISHED, "j-done", Map.of("outcome", "completed"));
    }

    @Test
    @DisplayName("History older than the retention window is deleted")
    void deletesOldHistory() {
        start(Instant.now().plus(Duration.ofDays(40)));
        seedFinishedAndPendingJobs();

        int deleted = deps.retentionCleaner().cleanup();

        assertTrue(deleted >= 2, "deleted " + deleted);
        assertTrue(deps.jobRepository().findById("j-done").isEmpty());
        assertTrue(deps.jobRepository().findById("j-open").isPresent());
        assertTrue(deps.activityService().recent(ActivityEvent.JOB_FINISHED, 10).isEmpty());
    }

    @Test
    @DisplayName("Retention window comes from settings")
    void windowFromSettings() {
        start(Instant.now().plus(Duration.ofDays(40)));
        seedFinishedAndPendingJobs();
        deps.settingsService().put(SettingsService.RETENTION_DAYS, "60");

        assertEquals(0, deps.retentionCleaner().cleanup());
        assertTrue(deps.jobRepository().findById("j-done").isPresent());
    }
}
