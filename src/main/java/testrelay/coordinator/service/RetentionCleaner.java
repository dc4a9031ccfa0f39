package testrelay.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.repository.ActivityLogRepository;
import testrelay.coordinator.repository.JobRepository;
import testrelay.coordinator.repository.TriggerExecutionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes execution history older than the configured retention window:
 * terminal jobs with their results, finalized trigger executions and
 * activity log rows.
 */
public class RetentionCleaner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionCleaner.class);

    private final JobRepository jobRepository;
    private final TriggerExecutionRepository executionRepository;
    private final ActivityLogRepository activityLogRepository;
    private final SettingsService settings;
    private final Clock clock;

    public RetentionCleaner(JobRepository jobRepository,
            TriggerExecutionRepository executionRepository,
            ActivityLogRepository activityLogRepository,
            SettingsService settings,
            Clock clock) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.activityLogRepository = activityLogRepository;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void run() {
        cleanup();
    }

    /**
     * @return total rows deleted
     */
    public int cleanup() {
        int days = settings.retentionDays();
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));

        int jobs = jobRepository.deleteTerminalBefore(cutoff);
        int executions = executionRepository.deleteFinalizedBefore(cutoff);
        int events = activityLogRepository.deleteBefore(cutoff);

        int total = jobs + executions + events;
        if (total > 0) {
            log.info("Retention ({} days): deleted {} jobs, {} executions, {} activity events",
                    days, jobs, executions, events);
        } else {
            log.debug("Retention ({} days): nothing to delete", days);
        }
        return total;
    }
}
