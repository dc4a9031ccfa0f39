package testrelay.coordinator.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.ActivityEvent;
import testrelay.coordinator.model.ExecutionSource;
import testrelay.coordinator.model.ExecutionStatus;
import testrelay.coordinator.model.Firing;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.SuiteMember;
import testrelay.coordinator.model.TestDefinition;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerExecution;
import testrelay.coordinator.repository.DispatchStore;
import testrelay.coordinator.repository.TestCatalog;
import testrelay.coordinator.repository.TriggerExecutionRepository;
import testrelay.coordinator.repository.TriggerRepository;
import testrelay.coordinator.schedule.RecurrenceCalculator;
import testrelay.coordinator.service.SettingsService;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns due triggers into queued jobs.
 *
 * A pass runs under the {@value #LOCK_NAME} lock so overlapping ticks and
 * other coordinator instances skip instead of double-firing. Each trigger
 * is handled on its own: a failure marks that execution FAILED and the
 * pass moves on.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String LOCK_NAME = "run_due_scheduled_triggers";

    static final String TEST_NOT_FOUND = "Target test not found";
    static final String EMPTY_SUITE = "Suite has no member tests";
    static final String ALREADY_FIRED = "Trigger already fired";

    private final TriggerRepository triggers;
    private final TriggerExecutionRepository executions;
    private final TestCatalog catalog;
    private final DispatchStore store;
    private final SettingsService settings;
    private final DispatchLock lock;
    private final Clock clock;
    private final int maxRetries;

    public Dispatcher(TriggerRepository triggers,
            TriggerExecutionRepository executions,
            TestCatalog catalog,
            DispatchStore store,
            SettingsService settings,
            DispatchLock lock,
            Clock clock,
            int maxRetries) {
        this.triggers = triggers;
        this.executions = executions;
        this.catalog = catalog;
        this.store = store;
        this.settings = settings;
        this.lock = lock;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    /**
     * Run one dispatch pass over every due scheduled trigger.
     */
    public DispatchSummary tick() {
        if (!settings.dispatchEnabled()) {
            log.debug("Scheduled dispatch disabled by setting {}", SettingsService.DISPATCH_ENABLED);
            return DispatchSummary.disabled();
        }

        Optional<DispatchLock.Handle> acquired = lock.tryAcquire(LOCK_NAME);
        if (acquired.isEmpty()) {
            log.debug("Dispatch pass already running elsewhere, skipping");
            return DispatchSummary.notAcquired();
        }

        try (DispatchLock.Handle ignored = acquired.get()) {
            Instant now = clock.instant();
            List<Trigger> due = triggers.findDue(now);

            int jobsCreated = 0;
            int failures = 0;

            for (Trigger trigger : due) {
                FireResult result = fireSafely(trigger, ExecutionSource.SCHEDULE, now);
                jobsCreated += result.jobsCreated();
                if (result.failed()) {
                    failures++;
                }
            }

            if (!due.isEmpty()) {
                log.info("Dispatch pass: {} triggers, {} jobs created, {} failures",
                        due.size(), jobsCreated, failures);
            }
            return new DispatchSummary(true, true, due.size(), jobsCreated, failures);
        }
    }

    /**
     * Fire one trigger outside the schedule. The trigger's next fire time is
     * left alone.
     *
     * @param triggerId trigger to fire
     * @param source    MANUAL or EXTERNAL_EVENT
     * @return the finalized execution
     */
    public TriggerExecution fire(String triggerId, ExecutionSource source) {
        if (source == ExecutionSource.SCHEDULE) {
            throw new IllegalArgumentException("Scheduled firing only happens through the dispatch pass");
        }

        Trigger trigger = triggers.findById(triggerId)
                .orElseThrow(() -> new IllegalArgumentException("Trigger not found: " + triggerId));

        if (source == ExecutionSource.EXTERNAL_EVENT && !trigger.active()) {
            throw new IllegalArgumentException("Trigger is inactive: " + triggerId);
        }

        FireResult result = fireSafely(trigger, source, clock.instant());
        return executions.findById(result.executionId())
                .orElseThrow(() -> new IllegalStateException("Execution vanished: " + result.executionId()));
    }

    private FireResult fireSafely(Trigger trigger, ExecutionSource source, Instant now) {
        String executionId = UUID.randomUUID().toString();
        try {
            executions.create(TriggerExecution.builder()
                    .id(executionId)
                    .triggerId(trigger.id())
                    .projectId(trigger.projectId())
                    .triggeredAt(now)
                    .source(source)
                    .status(ExecutionStatus.PENDING)
                    .build());

            Firing firing = buildFiring(trigger, executionId, source, now);

            if (!store.recordFiring(firing)) {
                executions.markFailed(executionId, ALREADY_FIRED);
                log.info("Trigger {} was already fired for {}", trigger.id(), trigger.nextFireAt());
                return new FireResult(executionId, 0, true);
            }

            if (firing.failed()) {
                log.warn("Trigger {} ({}) failed: {}", trigger.id(), trigger.name(), firing.errorMessage());
            } else {
                log.info("Trigger {} ({}) fired: {} jobs queued, next at {}",
                        trigger.id(), trigger.name(), firing.jobs().size(), firing.nextFireAt());
            }
            return new FireResult(executionId, firing.jobs().size(), firing.failed());
        } catch (Exception e) {
            log.error("Failed to fire trigger {}", trigger.id(), e);
            try {
                executions.markFailed(executionId, e.getMessage() != null ? e.getMessage() : e.toString());
            } catch (Exception markError) {
                log.warn("Could not mark execution {} failed: {}", executionId, markError.getMessage());
            }
            return new FireResult(executionId, 0, true);
        }
    }

    private Firing buildFiring(Trigger trigger, String executionId, ExecutionSource source, Instant now) {
        List<Job> jobs = new ArrayList<>();
        String error = null;
        String runToken = source.runPrefix() + "-" + randomHex();

        switch (trigger.targetType()) {
            case SINGLE_TEST -> {
                Optional<TestDefinition> test = catalog.findTest(trigger.targetId());
                if (test.isPresent()) {
                    jobs.add(newJob(trigger, executionId, test.get(), runToken, now));
                } else {
                    error = TEST_NOT_FOUND;
                }
            }
            case SUITE -> {
                List<SuiteMember> members = catalog.findSuiteMembers(trigger.targetId());
                if (members.isEmpty()) {
                    error = EMPTY_SUITE;
                }
                for (SuiteMember member : members) {
                    String runId = runToken + "-" + String.format(Locale.ROOT, "%03d", member.executionOrder());
                    jobs.add(newJob(trigger, executionId, member.test(), runId, now));
                }
            }
        }

        // Scheduled firings advance the schedule even when resolution failed
        Instant nextFireAt = source == ExecutionSource.SCHEDULE
                ? RecurrenceCalculator.nextFire(trigger.scheduleRule(), now)
                : null;

        return new Firing(trigger, executionId, jobs, error, now, nextFireAt,
                activityEvent(trigger, source, jobs.size(), error));
    }

    private Job newJob(Trigger trigger, String executionId, TestDefinition test, String runId, Instant now) {
        return Job.builder()
                .id(UUID.randomUUID().toString())
                .projectId(trigger.projectId())
                .testId(test.id())
                .runId(runId)
                .jobType(test.jobType())
                .payload(test.payload())
                .targetWorkerId(trigger.assignedWorkerId())
                .status(JobStatus.PENDING)
                .priority(trigger.priority())
                .maxRetries(maxRetries)
                .triggerExecutionId(executionId)
                .createdAt(now)
                .build();
    }

    private ActivityEvent activityEvent(Trigger trigger, ExecutionSource source, int jobsCreated, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("trigger_id", trigger.id());
        details.put("trigger_name", trigger.name());
        details.put("schedule_type", trigger.scheduleRule().type().name().toLowerCase(Locale.ROOT));
        details.put("target_type", trigger.targetType().name().toLowerCase(Locale.ROOT));
        details.put("target_id", trigger.targetId());
        details.put("jobs_created", jobsCreated);
        if (source != ExecutionSource.SCHEDULE) {
            details.put("source", source.name().toLowerCase(Locale.ROOT));
        }
        if (error != null) {
            details.put("error", error);
        }

        String eventType = source == ExecutionSource.SCHEDULE
                ? ActivityEvent.SCHEDULED_TRIGGER_EXECUTED
                : ActivityEvent.TRIGGER_FIRED;

        try {
            return ActivityEvent.of(trigger.projectId(), eventType, trigger.id(), MAPPER.writeValueAsString(details));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize activity details for trigger: " + trigger.id(), e);
        }
    }

    static String randomHex() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT);
    }

    private record FireResult(String executionId, int jobsCreated, boolean failed) {
    }
}
