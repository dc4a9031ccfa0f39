package testrelay.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerExecution;
import testrelay.coordinator.repository.TriggerExecutionRepository;
import testrelay.coordinator.repository.TriggerRepository;
import testrelay.coordinator.schedule.RecurrenceCalculator;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for trigger CRUD.
 * Every write recomputes {@code nextFireAt} from the rule so the stored
 * value never goes stale.
 */
public class TriggerService {

    private static final Logger log = LoggerFactory.getLogger(TriggerService.class);

    private final TriggerRepository triggerRepository;
    private final TriggerExecutionRepository executionRepository;
    private final Clock clock;

    public TriggerService(TriggerRepository triggerRepository, TriggerExecutionRepository executionRepository,
            Clock clock) {
        this.triggerRepository = triggerRepository;
        this.executionRepository = executionRepository;
        this.clock = clock;
    }

    /**
     * Create a trigger.
     */
    public Trigger create(Trigger trigger) {
        validate(trigger);

        Instant now = clock.instant();
        Trigger toSave = trigger.toBuilder()
                .nextFireAt(computeNextFire(trigger, now))
                .createdAt(now)
                .updatedAt(now)
                .build();

        triggerRepository.save(toSave);
        log.info("Created trigger {} ({}) next fire at {}", toSave.id(), toSave.name(), toSave.nextFireAt());
        return toSave;
    }

    /**
     * Replace a trigger's definition.
     *
     * @return the stored trigger, or empty if it does not exist
     */
    public Optional<Trigger> update(Trigger trigger) {
        validate(trigger);

        Optional<Trigger> existing = triggerRepository.findById(trigger.id());
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Trigger toSave = trigger.toBuilder()
                .nextFireAt(computeNextFire(trigger, now))
                .lastFiredAt(existing.get().lastFiredAt())
                .createdAt(existing.get().createdAt())
                .updatedAt(now)
                .build();

        if (!triggerRepository.update(toSave)) {
            return Optional.empty();
        }
        log.info("Updated trigger {} next fire at {}", toSave.id(), toSave.nextFireAt());
        return Optional.of(toSave);
    }

    public Optional<Trigger> findById(String triggerId) {
        return triggerRepository.findById(triggerId);
    }

    public List<Trigger> findByProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        return triggerRepository.findByProject(projectId);
    }

    public boolean delete(String triggerId) {
        boolean deleted = triggerRepository.delete(triggerId);
        if (deleted) {
            log.info("Deleted trigger {}", triggerId);
        }
        return deleted;
    }

    public List<TriggerExecution> executions(String triggerId, int limit) {
        return executionRepository.findByTrigger(triggerId, Math.max(1, Math.min(limit, 500)));
    }

    /**
     * Next fire instant for a trigger as it would be stored now; null when
     * the dispatcher should never pick it up.
     */
    Instant computeNextFire(Trigger trigger, Instant now) {
        return trigger.isRecurring() ? RecurrenceCalculator.nextFire(trigger.scheduleRule(), now) : null;
    }

    private static void validate(Trigger trigger) {
        if (trigger.projectId() == null || trigger.projectId().isBlank()) {
            throw new IllegalArgumentException("projectId is required");
        }
        if (trigger.targetId() == null || trigger.targetId().isBlank()) {
            throw new IllegalArgumentException("targetId is required");
        }
    }
}
