package testrelay.coordinator.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
import testrelay.coordinator.model.ScheduleRule;
import testrelay.coordinator.model.TargetType;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TriggerServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-03T10:00:00Z");

    private Dependencies deps;
    private TriggerService service;

    @BeforeEach
    void setUp() {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-triggers-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config, Clock.fixed(NOW, ZoneOffset.UTC));
        service = deps.triggerService();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private Trigger.Builder trigger(String id) {
        return Trigger.builder()
                .id(id)
                .projectId("proj-1")
                .name("Trigger " + id)
                .targetType(TargetType.SINGLE_TEST)
                .targetId("t-1")
                .scheduleRule(ScheduleRule.daily(LocalTime.of(9, 0), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Create computes the first fire time")
    void createComputesNextFire() {
        Trigger created = service.create(trigger("tr-1").build());

        assertEquals(Instant.parse("2024-06-04T09:00:00Z"), created.nextFireAt());
        assertEquals(NOW, created.createdAt());

        Trigger stored = service.findById("tr-1").orElseThrow();
        assertEquals(created.nextFireAt(), stored.nextFireAt());
        assertEquals(ScheduleRule.daily(LocalTime.of(9, 0), ZoneOffset.UTC), stored.scheduleRule());
    }

    @Test
    @DisplayName("Event-driven and inactive triggers get no fire time")
    void nonRecurringHasNoNextFire() {
        assertNull(service.create(trigger("tr-ev").triggerType(TriggerType.EXTERNAL_EVENT).build()).nextFireAt());
        assertNull(service.create(trigger("tr-off").active(false).build()).nextFireAt());
    }

    @Test
    @DisplayName("Update recomputes the fire time and keeps history fields")
    void updateRecomputes() {
        service.create(trigger("tr-1").build());

        Trigger updated = service.update(trigger("tr-1")
                .scheduleRule(ScheduleRule.hourly(15, ZoneOffset.UTC))
                .priority(3)
                .build()).orElseThrow();

        assertEquals(Instant.parse("2024-06-03T10:15:00Z"), updated.nextFireAt());
        assertEquals(NOW, updated.createdAt());
        assertEquals(3, service.findById("tr-1").orElseThrow().priority());

        Trigger paused = service.update(trigger("tr-1").active(false).build()).orElseThrow();
        assertNull(paused.nextFireAt());
    }

    @Test
    @DisplayName("Update of an unknown trigger is empty")
    void updateMissing() {
        assertTrue(service.update(trigger("nope").build()).isEmpty());
    }

    @Test
    @DisplayName("List by project and delete")
    void listAndDelete() {
        service.create(trigger("tr-1").build());
        service.create(trigger("tr-2").build());
        service.create(trigger("tr-3").projectId("proj-2").build());

        assertEquals(2, service.findByProject("proj-1").size());
        assertTrue(service.delete("tr-1"));
        assertFalse(service.delete("tr-1"));
        assertEquals(1, service.findByProject("proj-1").size());
        assertThrows(IllegalArgumentException.class, () -> service.findByProject(" "));
    }

    @Test
    @DisplayName("Blank project or target is rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> service.create(trigger("tr-x").projectId("").build()));
        assertThrows(IllegalArgumentException.class, () -> service.create(trigger("tr-y").targetId(" ").build()));
    }
}
