package testrelay.coordinator.schedule;

import testrelay.coordinator.model.ScheduleRule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Computes the next fire instant of a schedule rule.
 * <p>
 * Candidates are built in the rule's local time and converted back to an
 * instant. A candidate equal to the reference counts as already passed, so
 * the result is always strictly after the reference.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {
    }

    /**
     * Next fire instant strictly after {@code reference}.
     *
     * @param rule      schedule rule (defaults already applied)
     * @param reference the instant to compute from, usually "now"
     * @return next fire instant
     */
    public static Instant nextFire(ScheduleRule rule, Instant reference) {
        ZoneId zone = rule.timezone();
        LocalDateTime localNow = LocalDateTime.ofInstant(reference, zone);
        LocalTime time = rule.timeOfDay();

        LocalDateTime candidate;
        switch (rule.type()) {
            case HOURLY -> {
                // Only the minute matters for hourly rules
                candidate = localNow.truncatedTo(ChronoUnit.HOURS).withMinute(time.getMinute());
                if (!candidate.isAfter(localNow)) {
                    candidate = candidate.plusHours(1);
                }
            }
            case WEEKLY -> {
                int currentDow = localNow.getDayOfWeek().getValue() % 7; // 0 = Sunday
                int daysUntil = (rule.dayOfWeek() - currentDow + 7) % 7;
                candidate = localNow.toLocalDate().plusDays(daysUntil).atTime(time);
                if (daysUntil == 0 && !candidate.isAfter(localNow)) {
                    candidate = candidate.plusDays(7);
                }
            }
            default -> {
                candidate = localNow.toLocalDate().atTime(time);
                if (!candidate.isAfter(localNow)) {
                    candidate = candidate.plusDays(1);
                }
            }
        }

        Instant next = toInstant(candidate, zone);

        // A DST overlap can map a later local time to an earlier instant
        while (!next.isAfter(reference)) {
            candidate = advance(rule, candidate);
            next = toInstant(candidate, zone);
        }
        return next;
    }

    private static LocalDateTime advance(ScheduleRule rule, LocalDateTime candidate) {
        return switch (rule.type()) {
            case HOURLY -> candidate.plusHours(1);
            case WEEKLY -> candidate.plusWeeks(1);
            default -> candidate.plusDays(1);
        };
    }

    private static Instant toInstant(LocalDateTime local, ZoneId zone) {
        return ZonedDateTime.ofLocal(local, zone, null).toInstant();
    }
}
