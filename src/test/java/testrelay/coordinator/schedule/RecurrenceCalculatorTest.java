package testrelay.coordinator.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import testrelay.coordinator.model.ScheduleRule;
import testrelay.coordinator.model.ScheduleType;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Nested
    @DisplayName("Daily")
    class Daily {

        private final ScheduleRule rule = ScheduleRule.daily(LocalTime.of(9, 0), UTC);

        @Test
        @DisplayName("Later the same day when the time is still ahead")
        void sameDay() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T08:00:00Z"));
            assertEquals(Instant.parse("2024-01-10T09:00:00Z"), next);
        }

        @Test
        @DisplayName("Exactly at the fire time rolls to the next day")
        void exactlyAtFireTime() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T09:00:00Z"));
            assertEquals(Instant.parse("2024-01-11T09:00:00Z"), next);
        }

        @Test
        @DisplayName("Past the time rolls to the next day")
        void pastTime() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T17:45:12Z"));
            assertEquals(Instant.parse("2024-01-11T09:00:00Z"), next);
        }

        @Test
        @DisplayName("Time of day is read in the rule's zone")
        void honoursZone() {
            ScheduleRule ny = ScheduleRule.daily(LocalTime.of(9, 0), ZoneId.of("America/New_York"));
            // 07:00 in New York (UTC-5 in January)
            Instant next = RecurrenceCalculator.nextFire(ny, Instant.parse("2024-01-10T12:00:00Z"));
            assertEquals(Instant.parse("2024-01-10T14:00:00Z"), next);
        }

        @Test
        @DisplayName("Non-existent local time shifts forward by the gap")
        void springForwardGap() {
            ScheduleRule rule = ScheduleRule.daily(LocalTime.of(2, 30), BERLIN);
            // 01:00 local on the night clocks jump from 02:00 to 03:00
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-03-31T00:00:00Z"));
            assertEquals(Instant.parse("2024-03-31T01:30:00Z"), next);
        }
    }

    @Nested
    @DisplayName("Hourly")
    class Hourly {

        private final ScheduleRule rule = ScheduleRule.hourly(30, UTC);

        @Test
        @DisplayName("Minute still ahead in the current hour")
        void currentHour() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T10:15:00Z"));
            assertEquals(Instant.parse("2024-01-10T10:30:00Z"), next);
        }

        @Test
        @DisplayName("Exactly at the minute rolls to the next hour")
        void exactlyAtMinute() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T10:30:00Z"));
            assertEquals(Instant.parse("2024-01-10T11:30:00Z"), next);
        }

        @Test
        @DisplayName("Seconds of the time of day are ignored")
        void ignoresSeconds() {
            ScheduleRule withSeconds = ScheduleRule.of(ScheduleType.HOURLY, LocalTime.of(9, 30, 45), 1, UTC);

            Instant next = RecurrenceCalculator.nextFire(withSeconds, Instant.parse("2024-01-10T10:15:00Z"));
            assertEquals(Instant.parse("2024-01-10T10:30:00Z"), next);

            next = RecurrenceCalculator.nextFire(withSeconds, Instant.parse("2024-01-10T10:30:10Z"));
            assertEquals(Instant.parse("2024-01-10T11:30:00Z"), next);
        }

        @Test
        @DisplayName("Crosses midnight")
        void crossesMidnight() {
            Instant next = RecurrenceCalculator.nextFire(rule, Instant.parse("2024-01-10T23:45:00Z"));
            assertEquals(Instant.parse("2024-01-11T00:30:00Z"), next);
        }

        @Test
        @DisplayName("Always strictly after the reference across a DST fall-back day")
        void strictlyAfterAcrossFallBack() {
            ScheduleRule berlin = ScheduleRule.hourly(30, BERLIN);
            Instant reference = Instant.parse("2024-10-26T20:00:00Z");
            Instant end = Instant.parse("2024-10-27T06:00:00Z");

            while (reference.isBefore(end)) {
                Instant next = RecurrenceCalculator.nextFire(berlin, reference);
                assertTrue(next.isAfter(reference), "next " + next + " not after " + reference);
                assertTrue(Duration.between(reference, next).compareTo(Duration.ofHours(2)) <= 0,
                        "next " + next + " too far from " + reference);
                reference = reference.plus(Duration.ofMinutes(10));
            }
        }
    }

    @Nested
    @DisplayName("Weekly")
    class Weekly {

        // 2024-01-08 is a Monday
        private final ScheduleRule mondayNine = ScheduleRule.weekly(1, LocalTime.of(9, 0), UTC);

        @Test
        @DisplayName("Later in the week")
        void laterInWeek() {
            Instant next = RecurrenceCalculator.nextFire(mondayNine, Instant.parse("2024-01-03T12:00:00Z"));
            assertEquals(Instant.parse("2024-01-08T09:00:00Z"), next);
        }

        @Test
        @DisplayName("Same day before the time fires today")
        void sameDayBefore() {
            Instant next = RecurrenceCalculator.nextFire(mondayNine, Instant.parse("2024-01-08T08:59:59Z"));
            assertEquals(Instant.parse("2024-01-08T09:00:00Z"), next);
        }

        @Test
        @DisplayName("Same day at or after the time waits a full week")
        void sameDayAfter() {
            assertEquals(Instant.parse("2024-01-15T09:00:00Z"),
                    RecurrenceCalculator.nextFire(mondayNine, Instant.parse("2024-01-08T09:00:00Z")));
            assertEquals(Instant.parse("2024-01-15T09:00:00Z"),
                    RecurrenceCalculator.nextFire(mondayNine, Instant.parse("2024-01-08T18:00:00Z")));
        }

        @Test
        @DisplayName("Day 0 is Sunday")
        void sundayIsZero() {
            ScheduleRule sunday = ScheduleRule.weekly(0, LocalTime.of(6, 0), UTC);
            // Saturday
            Instant next = RecurrenceCalculator.nextFire(sunday, Instant.parse("2024-01-06T10:00:00Z"));
            assertEquals(Instant.parse("2024-01-07T06:00:00Z"), next);
        }

        @Test
        @DisplayName("Day of week is evaluated in the rule's zone")
        void dayInZone() {
            ScheduleRule tokyoMonday = ScheduleRule.weekly(1, LocalTime.of(8, 0), ZoneId.of("Asia/Tokyo"));
            // Sunday 20:00 UTC is already Monday 05:00 in Tokyo
            Instant next = RecurrenceCalculator.nextFire(tokyoMonday, Instant.parse("2024-01-07T20:00:00Z"));
            assertEquals(Instant.parse("2024-01-07T23:00:00Z"), next);
        }
    }

    @Test
    @DisplayName("Daily results are strictly later and repeatable for any reference")
    void dailyStrictlyAfterAndPure() {
        ScheduleRule rule = ScheduleRule.daily(LocalTime.of(2, 30), BERLIN);
        Instant reference = Instant.parse("2024-01-01T00:00:00Z");

        for (int i = 0; i < 2000; i++) {
            Instant next = RecurrenceCalculator.nextFire(rule, reference);
            assertTrue(next.isAfter(reference), "not after " + reference);
            assertEquals(next, RecurrenceCalculator.nextFire(rule, reference));
            reference = reference.plus(Duration.ofMinutes(283));
        }
    }

    @Test
    @DisplayName("Default rule fires daily at 09:00 UTC")
    void defaultRule() {
        Instant next = RecurrenceCalculator.nextFire(ScheduleRule.defaults(), Instant.parse("2024-05-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-05-02T09:00:00Z"), next);
    }
}
