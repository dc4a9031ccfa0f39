package testrelay.coordinator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleRuleTest {

    @Test
    @DisplayName("Missing values fall back to daily 09:00 Monday UTC")
    void missingValuesUseDefaults() {
        ScheduleRule rule = ScheduleRule.parse(null, null, null, null);

        assertEquals(ScheduleType.DAILY, rule.type());
        assertEquals(LocalTime.of(9, 0), rule.timeOfDay());
        assertEquals(1, rule.dayOfWeek());
        assertEquals(ZoneOffset.UTC, rule.timezone());
        assertEquals(ScheduleRule.defaults(), rule);
    }

    @Test
    @DisplayName("Unparseable values fall back individually")
    void invalidValuesUseDefaults() {
        ScheduleRule rule = ScheduleRule.parse("fortnightly", "25:99", 9, "Mars/Olympus_Mons");

        assertEquals(ScheduleType.DAILY, rule.type());
        assertEquals(LocalTime.of(9, 0), rule.timeOfDay());
        assertEquals(1, rule.dayOfWeek());
        assertEquals(ZoneOffset.UTC, rule.timezone());
    }

    @Test
    @DisplayName("Valid values are kept")
    void validValues() {
        ScheduleRule rule = ScheduleRule.parse("weekly", "14:30", 0, "Europe/Paris");

        assertEquals(ScheduleType.WEEKLY, rule.type());
        assertEquals(LocalTime.of(14, 30), rule.timeOfDay());
        assertEquals(0, rule.dayOfWeek());
        assertEquals(ZoneId.of("Europe/Paris"), rule.timezone());
    }

    @Test
    @DisplayName("Schedule type parsing ignores case and whitespace")
    void typeParsing() {
        assertEquals(ScheduleType.HOURLY, ScheduleType.parse(" Hourly "));
        assertEquals(ScheduleType.DAILY, ScheduleType.parse(""));
        assertEquals(ScheduleType.DAILY, ScheduleType.parse("monthly"));
    }

    @Test
    @DisplayName("Negative day of week is replaced")
    void negativeDay() {
        assertEquals(1, ScheduleRule.weekly(-1, LocalTime.NOON, ZoneOffset.UTC).dayOfWeek());
    }
}
