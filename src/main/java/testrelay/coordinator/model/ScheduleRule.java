package testrelay.coordinator.model;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Recurrence rule attached to a schedule trigger.
 * <p>
 * Day of week uses 0 = Sunday .. 6 = Saturday and is only read for
 * {@link ScheduleType#WEEKLY}. Invalid or missing parts fall back to
 * daily / 09:00 / Monday / UTC.
 */
public final class ScheduleRule {

    public static final ScheduleType DEFAULT_TYPE = ScheduleType.DAILY;
    public static final LocalTime DEFAULT_TIME = LocalTime.of(9, 0);
    public static final int DEFAULT_DAY_OF_WEEK = 1;
    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private final ScheduleType type;
    private final LocalTime timeOfDay;
    private final int dayOfWeek;
    private final ZoneId timezone;

    private ScheduleRule(ScheduleType type, LocalTime timeOfDay, int dayOfWeek, ZoneId timezone) {
        this.type = type;
        this.timeOfDay = timeOfDay;
        this.dayOfWeek = dayOfWeek;
        this.timezone = timezone;
    }

    public static ScheduleRule of(ScheduleType type, LocalTime timeOfDay, int dayOfWeek, ZoneId timezone) {
        return new ScheduleRule(
                type != null ? type : DEFAULT_TYPE,
                timeOfDay != null ? timeOfDay : DEFAULT_TIME,
                dayOfWeek >= 0 && dayOfWeek <= 6 ? dayOfWeek : DEFAULT_DAY_OF_WEEK,
                timezone != null ? timezone : DEFAULT_ZONE);
    }

    /**
     * Build a rule from raw stored values, applying defaults to anything
     * that does not parse.
     */
    public static ScheduleRule parse(String type, String timeOfDay, Integer dayOfWeek, String timezone) {
        return of(ScheduleType.parse(type),
                parseTime(timeOfDay),
                dayOfWeek != null ? dayOfWeek : DEFAULT_DAY_OF_WEEK,
                parseZone(timezone));
    }

    public static ScheduleRule defaults() {
        return of(DEFAULT_TYPE, DEFAULT_TIME, DEFAULT_DAY_OF_WEEK, DEFAULT_ZONE);
    }

    public static ScheduleRule daily(LocalTime time, ZoneId zone) {
        return of(ScheduleType.DAILY, time, DEFAULT_DAY_OF_WEEK, zone);
    }

    public static ScheduleRule hourly(int minute, ZoneId zone) {
        return of(ScheduleType.HOURLY, LocalTime.of(0, minute), DEFAULT_DAY_OF_WEEK, zone);
    }

    public static ScheduleRule weekly(int dayOfWeek, LocalTime time, ZoneId zone) {
        return of(ScheduleType.WEEKLY, time, dayOfWeek, zone);
    }

    private static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIME;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            return DEFAULT_TIME;
        }
    }

    private static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            return DEFAULT_ZONE;
        }
    }

    public ScheduleType type() {
        return type;
    }

    public LocalTime timeOfDay() {
        return timeOfDay;
    }

    public int dayOfWeek() {
        return dayOfWeek;
    }

    public ZoneId timezone() {
        return timezone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduleRule rule))
            return false;
        return dayOfWeek == rule.dayOfWeek
                && type == rule.type
                && timeOfDay.equals(rule.timeOfDay)
                && timezone.equals(rule.timezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, timeOfDay, dayOfWeek, timezone);
    }

    @Override
    public String toString() {
        return "ScheduleRule{" + type + " " + timeOfDay + ", dow=" + dayOfWeek + ", tz=" + timezone + "}";
    }
}
