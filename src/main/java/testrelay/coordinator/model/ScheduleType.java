package testrelay.coordinator.model;

import java.util.Locale;

/**
 * Recurrence kind of a scheduled trigger.
 */
public enum ScheduleType {
    /** Fires once per hour at the configured minute */
    HOURLY,
    /** Fires once per day at the configured time */
    DAILY,
    /** Fires once per week on the configured day and time */
    WEEKLY;

    /**
     * Parse a stored or user-supplied value. Unknown or empty values map to
     * {@link #DAILY}.
     */
    public static ScheduleType parse(String value) {
        if (value == null || value.isBlank()) {
            return DAILY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DAILY;
        }
    }
}
