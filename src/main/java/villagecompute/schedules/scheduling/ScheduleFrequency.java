package villagecompute.schedules.scheduling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recurrence shapes supported by scheduled jobs.
 *
 * <p>
 * Each frequency reads a different subset of the recurrence fields on {@link RecurrenceDefinition}:
 * <ul>
 * <li>{@link #ONCE} - {@code startDate}</li>
 * <li>{@link #DAILY} - {@code hour}, {@code minute}</li>
 * <li>{@link #WEEKLY} - {@code dayOfWeek}, {@code hour}, {@code minute}</li>
 * <li>{@link #MONTHLY} - {@code dayOfMonth} (clamped to 1-28), {@code hour}, {@code minute}</li>
 * <li>{@link #CUSTOM} - {@code cronExpression} (5-field UNIX cron)</li>
 * </ul>
 *
 * @see NextRunCalculator
 */
public enum ScheduleFrequency {

    ONCE("once"),

    DAILY("daily"),

    WEEKLY("weekly"),

    MONTHLY("monthly"),

    CUSTOM("custom");

    private final String value;

    ScheduleFrequency(String value) {
        this.value = value;
    }

    /**
     * Returns the lower-case wire value (e.g. {@code "weekly"}).
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a wire value case-insensitively.
     *
     * @param value
     *            frequency name such as {@code "daily"}
     * @return matching frequency, or {@code null} when the value is blank or unrecognized
     */
    @JsonCreator
    public static ScheduleFrequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ScheduleFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        return null;
    }
}
