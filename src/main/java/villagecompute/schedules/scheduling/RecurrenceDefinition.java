package villagecompute.schedules.scheduling;

import villagecompute.schedules.data.models.ScheduledJob;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * The recurrence fields of a schedule, detached from persistence so {@link NextRunCalculator} stays a pure function.
 *
 * @param frequency
 *            recurrence shape
 * @param hour
 *            hour of day (0-23), {@code null} means 0
 * @param minute
 *            minute of hour (0-59), {@code null} means 0
 * @param dayOfWeek
 *            weekday for {@link ScheduleFrequency#WEEKLY}, {@code null} means the reference instant's weekday
 * @param dayOfMonth
 *            day for {@link ScheduleFrequency#MONTHLY}, clamped to 1-28 by the calculator
 * @param cronExpression
 *            5-field UNIX cron for {@link ScheduleFrequency#CUSTOM}
 * @param timezone
 *            zone the wall-clock fields are interpreted in
 * @param startDate
 *            no occurrence is computed before this instant
 * @param endDate
 *            no occurrence is computed at or after this instant
 */
public record RecurrenceDefinition(ScheduleFrequency frequency, Integer hour, Integer minute, DayOfWeek dayOfWeek,
        Integer dayOfMonth, String cronExpression, ZoneId timezone, Instant startDate, Instant endDate) {

    public RecurrenceDefinition {
        if (timezone == null) {
            timezone = ZoneOffset.UTC;
        }
    }

    /**
     * Builds a definition from a stored schedule. An unknown zone id falls back to UTC.
     *
     * @param schedule
     *            persisted schedule
     * @return recurrence definition
     */
    public static RecurrenceDefinition of(ScheduledJob schedule) {
        return new RecurrenceDefinition(schedule.frequency, schedule.hour, schedule.minute, schedule.dayOfWeek,
                schedule.dayOfMonth, schedule.cronExpression, parseZone(schedule.timezone), schedule.startDate,
                schedule.endDate);
    }

    /**
     * Parses a zone id, returning UTC for blank or invalid values.
     */
    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }
}
