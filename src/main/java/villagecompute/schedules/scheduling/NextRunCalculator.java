package villagecompute.schedules.scheduling;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next due instant of a schedule.
 *
 * <p>
 * Pure and deterministic: the reference instant and the zone are both inputs, nothing reads the system clock or the
 * default zone. Every result is either {@code null} or strictly after {@code now}, except
 * {@link ScheduleFrequency#ONCE} which returns its start date verbatim and leaves the due check to the caller.
 *
 * <p>
 * <b>Frequency rules:</b>
 * <ul>
 * <li>ONCE - the start date, {@code null} if absent</li>
 * <li>DAILY - today at {@code hour:minute}, else tomorrow</li>
 * <li>WEEKLY - the next occurrence of the weekday (a same-day delta counts as a full week), plus 7 days if that is
 * still not after now</li>
 * <li>MONTHLY - this month on {@code dayOfMonth} clamped to 1-28, else next month</li>
 * <li>CUSTOM - next match of a 5-field UNIX cron expression in the schedule's zone</li>
 * </ul>
 *
 * <p>
 * A start date in the future moves the reference point up to it, so a recurring schedule never fires before it starts.
 * An end date suppresses any occurrence at or after it.
 */
public final class NextRunCalculator {

    /**
     * Highest day-of-month a monthly schedule may target; every month has it.
     */
    public static final int MAX_DAY_OF_MONTH = 28;

    private static final CronParser CRON_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private NextRunCalculator() {
        // Utility class, no instantiation
    }

    /**
     * Computes the next run for a recurrence definition.
     *
     * @param definition
     *            recurrence fields
     * @param now
     *            reference instant
     * @return next due instant, or {@code null} if the schedule has no further occurrence
     */
    public static Instant computeNextRun(RecurrenceDefinition definition, Instant now) {
        if (definition == null || definition.frequency() == null || now == null) {
            return null;
        }

        Instant next = switch (definition.frequency()) {
            case ONCE -> definition.startDate();
            case DAILY -> nextDaily(definition, reference(definition, now));
            case WEEKLY -> nextWeekly(definition, reference(definition, now));
            case MONTHLY -> nextMonthly(definition, reference(definition, now));
            case CUSTOM -> nextCron(definition, reference(definition, now));
        };

        if (next != null && definition.endDate() != null && !next.isBefore(definition.endDate())) {
            return null;
        }
        return next;
    }

    /**
     * Returns whether the expression is a valid 5-field UNIX cron expression.
     */
    public static boolean isValidCron(String expression) {
        return parseCron(expression).isPresent();
    }

    private static Instant reference(RecurrenceDefinition definition, Instant now) {
        Instant start = definition.startDate();
        if (start != null && start.isAfter(now)) {
            // One millisecond earlier so that an occurrence exactly at the start date still counts
            return start.minusMillis(1);
        }
        return now;
    }

    private static Instant nextDaily(RecurrenceDefinition definition, Instant now) {
        ZoneId zone = definition.timezone();
        LocalDate today = now.atZone(zone).toLocalDate();

        ZonedDateTime next = atTimeOfDay(today, definition, zone);
        if (!next.toInstant().isAfter(now)) {
            next = atTimeOfDay(today.plusDays(1), definition, zone);
        }
        return next.toInstant();
    }

    private static Instant nextWeekly(RecurrenceDefinition definition, Instant now) {
        ZoneId zone = definition.timezone();
        ZonedDateTime current = now.atZone(zone);
        DayOfWeek target = definition.dayOfWeek() != null ? definition.dayOfWeek() : current.getDayOfWeek();

        int delta = (target.getValue() - current.getDayOfWeek().getValue() + 7) % 7;
        if (delta == 0) {
            delta = 7;
        }

        LocalDate day = current.toLocalDate().plusDays(delta);
        ZonedDateTime next = atTimeOfDay(day, definition, zone);
        if (!next.toInstant().isAfter(now)) {
            next = atTimeOfDay(day.plusDays(7), definition, zone);
        }
        return next.toInstant();
    }

    private static Instant nextMonthly(RecurrenceDefinition definition, Instant now) {
        ZoneId zone = definition.timezone();
        int day = clampDayOfMonth(definition.dayOfMonth());
        YearMonth month = YearMonth.from(now.atZone(zone));

        ZonedDateTime next = atTimeOfDay(month.atDay(day), definition, zone);
        if (!next.toInstant().isAfter(now)) {
            next = atTimeOfDay(month.plusMonths(1).atDay(day), definition, zone);
        }
        return next.toInstant();
    }

    private static Instant nextCron(RecurrenceDefinition definition, Instant now) {
        Optional<Cron> cron = parseCron(definition.cronExpression());
        if (cron.isEmpty()) {
            return null;
        }
        ZonedDateTime base = now.atZone(definition.timezone());
        return ExecutionTime.forCron(cron.get()).nextExecution(base).map(ZonedDateTime::toInstant)
                .filter(next -> next.isAfter(now)).orElse(null);
    }

    /**
     * Clamps a requested day of month into 1-28; {@code null} means the 1st.
     */
    static int clampDayOfMonth(Integer dayOfMonth) {
        if (dayOfMonth == null) {
            return 1;
        }
        return Math.max(1, Math.min(dayOfMonth, MAX_DAY_OF_MONTH));
    }

    private static ZonedDateTime atTimeOfDay(LocalDate date, RecurrenceDefinition definition, ZoneId zone) {
        int hour = definition.hour() != null ? definition.hour() : 0;
        int minute = definition.minute() != null ? definition.minute() : 0;
        // Wall-clock times inside a DST gap resolve forward by the length of the gap
        return date.atTime(hour, minute).atZone(zone);
    }

    private static Optional<Cron> parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        try {
            Cron cron = CRON_PARSER.parse(expression.trim());
            cron.validate();
            return Optional.of(cron);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
