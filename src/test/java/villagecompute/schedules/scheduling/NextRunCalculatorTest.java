package villagecompute.schedules.scheduling;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link NextRunCalculator}.
 */
class NextRunCalculatorTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static RecurrenceDefinition daily(int hour, int minute, ZoneId zone) {
        return new RecurrenceDefinition(ScheduleFrequency.DAILY, hour, minute, null, null, null, zone, null, null);
    }

    private static RecurrenceDefinition weekly(DayOfWeek day, int hour, int minute) {
        return new RecurrenceDefinition(ScheduleFrequency.WEEKLY, hour, minute, day, null, null, UTC, null, null);
    }

    private static RecurrenceDefinition monthly(Integer dayOfMonth, int hour, int minute) {
        return new RecurrenceDefinition(ScheduleFrequency.MONTHLY, hour, minute, null, dayOfMonth, null, UTC, null,
                null);
    }

    private static RecurrenceDefinition cron(String expression, ZoneId zone) {
        return new RecurrenceDefinition(ScheduleFrequency.CUSTOM, null, null, null, null, expression, zone, null, null);
    }

    private static Instant at(String iso) {
        return Instant.parse(iso);
    }

    @Test
    void testDaily_createdAfterTodaysSlot_runsTomorrow() {
        Instant next = NextRunCalculator.computeNextRun(daily(9, 0, UTC), at("2024-01-01T10:00:00Z"));
        assertEquals(at("2024-01-02T09:00:00Z"), next);
    }

    @Test
    void testDaily_afterTickPastDueTime_advancesOneDay() {
        Instant next = NextRunCalculator.computeNextRun(daily(9, 0, UTC), at("2024-01-02T09:05:00Z"));
        assertEquals(at("2024-01-03T09:00:00Z"), next);
    }

    @Test
    void testDaily_beforeTodaysSlot_runsToday() {
        Instant next = NextRunCalculator.computeNextRun(daily(9, 30, UTC), at("2024-01-01T08:00:00Z"));
        assertEquals(at("2024-01-01T09:30:00Z"), next);
    }

    @Test
    void testDaily_exactlyAtSlot_isNotReturned() {
        Instant now = at("2024-01-01T09:00:00Z");
        assertEquals(at("2024-01-02T09:00:00Z"), NextRunCalculator.computeNextRun(daily(9, 0, UTC), now));
    }

    @Test
    void testDaily_missingHourAndMinute_defaultToMidnight() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.DAILY, null, null, null, null,
                null, UTC, null, null);
        assertEquals(at("2024-01-02T00:00:00Z"),
                NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testDaily_inScheduleTimezone_usesZoneWallClock() {
        // 05:00 in New York, so 09:00 local is still ahead today
        Instant next = NextRunCalculator.computeNextRun(daily(9, 0, NEW_YORK), at("2024-01-01T10:00:00Z"));
        assertEquals(at("2024-01-01T14:00:00Z"), next);
    }

    @Test
    void testDaily_acrossDstStart_keepsLocalTime() {
        // 2024-03-10 is the US spring-forward date: 09:00 EDT is 13:00 UTC
        Instant next = NextRunCalculator.computeNextRun(daily(9, 0, NEW_YORK), at("2024-03-09T15:00:00Z"));
        assertEquals(at("2024-03-10T13:00:00Z"), next);
    }

    @Test
    void testWeekly_sameWeekdayAfterSlot_runsFollowingWeek() {
        // 2024-01-01 is a Monday
        Instant next = NextRunCalculator.computeNextRun(weekly(DayOfWeek.MONDAY, 9, 0), at("2024-01-01T23:00:00Z"));
        assertEquals(at("2024-01-08T09:00:00Z"), next);
    }

    @Test
    void testWeekly_sameWeekdayBeforeSlot_stillRunsFollowingWeek() {
        Instant next = NextRunCalculator.computeNextRun(weekly(DayOfWeek.MONDAY, 9, 0), at("2024-01-01T06:00:00Z"));
        assertEquals(at("2024-01-08T09:00:00Z"), next);
    }

    @Test
    void testWeekly_laterWeekday_runsThisWeek() {
        Instant next = NextRunCalculator.computeNextRun(weekly(DayOfWeek.WEDNESDAY, 9, 0), at("2024-01-01T10:00:00Z"));
        assertEquals(at("2024-01-03T09:00:00Z"), next);
    }

    @Test
    void testWeekly_earlierWeekday_wrapsToNextWeek() {
        // Friday 2024-01-05 -> Monday 2024-01-08
        Instant next = NextRunCalculator.computeNextRun(weekly(DayOfWeek.MONDAY, 9, 0), at("2024-01-05T10:00:00Z"));
        assertEquals(at("2024-01-08T09:00:00Z"), next);
    }

    @Test
    void testWeekly_missingDayOfWeek_usesNowsWeekday() {
        Instant next = NextRunCalculator.computeNextRun(weekly(null, 9, 0), at("2024-01-03T10:00:00Z"));
        assertEquals(at("2024-01-10T09:00:00Z"), next);
    }

    @Test
    void testMonthly_dayOfMonth31_clampsTo28InFebruary() {
        Instant next = NextRunCalculator.computeNextRun(monthly(31, 8, 0), at("2024-02-10T00:00:00Z"));
        assertEquals(at("2024-02-28T08:00:00Z"), next);
    }

    @Test
    void testMonthly_afterSlot_advancesToNextMonth() {
        Instant next = NextRunCalculator.computeNextRun(monthly(31, 8, 0), at("2024-02-28T08:00:00Z"));
        assertEquals(at("2024-03-28T08:00:00Z"), next);
    }

    @Test
    void testMonthly_decemberRollover_movesToJanuary() {
        Instant next = NextRunCalculator.computeNextRun(monthly(15, 12, 0), at("2024-12-20T00:00:00Z"));
        assertEquals(at("2025-01-15T12:00:00Z"), next);
    }

    @Test
    void testMonthly_missingDayOfMonth_defaultsToFirst() {
        Instant next = NextRunCalculator.computeNextRun(monthly(null, 0, 0), at("2024-01-15T00:00:00Z"));
        assertEquals(at("2024-02-01T00:00:00Z"), next);
    }

    @Test
    void testClampDayOfMonth_bounds() {
        assertEquals(1, NextRunCalculator.clampDayOfMonth(null));
        assertEquals(1, NextRunCalculator.clampDayOfMonth(0));
        assertEquals(1, NextRunCalculator.clampDayOfMonth(-4));
        assertEquals(15, NextRunCalculator.clampDayOfMonth(15));
        assertEquals(28, NextRunCalculator.clampDayOfMonth(29));
        assertEquals(28, NextRunCalculator.clampDayOfMonth(31));
    }

    @Test
    void testOnce_returnsStartDateEvenWhenPast() {
        Instant start = at("2023-06-01T12:00:00Z");
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.ONCE, null, null, null, null,
                null, UTC, start, null);
        assertEquals(start, NextRunCalculator.computeNextRun(definition, at("2024-01-01T00:00:00Z")));
    }

    @Test
    void testOnce_withoutStartDate_returnsNull() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.ONCE, null, null, null, null,
                null, UTC, null, null);
        assertNull(NextRunCalculator.computeNextRun(definition, at("2024-01-01T00:00:00Z")));
    }

    @Test
    void testCustom_everyFifteenMinutes_returnsNextQuarterHour() {
        Instant next = NextRunCalculator.computeNextRun(cron("*/15 * * * *", UTC), at("2024-01-01T10:07:00Z"));
        assertEquals(at("2024-01-01T10:15:00Z"), next);
    }

    @Test
    void testCustom_matchingNow_returnsFollowingOccurrence() {
        Instant next = NextRunCalculator.computeNextRun(cron("0 10 * * *", UTC), at("2024-01-01T10:00:00Z"));
        assertEquals(at("2024-01-02T10:00:00Z"), next);
    }

    @Test
    void testCustom_evaluatedInScheduleTimezone() {
        // 11:00 in Berlin, so the next 09:00 Berlin is tomorrow at 08:00 UTC
        Instant next = NextRunCalculator.computeNextRun(cron("0 9 * * *", ZoneId.of("Europe/Berlin")),
                at("2024-01-01T10:00:00Z"));
        assertEquals(at("2024-01-02T08:00:00Z"), next);
    }

    @Test
    void testCustom_invalidExpression_returnsNull() {
        assertNull(NextRunCalculator.computeNextRun(cron("not a cron", UTC), at("2024-01-01T10:00:00Z")));
        assertNull(NextRunCalculator.computeNextRun(cron(null, UTC), at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testIsValidCron() {
        assertTrue(NextRunCalculator.isValidCron("0 9 * * 1-5"));
        assertTrue(NextRunCalculator.isValidCron("*/5 * * * *"));
        assertFalse(NextRunCalculator.isValidCron("* * *"));
        assertFalse(NextRunCalculator.isValidCron("not a cron"));
        assertFalse(NextRunCalculator.isValidCron(""));
        assertFalse(NextRunCalculator.isValidCron(null));
    }

    @Test
    void testEndDate_occurrenceAtEndDate_returnsNull() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.DAILY, 9, 0, null, null, null,
                UTC, null, at("2024-01-02T09:00:00Z"));
        assertNull(NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testEndDate_occurrenceBeforeEndDate_isReturned() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.DAILY, 9, 0, null, null, null,
                UTC, null, at("2024-01-02T09:00:01Z"));
        assertEquals(at("2024-01-02T09:00:00Z"),
                NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testFutureStartDate_firstRunIsNotBeforeStart() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.DAILY, 9, 0, null, null, null,
                UTC, at("2024-02-01T12:00:00Z"), null);
        assertEquals(at("2024-02-02T09:00:00Z"),
                NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testFutureStartDate_onSlot_firesAtStart() {
        RecurrenceDefinition definition = new RecurrenceDefinition(ScheduleFrequency.DAILY, 9, 0, null, null, null,
                UTC, at("2024-02-01T09:00:00Z"), null);
        assertEquals(at("2024-02-01T09:00:00Z"),
                NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testNullFrequency_returnsNull() {
        RecurrenceDefinition definition = new RecurrenceDefinition(null, 9, 0, null, null, null, UTC, null, null);
        assertNull(NextRunCalculator.computeNextRun(definition, at("2024-01-01T10:00:00Z")));
    }

    @Test
    void testRecurringFrequencies_neverReturnInstantAtOrBeforeNow() {
        List<RecurrenceDefinition> definitions = List.of(daily(0, 0, UTC), daily(23, 59, NEW_YORK),
                weekly(DayOfWeek.SUNDAY, 0, 0), weekly(DayOfWeek.SATURDAY, 23, 59), monthly(1, 0, 0),
                monthly(28, 23, 59), cron("30 14 * * *", NEW_YORK));

        Instant now = at("2024-01-01T00:00:00Z");
        Instant end = at("2025-01-01T00:00:00Z");
        while (now.isBefore(end)) {
            for (RecurrenceDefinition definition : definitions) {
                Instant next = NextRunCalculator.computeNextRun(definition, now);
                assertNotNull(next);
                assertTrue(next.isAfter(now), definition + " at " + now + " returned " + next);
            }
            now = now.plus(Duration.ofMinutes(7919));
        }
    }

    @Test
    void testRecurringFrequencies_feedingResultBackIsStrictlyIncreasing() {
        List<RecurrenceDefinition> definitions = List.of(daily(9, 0, NEW_YORK), weekly(DayOfWeek.FRIDAY, 17, 30),
                monthly(31, 6, 15));

        for (RecurrenceDefinition definition : definitions) {
            Instant previous = at("2024-01-01T00:00:00Z");
            for (int i = 0; i < 40; i++) {
                Instant next = NextRunCalculator.computeNextRun(definition, previous);
                assertTrue(next.isAfter(previous), definition + " did not advance from " + previous);
                previous = next;
            }
        }
    }
}
