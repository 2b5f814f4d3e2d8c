package villagecompute.schedules.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.schedules.data.ScheduledJobPatch;
import villagecompute.schedules.data.models.DelayedJob;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.exceptions.DispatchException;
import villagecompute.schedules.exceptions.ResourceNotFoundException;
import villagecompute.schedules.exceptions.ValidationException;
import villagecompute.schedules.jobs.DispatchedJob;
import villagecompute.schedules.jobs.JobDispatchRequest;
import villagecompute.schedules.scheduling.FailurePolicy;
import villagecompute.schedules.scheduling.ScheduleFrequency;
import villagecompute.schedules.testing.InMemoryScheduledJobStore;
import villagecompute.schedules.testing.MutableClock;
import villagecompute.schedules.testing.RecordingJobDispatcher;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ScheduleService}.
 */
class ScheduleServiceTest {

    private static final String ORG = "org_acme";
    private static final String USER = "user_1";

    @Mock
    DelayedJobService delayedJobService;

    private MutableClock clock;
    private InMemoryScheduledJobStore store;
    private RecordingJobDispatcher dispatcher;
    private ScheduleService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = MutableClock.at("2024-01-01T10:00:00Z");
        store = new InMemoryScheduledJobStore(clock);
        dispatcher = new RecordingJobDispatcher();

        service = new ScheduleService();
        service.store = store;
        service.jobDispatcher = dispatcher;
        service.delayedJobService = delayedJobService;
        service.clock = clock;
    }

    private ScheduledJob draft(ScheduleFrequency frequency) {
        ScheduledJob draft = new ScheduledJob();
        draft.name = "Revenue report";
        draft.jobType = "report";
        draft.frequency = frequency;
        draft.hour = 9;
        draft.minute = 0;
        return draft;
    }

    @Test
    void testCreate_dailySchedule_computesNextRunFromCreationTime() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));

        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), created.nextRunAt);
        assertEquals(ORG, created.organizationId);
        assertEquals(USER, created.createdBy);
        assertEquals("UTC", created.timezone);
        assertEquals(clock.instant(), created.startDate);
        assertEquals(ScheduledJob.DeliveryMethod.NONE, created.deliveryMethod);
        assertTrue(created.isActive);
        assertEquals(0, created.failureCount);
    }

    @Test
    void testCreate_onceWithoutStartDate_isDueImmediately() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.ONCE));
        assertEquals(clock.instant(), created.nextRunAt);
    }

    @Test
    void testCreate_customWithValidCron_computesNextRun() {
        ScheduledJob draft = draft(ScheduleFrequency.CUSTOM);
        draft.cronExpression = "30 12 * * *";

        assertEquals(Instant.parse("2024-01-01T12:30:00Z"), service.create(ORG, USER, draft).nextRunAt);
    }

    @Test
    void testCreate_customWithoutCron_isRejected() {
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, draft(ScheduleFrequency.CUSTOM)));
    }

    @Test
    void testCreate_customWithInvalidCron_isRejected() {
        ScheduledJob draft = draft(ScheduleFrequency.CUSTOM);
        draft.cronExpression = "every tuesday";
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, draft));
    }

    @Test
    void testCreate_invalidFields_areRejected() {
        ScheduledJob badHour = draft(ScheduleFrequency.DAILY);
        badHour.hour = 24;
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, badHour));

        ScheduledJob badMinute = draft(ScheduleFrequency.DAILY);
        badMinute.minute = -1;
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, badMinute));

        ScheduledJob badZone = draft(ScheduleFrequency.DAILY);
        badZone.timezone = "Mars/Olympus_Mons";
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, badZone));

        ScheduledJob badWindow = draft(ScheduleFrequency.DAILY);
        badWindow.startDate = Instant.parse("2024-02-01T00:00:00Z");
        badWindow.endDate = Instant.parse("2024-01-15T00:00:00Z");
        assertThrows(ValidationException.class, () -> service.create(ORG, USER, badWindow));

        assertThrows(ValidationException.class, () -> service.create(ORG, USER, draft(null)));
    }

    @Test
    void testCreate_withoutActingUser_isRejected() {
        assertThrows(ValidationException.class, () -> service.create(ORG, " ", draft(ScheduleFrequency.DAILY)));
    }

    @Test
    void testUpdate_nonRecurrenceField_keepsNextRunAt() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        Instant original = created.nextRunAt;
        clock.advance(Duration.ofDays(3));

        ScheduledJob updated = service.update(ORG, created.id, new ScheduledJobPatch().name("Renamed"));

        assertEquals("Renamed", updated.name);
        assertEquals(original, updated.nextRunAt);
    }

    @Test
    void testUpdate_recurrenceField_recomputesFromNowWithStoredValues() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        clock.set(Instant.parse("2024-01-05T10:00:00Z"));

        // frequency and minute come from the stored row
        ScheduledJob updated = service.update(ORG, created.id, new ScheduledJobPatch().hour(18));

        assertEquals(Instant.parse("2024-01-05T18:00:00Z"), updated.nextRunAt);
    }

    @Test
    void testUpdate_switchToWeekly_usesPatchedDay() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));

        ScheduledJob updated = service.update(ORG, created.id,
                new ScheduledJobPatch().frequency(ScheduleFrequency.WEEKLY).dayOfWeek(DayOfWeek.FRIDAY));

        assertEquals(Instant.parse("2024-01-05T09:00:00Z"), updated.nextRunAt);
    }

    @Test
    void testUpdate_invalidMergedRecurrence_isRejected() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        assertThrows(ValidationException.class,
                () -> service.update(ORG, created.id, new ScheduledJobPatch().frequency(ScheduleFrequency.CUSTOM)));
    }

    @Test
    void testUpdate_otherTenant_isNotFound() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        assertThrows(ResourceNotFoundException.class,
                () -> service.update("org_other", created.id, new ScheduledJobPatch().name("x")));
    }

    @Test
    void testUpdate_reactivatingPausedSchedule_followsResumePolicy() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        service.pause(ORG, created.id);
        created.failureCount = 3;
        clock.set(Instant.parse("2024-03-10T12:00:00Z"));

        ScheduledJob updated = service.update(ORG, created.id, new ScheduledJobPatch().isActive(true));

        assertTrue(updated.isActive);
        assertEquals(Instant.parse("2024-03-11T09:00:00Z"), updated.nextRunAt);
        assertEquals(0, updated.failureCount);
    }

    @Test
    void testUpdate_reactivatingWithNewHour_usesPatchedRecurrence() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        service.pause(ORG, created.id);
        clock.set(Instant.parse("2024-03-10T12:00:00Z"));

        ScheduledJob updated = service.update(ORG, created.id, new ScheduledJobPatch().isActive(true).hour(15));

        assertEquals(Instant.parse("2024-03-10T15:00:00Z"), updated.nextRunAt);
    }

    @Test
    void testUpdate_isActiveTrueOnActiveSchedule_keepsNextRunAt() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        Instant original = created.nextRunAt;
        created.failureCount = 2;
        clock.advance(Duration.ofDays(3));

        ScheduledJob updated = service.update(ORG, created.id, new ScheduledJobPatch().isActive(true));

        assertEquals(original, updated.nextRunAt);
        assertEquals(2, updated.failureCount);
    }

    @Test
    void testPause_keepsNextRunAt() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        Instant original = created.nextRunAt;

        ScheduledJob paused = service.pause(ORG, created.id);

        assertFalse(paused.isActive);
        assertEquals(original, paused.nextRunAt);
    }

    @Test
    void testResume_recomputesStrictlyAfterResumeTime() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        service.pause(ORG, created.id);
        clock.set(Instant.parse("2024-03-10T12:00:00Z"));

        ScheduledJob resumed = service.resume(ORG, created.id);

        assertTrue(resumed.isActive);
        assertEquals(Instant.parse("2024-03-11T09:00:00Z"), resumed.nextRunAt);
        assertTrue(resumed.nextRunAt.isAfter(clock.instant()));
    }

    @Test
    void testResume_autoDisabledSchedule_clearsFailureStreak() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        created.failureCount = 5;
        created.isActive = false;

        ScheduledJob resumed = service.resume(ORG, created.id);

        assertEquals(0, resumed.failureCount);
        assertTrue(resumed.isActive);
    }

    @Test
    void testResume_oneTimeScheduleInThePast_hasNoNextRun() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.ONCE));
        clock.advance(Duration.ofDays(1));

        assertNull(service.resume(ORG, created.id).nextRunAt);
    }

    @Test
    void testRunNow_onlyTouchesLastRunFields() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        created.failureCount = 2;
        Instant nextRunAt = created.nextRunAt;
        clock.advance(Duration.ofMinutes(30));

        DispatchedJob job = service.runNow(ORG, created.id, "user_2");

        assertEquals(job.id(), created.lastJobId);
        assertEquals(clock.instant(), created.lastRunAt);
        assertEquals(nextRunAt, created.nextRunAt);
        assertEquals(2, created.failureCount);

        JobDispatchRequest request = dispatcher.requests.get(0);
        assertEquals("manual", request.metadata().get(JobDispatchRequest.META_TRIGGERED_BY));
        assertEquals(created.id.toString(), request.metadata().get(JobDispatchRequest.META_SCHEDULE_ID));
        assertEquals("user_2", request.createdBy());
    }

    @Test
    void testRunNow_dispatchFailure_propagatesWithoutCountingFailure() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        dispatcher.failWith(new IllegalStateException("queue down"));

        assertThrows(DispatchException.class, () -> service.runNow(ORG, created.id, USER));
        assertEquals(0, created.failureCount);
        assertNull(created.lastJobId);
    }

    @Test
    void testDelete_hidesScheduleAndSecondDeleteIsNotFound() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));

        service.delete(ORG, created.id);

        assertThrows(ResourceNotFoundException.class, () -> service.get(ORG, created.id));
        assertThrows(ResourceNotFoundException.class, () -> service.delete(ORG, created.id));
        Instant farFuture = Instant.parse("2030-01-01T00:00:00Z");
        assertTrue(store.findDueBatch(farFuture, FailurePolicy.MAX_FAILURE_COUNT, 10).isEmpty());
    }

    @Test
    void testGetHistory_defaultsAndCapsLimit() {
        ScheduledJob created = service.create(ORG, USER, draft(ScheduleFrequency.DAILY));
        List<DelayedJob> jobs = List.of(new DelayedJob());
        when(delayedJobService.findRecentForSchedule(anyString(), any(UUID.class), anyInt())).thenReturn(jobs);

        assertSame(jobs, service.getHistory(ORG, created.id, null));
        verify(delayedJobService).findRecentForSchedule(ORG, created.id, ScheduleService.DEFAULT_HISTORY_LIMIT);

        service.getHistory(ORG, created.id, 10_000);
        verify(delayedJobService).findRecentForSchedule(ORG, created.id, ScheduleService.MAX_HISTORY_LIMIT);
    }

    @Test
    void testGetHistory_unknownSchedule_isNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> service.getHistory(ORG, UUID.randomUUID(), 5));
        verify(delayedJobService, never()).findRecentForSchedule(anyString(), any(UUID.class), anyInt());
    }

    @Test
    void testParseHelpers() {
        assertEquals(DayOfWeek.MONDAY, ScheduleService.parseDayOfWeek("monday"));
        assertEquals(DayOfWeek.WEDNESDAY, ScheduleService.parseDayOfWeek("WED"));
        assertNull(ScheduleService.parseDayOfWeek(null));
        assertThrows(ValidationException.class, () -> ScheduleService.parseDayOfWeek("funday"));

        assertEquals(ScheduleFrequency.WEEKLY, ScheduleService.parseFrequency("weekly"));
        assertThrows(ValidationException.class, () -> ScheduleService.parseFrequency("hourly"));

        assertEquals(ScheduledJob.DeliveryMethod.EMAIL, ScheduleService.parseDeliveryMethod("email"));
        assertThrows(ValidationException.class, () -> ScheduleService.parseDeliveryMethod("pigeon"));
    }
}
