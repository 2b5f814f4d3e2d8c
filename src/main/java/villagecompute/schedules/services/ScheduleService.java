package villagecompute.schedules.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.ScheduleListQuery;
import villagecompute.schedules.data.ScheduledJobPage;
import villagecompute.schedules.data.ScheduledJobPatch;
import villagecompute.schedules.data.ScheduledJobStore;
import villagecompute.schedules.data.models.DelayedJob;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.exceptions.DispatchException;
import villagecompute.schedules.exceptions.ResourceNotFoundException;
import villagecompute.schedules.exceptions.ValidationException;
import villagecompute.schedules.jobs.DispatchedJob;
import villagecompute.schedules.jobs.JobDispatchRequest;
import villagecompute.schedules.jobs.JobDispatcher;
import villagecompute.schedules.scheduling.NextRunCalculator;
import villagecompute.schedules.scheduling.RecurrenceDefinition;
import villagecompute.schedules.scheduling.ScheduleFrequency;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant-facing schedule operations.
 *
 * <p>
 * Sits on top of {@link ScheduledJobStore} and owns every decision about {@code nextRunAt} outside the engine:
 * <ul>
 * <li>create computes it from the creation time</li>
 * <li>update recomputes it only when a recurrence field is part of the patch</li>
 * <li>pause leaves it alone, resume recomputes it strictly after the resume time</li>
 * <li>run-now never touches it</li>
 * </ul>
 *
 * <p>
 * Missing, soft-deleted and foreign-tenant schedules all surface as {@link ResourceNotFoundException}; bad input
 * surfaces as {@link ValidationException}.
 */
@ApplicationScoped
public class ScheduleService {

    private static final Logger LOG = Logger.getLogger(ScheduleService.class);

    public static final int DEFAULT_HISTORY_LIMIT = 10;

    public static final int MAX_HISTORY_LIMIT = 100;

    @Inject
    ScheduledJobStore store;

    @Inject
    JobDispatcher jobDispatcher;

    @Inject
    DelayedJobService delayedJobService;

    @Inject
    Clock clock;

    public ScheduledJobPage list(String organizationId, ScheduleListQuery query) {
        return store.list(organizationId, query == null ? ScheduleListQuery.firstPage() : query);
    }

    public ScheduledJob get(String organizationId, UUID scheduleId) {
        return store.findById(organizationId, scheduleId).orElseThrow(() -> notFound(scheduleId));
    }

    /**
     * Validates and stores a new schedule.
     *
     * <p>
     * Defaults: timezone {@code UTC}, start date now, delivery method {@code none}, active.
     *
     * @param organizationId
     *            owning tenant
     * @param userId
     *            acting user, stored as creator and used as the creator of every dispatched job
     * @param draft
     *            unsaved schedule carrying the requested fields
     * @return stored schedule with {@code nextRunAt} computed
     */
    public ScheduledJob create(String organizationId, String userId, ScheduledJob draft) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("Acting user is required");
        }
        if (draft.name == null || draft.name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (draft.jobType == null || draft.jobType.isBlank()) {
            throw new ValidationException("jobType is required");
        }

        Instant now = clock.instant();
        draft.organizationId = organizationId;
        draft.createdBy = userId;
        if (draft.timezone == null || draft.timezone.isBlank()) {
            draft.timezone = "UTC";
        }
        if (draft.startDate == null) {
            draft.startDate = now;
        }
        if (draft.deliveryMethod == null) {
            draft.deliveryMethod = ScheduledJob.DeliveryMethod.NONE;
        }
        draft.isActive = true;
        draft.failureCount = 0;

        validateRecurrence(draft.frequency, draft.hour, draft.minute, draft.dayOfMonth, draft.cronExpression,
                draft.timezone, draft.startDate, draft.endDate);
        draft.nextRunAt = NextRunCalculator.computeNextRun(RecurrenceDefinition.of(draft), now);

        return store.create(draft);
    }

    /**
     * Applies a partial update. {@code nextRunAt} is recomputed from now when the patch touches a recurrence field;
     * the stored values fill in whatever the patch leaves out.
     *
     * <p>
     * Setting {@code isActive=true} on an inactive schedule is a resume and follows {@link #resume}: {@code nextRunAt}
     * is recomputed strictly after now and the failure streak is cleared.
     */
    public ScheduledJob update(String organizationId, UUID scheduleId, ScheduledJobPatch patch) {
        ScheduledJob existing = get(organizationId, scheduleId);
        boolean reactivating = Boolean.TRUE.equals(patch.getIsActive()) && !existing.isActive;

        if (patch.changesRecurrence() || reactivating) {
            RecurrenceDefinition merged = merge(existing, patch);
            if (patch.changesRecurrence()) {
                validateRecurrence(merged.frequency(), merged.hour(), merged.minute(), merged.dayOfMonth(),
                        merged.cronExpression(), patch.getTimezone() != null ? patch.getTimezone() : existing.timezone,
                        merged.startDate(), merged.endDate());
            }
            Instant now = clock.instant();
            Instant next = NextRunCalculator.computeNextRun(merged, now);
            if (reactivating) {
                next = strictlyAfter(next, now);
                patch.failureCount(0);
                LOG.infof("Reactivating schedule %s (org: %s) via update, next run %s", scheduleId, organizationId,
                        next);
            }
            patch.nextRunAt(next);
        }

        return store.update(organizationId, scheduleId, patch).orElseThrow(() -> notFound(scheduleId));
    }

    public void delete(String organizationId, UUID scheduleId) {
        if (!store.softDelete(organizationId, scheduleId)) {
            throw notFound(scheduleId);
        }
    }

    /**
     * Deactivates a schedule. {@code nextRunAt} is kept so the history of intent stays visible.
     */
    public ScheduledJob pause(String organizationId, UUID scheduleId) {
        ScheduledJob paused = store.update(organizationId, scheduleId, new ScheduledJobPatch().isActive(false))
                .orElseThrow(() -> notFound(scheduleId));
        LOG.infof("Paused schedule %s (org: %s)", scheduleId, organizationId);
        return paused;
    }

    /**
     * Reactivates a schedule, recomputing {@code nextRunAt} strictly after now and clearing the failure streak so an
     * auto-disabled schedule becomes eligible again.
     */
    public ScheduledJob resume(String organizationId, UUID scheduleId) {
        ScheduledJob existing = get(organizationId, scheduleId);
        Instant now = clock.instant();
        Instant next = strictlyAfter(NextRunCalculator.computeNextRun(RecurrenceDefinition.of(existing), now), now);

        ScheduledJob resumed = store.update(organizationId, scheduleId,
                new ScheduledJobPatch().isActive(true).failureCount(0).nextRunAt(next))
                .orElseThrow(() -> notFound(scheduleId));
        LOG.infof("Resumed schedule %s (org: %s), next run %s", scheduleId, organizationId, next);
        return resumed;
    }

    /**
     * Dispatches the schedule's job immediately, outside its recurrence.
     *
     * <p>
     * Only {@code lastRunAt} and {@code lastJobId} are written; {@code nextRunAt} and {@code failureCount} stay as they
     * were. A dispatch failure is reported to the caller and not counted against the schedule.
     *
     * @param userId
     *            acting user recorded as the job's creator
     * @return the dispatched job
     * @throws DispatchException
     *             if the dispatcher rejects the job
     */
    public DispatchedJob runNow(String organizationId, UUID scheduleId, String userId) {
        ScheduledJob schedule = get(organizationId, scheduleId);
        String createdBy = userId == null || userId.isBlank() ? schedule.createdBy : userId;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(JobDispatchRequest.META_SCHEDULE_ID, schedule.id.toString());
        metadata.put(JobDispatchRequest.META_TRIGGERED_BY, JobDispatchRequest.TRIGGERED_BY_MANUAL);

        DispatchedJob job;
        try {
            job = jobDispatcher.createAndEnqueueJob(new JobDispatchRequest(organizationId, schedule.jobType, createdBy,
                    schedule.jobConfig, metadata));
        } catch (DispatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DispatchException("Manual dispatch failed for schedule " + scheduleId, e);
        }

        store.recordManualRun(schedule.id, clock.instant(), job.id());
        LOG.infof("Manual run of schedule %s dispatched job %s (by %s)", scheduleId, job.id(), createdBy);
        return job;
    }

    /**
     * Returns the most recent jobs dispatched for a schedule.
     *
     * @param limit
     *            requested size, defaults to {@value #DEFAULT_HISTORY_LIMIT} and is capped at
     *            {@value #MAX_HISTORY_LIMIT}
     */
    public List<DelayedJob> getHistory(String organizationId, UUID scheduleId, Integer limit) {
        get(organizationId, scheduleId);
        int resolved = limit == null || limit < 1 ? DEFAULT_HISTORY_LIMIT : Math.min(limit, MAX_HISTORY_LIMIT);
        return delayedJobService.findRecentForSchedule(organizationId, scheduleId, resolved);
    }

    /**
     * Parses a wire frequency value.
     *
     * @throws ValidationException
     *             for unknown values
     */
    public static ScheduleFrequency parseFrequency(String value) {
        if (value == null) {
            return null;
        }
        ScheduleFrequency frequency = ScheduleFrequency.fromValue(value);
        if (frequency == null) {
            throw new ValidationException("Unknown frequency: " + value);
        }
        return frequency;
    }

    /**
     * Parses a weekday name such as {@code monday} or {@code MON}.
     *
     * @throws ValidationException
     *             for unknown names
     */
    public static DayOfWeek parseDayOfWeek(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().equals(normalized) || day.name().startsWith(normalized) && normalized.length() == 3) {
                return day;
            }
        }
        throw new ValidationException("Unknown day of week: " + value);
    }

    /**
     * Parses a wire delivery method value.
     *
     * @throws ValidationException
     *             for unknown values
     */
    public static ScheduledJob.DeliveryMethod parseDeliveryMethod(String value) {
        if (value == null) {
            return null;
        }
        ScheduledJob.DeliveryMethod method = ScheduledJob.DeliveryMethod.fromValue(value);
        if (method == null) {
            throw new ValidationException("Unknown delivery method: " + value);
        }
        return method;
    }

    private static void validateRecurrence(ScheduleFrequency frequency, Integer hour, Integer minute,
            Integer dayOfMonth, String cronExpression, String timezone, Instant startDate, Instant endDate) {
        if (frequency == null) {
            throw new ValidationException("frequency is required");
        }
        if (hour != null && (hour < 0 || hour > 23)) {
            throw new ValidationException("hour must be between 0 and 23");
        }
        if (minute != null && (minute < 0 || minute > 59)) {
            throw new ValidationException("minute must be between 0 and 59");
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new ValidationException("dayOfMonth must be between 1 and 31");
        }
        if (timezone != null) {
            try {
                ZoneId.of(timezone.trim());
            } catch (DateTimeException e) {
                throw new ValidationException("Unknown timezone: " + timezone);
            }
        }
        if (frequency == ScheduleFrequency.CUSTOM) {
            if (cronExpression == null || cronExpression.isBlank()) {
                throw new ValidationException("cronExpression is required for custom schedules");
            }
            if (!NextRunCalculator.isValidCron(cronExpression)) {
                throw new ValidationException("Invalid cron expression: " + cronExpression);
            }
        }
        if (startDate != null && endDate != null && !endDate.isAfter(startDate)) {
            throw new ValidationException("endDate must be after startDate");
        }
    }

    private static RecurrenceDefinition merge(ScheduledJob existing, ScheduledJobPatch patch) {
        return new RecurrenceDefinition(pick(patch.getFrequency(), existing.frequency),
                pick(patch.getHour(), existing.hour), pick(patch.getMinute(), existing.minute),
                pick(patch.getDayOfWeek(), existing.dayOfWeek), pick(patch.getDayOfMonth(), existing.dayOfMonth),
                pick(patch.getCronExpression(), existing.cronExpression),
                RecurrenceDefinition.parseZone(pick(patch.getTimezone(), existing.timezone)),
                pick(patch.getStartDate(), existing.startDate), pick(patch.getEndDate(), existing.endDate));
    }

    private static Instant strictlyAfter(Instant next, Instant now) {
        return next != null && next.isAfter(now) ? next : null;
    }

    private static <T> T pick(T patched, T stored) {
        return patched != null ? patched : stored;
    }

    private static ResourceNotFoundException notFound(UUID scheduleId) {
        return new ResourceNotFoundException("Schedule not found: " + scheduleId);
    }
}
