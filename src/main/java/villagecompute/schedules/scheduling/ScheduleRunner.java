package villagecompute.schedules.scheduling;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.ScheduledJobStore;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.exceptions.DispatchException;
import villagecompute.schedules.jobs.DispatchedJob;
import villagecompute.schedules.jobs.JobDispatchRequest;
import villagecompute.schedules.jobs.JobDispatcher;
import villagecompute.schedules.observability.LoggingConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Dispatches a single due schedule and writes back its run state.
 *
 * <p>
 * <b>Procedure:</b>
 * <ol>
 * <li>Take the dispatch lease; skip the schedule if another instance holds it or has already advanced it past the
 * {@code nextRunAt} read by the batch query</li>
 * <li>Dispatch a job tagged {@code triggeredBy=scheduler} with the due time as {@code scheduledTime} on the calling
 * thread; the dispatcher bounds the call with its own fault-tolerance timeout</li>
 * <li>On success, recompute {@code nextRunAt} from the current time and reset the failure count</li>
 * <li>On failure, apply the {@link FailurePolicy}; {@code nextRunAt} stays in the past so the next tick retries</li>
 * </ol>
 *
 * <p>
 * Errors from the accounting writes are logged and never propagate, so one schedule cannot abort the rest of a batch.
 */
public class ScheduleRunner {

    private static final Logger LOG = Logger.getLogger(ScheduleRunner.class);

    private final ScheduledJobStore store;
    private final JobDispatcher dispatcher;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final FailurePolicy failurePolicy;
    private final Duration claimLease;
    private final String workerId;

    public ScheduleRunner(ScheduledJobStore store, JobDispatcher dispatcher, Clock clock, MeterRegistry meterRegistry,
            FailurePolicy failurePolicy, Duration claimLease, String workerId) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.failurePolicy = failurePolicy;
        this.claimLease = claimLease;
        this.workerId = workerId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Runs the dispatch procedure for one schedule taken from a due batch.
     *
     * @param schedule
     *            due schedule as read by the batch query
     * @return outcome for tick aggregation
     */
    public RunOutcome run(ScheduledJob schedule) {
        LoggingConfig.setScheduleContext(schedule.organizationId, schedule.id);
        try {
            Instant claimedAt = clock.instant();
            if (!store.claim(schedule.id, workerId, schedule.nextRunAt, claimedAt, claimedAt.plus(claimLease))) {
                LOG.debugf("Schedule %s is leased or already advanced by another instance, skipping", schedule.id);
                count(RunOutcome.SKIPPED);
                return RunOutcome.SKIPPED;
            }

            DispatchedJob job;
            try {
                job = dispatch(scheduledRequest(schedule));
            } catch (DispatchException e) {
                recordFailure(schedule, e);
                count(RunOutcome.FAILED);
                return RunOutcome.FAILED;
            }

            LoggingConfig.setJobId(job.id());
            recordSuccess(schedule, job);
            count(RunOutcome.SUCCEEDED);
            return RunOutcome.SUCCEEDED;

        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error while processing schedule %s", schedule.id);
            count(RunOutcome.FAILED);
            return RunOutcome.FAILED;

        } finally {
            LoggingConfig.clearScheduleContext();
        }
    }

    /**
     * Invokes the dispatcher and normalizes every failure, including a fault-tolerance timeout, to a
     * {@link DispatchException}.
     */
    DispatchedJob dispatch(JobDispatchRequest request) {
        DispatchedJob job;
        try {
            job = dispatcher.createAndEnqueueJob(request);
        } catch (DispatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DispatchException("Dispatch failed: " + e.getMessage(), e);
        }
        if (job == null || job.id() == null) {
            throw new DispatchException("Dispatcher returned no job id");
        }
        return job;
    }

    private JobDispatchRequest scheduledRequest(ScheduledJob schedule) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(JobDispatchRequest.META_SCHEDULE_ID, schedule.id.toString());
        metadata.put(JobDispatchRequest.META_TRIGGERED_BY, JobDispatchRequest.TRIGGERED_BY_SCHEDULER);
        metadata.put(JobDispatchRequest.META_SCHEDULED_TIME,
                schedule.nextRunAt == null ? null : schedule.nextRunAt.toString());
        return new JobDispatchRequest(schedule.organizationId, schedule.jobType, schedule.createdBy,
                schedule.jobConfig, metadata);
    }

    private void recordSuccess(ScheduledJob schedule, DispatchedJob job) {
        Instant now = clock.instant();
        Instant next = NextRunCalculator.computeNextRun(RecurrenceDefinition.of(schedule), now);
        if (next != null && !next.isAfter(now)) {
            // once: startDate is already behind us
            next = null;
        }
        try {
            store.recordSuccess(schedule.id, now, job.id(), next);
            LOG.infof("Schedule %s dispatched job %s, next run %s", schedule.id, job.id(), next);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Dispatched job %s for schedule %s but failed to record the run", job.id(), schedule.id);
        }
    }

    private void recordFailure(ScheduledJob schedule, DispatchException cause) {
        try {
            int failures = store.recordFailure(schedule.id, clock.instant(), failurePolicy);
            if (failures < 0) {
                LOG.warnf(cause, "Dispatch failed for schedule %s, which no longer exists", schedule.id);
                return;
            }
            if (failures >= failurePolicy.getMaxFailureCount()) {
                LOG.errorf(cause, "Schedule %s disabled after %d consecutive failures", schedule.id, failures);
                Counter.builder("schedules.auto_disabled.total").register(meterRegistry).increment();
            } else {
                LOG.warnf(cause, "Dispatch failed for schedule %s (failure %d/%d)", schedule.id, failures,
                        failurePolicy.getMaxFailureCount());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record dispatch failure for schedule %s", schedule.id);
        }
    }

    private void count(RunOutcome outcome) {
        Counter.builder("schedules.dispatch.total").tag("result", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry).increment();
    }
}
