package villagecompute.schedules.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.models.DelayedJob;
import villagecompute.schedules.jobs.DispatchedJob;
import villagecompute.schedules.jobs.JobDispatchRequest;
import villagecompute.schedules.jobs.JobDispatcher;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Database-backed job dispatch.
 *
 * <p>
 * Every dispatch creates one {@link DelayedJob} row in PENDING state. Execution of those rows belongs to the job
 * workers and is not handled here. Each dispatch is wrapped in a {@code job.dispatch} OpenTelemetry span carrying the
 * tenant, job type and originating schedule.
 *
 * <p>
 * <b>Timeout:</b> a dispatch is interrupted after 30s by default. {@code schedules.engine.dispatch-timeout-ms}
 * overrides it through the MicroProfile Fault Tolerance {@code Timeout/value} key. A timed-out dispatch surfaces as a
 * {@link org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException} and its transaction rolls back.
 *
 * @see JobDispatcher for the contract the scheduler depends on
 */
@ApplicationScoped
public class DelayedJobService implements JobDispatcher {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    @Inject
    Tracer tracer;

    @Inject
    Clock clock;

    @Override
    @Transactional
    @Timeout(30000)
    public DispatchedJob createAndEnqueueJob(JobDispatchRequest request) {
        UUID scheduleId = scheduleIdOf(request);

        Span span = tracer.spanBuilder("job.dispatch").setAttribute("job.type", request.type())
                .setAttribute("tenant.id", request.tenantId())
                .setAttribute("schedule.id", scheduleId == null ? "" : scheduleId.toString()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            DelayedJob job = DelayedJob.create(request.tenantId(), request.type(), request.createdBy(), request.input(),
                    request.metadata(), scheduleId, clock.instant());
            span.setAttribute("job.id", job.id.toString());
            span.addEvent("job.enqueued");
            return new DispatchedJob(job.id.toString());

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            LOG.errorf(e, "Failed to enqueue job (type: %s, tenant: %s)", request.type(), request.tenantId());
            throw e;

        } finally {
            span.end();
        }
    }

    /**
     * Lists the most recent jobs dispatched for a schedule.
     *
     * @param tenantId
     *            owning organization
     * @param scheduleId
     *            originating schedule
     * @param limit
     *            max jobs to return
     * @return jobs, newest first
     */
    @Transactional
    public List<DelayedJob> findRecentForSchedule(String tenantId, UUID scheduleId, int limit) {
        return DelayedJob.findRecentForSchedule(tenantId, scheduleId, limit);
    }

    private static UUID scheduleIdOf(JobDispatchRequest request) {
        Object raw = request.metadata().get(JobDispatchRequest.META_SCHEDULE_ID);
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw.toString());
        } catch (IllegalArgumentException e) {
            LOG.debugf("Ignoring non-UUID scheduleId metadata: %s", raw);
            return null;
        }
    }
}
