package villagecompute.schedules.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for enriching logs with scheduling context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code tenant_id} - Organization owning the schedule being handled</li>
 * <li>{@code schedule_id} - Schedule primary key</li>
 * <li>{@code job_id} - Dispatched job id (set once dispatch returns)</li>
 * <li>{@code request_origin} - HTTP request path or {@code scheduler} for engine ticks</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the engine:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setScheduleContext(schedule.organizationId, schedule.id);
 * LoggingConfig.setRequestOrigin("scheduler");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * All methods operate on {@link MDC}, which is thread-local. Callers clear it when their unit of work ends.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_TENANT_ID = "tenant_id";

    public static final String MDC_SCHEDULE_ID = "schedule_id";

    public static final String MDC_JOB_ID = "job_id";

    /**
     * HTTP request path (e.g., "/api/orgs/acme/schedules") or {@code scheduler} for background ticks.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings are written when no span
     * is active so the JSON log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets tenant and schedule identifiers.
     *
     * @param tenantId
     *            owning organization
     * @param scheduleId
     *            schedule primary key
     */
    public static void setScheduleContext(String tenantId, Object scheduleId) {
        if (tenantId != null) {
            MDC.put(MDC_TENANT_ID, tenantId);
        }
        if (scheduleId != null) {
            MDC.put(MDC_SCHEDULE_ID, scheduleId.toString());
        }
    }

    public static void setJobId(String jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears the per-schedule fields while keeping the request-level ones, so a batch can reuse the thread's context.
     */
    public static void clearScheduleContext() {
        MDC.remove(MDC_TENANT_ID);
        MDC.remove(MDC_SCHEDULE_ID);
        MDC.remove(MDC_JOB_ID);
    }

    /**
     * Clears all observability-related MDC fields.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        clearScheduleContext();
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
