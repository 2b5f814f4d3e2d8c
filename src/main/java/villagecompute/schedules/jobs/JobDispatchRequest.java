package villagecompute.schedules.jobs;

import java.util.Map;

/**
 * Input of a single dispatch.
 *
 * @param tenantId
 *            organization the job belongs to
 * @param type
 *            opaque job type, passed through from the schedule
 * @param createdBy
 *            user recorded as the job's creator
 * @param input
 *            opaque job configuration, passed through from the schedule
 * @param metadata
 *            provenance: {@code scheduleId}, {@code triggeredBy} and, for engine runs, {@code scheduledTime}
 */
public record JobDispatchRequest(String tenantId, String type, String createdBy, Map<String, Object> input,
        Map<String, Object> metadata) {

    public static final String META_SCHEDULE_ID = "scheduleId";

    public static final String META_TRIGGERED_BY = "triggeredBy";

    public static final String META_SCHEDULED_TIME = "scheduledTime";

    public static final String TRIGGERED_BY_SCHEDULER = "scheduler";

    public static final String TRIGGERED_BY_MANUAL = "manual";

    public JobDispatchRequest {
        input = input == null ? Map.of() : input;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
