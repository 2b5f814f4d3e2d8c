package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * API response type for the recent runs of a schedule.
 *
 * @param scheduleId
 *            schedule id
 * @param jobs
 *            dispatched jobs, newest first
 */
@Schema(
        description = "Recent jobs dispatched for a schedule")
public record ScheduleHistoryType(@JsonProperty("schedule_id") UUID scheduleId, List<JobRunType> jobs) {

    /**
     * One dispatched job.
     *
     * @param jobId
     *            job id
     * @param status
     *            job status as reported by the job subsystem
     * @param triggeredBy
     *            {@code scheduler} or {@code manual}
     * @param createdAt
     *            dispatch time
     * @param completedAt
     *            completion time, if finished
     * @param success
     *            whether the job completed
     * @param error
     *            last error, if failed
     */
    public record JobRunType(@JsonProperty("job_id") String jobId, String status,
            @JsonProperty("triggered_by") String triggeredBy, @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("completed_at") Instant completedAt, boolean success, String error) {
    }
}
