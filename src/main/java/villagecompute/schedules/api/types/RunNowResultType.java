package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.UUID;

/**
 * API response type for a manual run.
 *
 * @param scheduleId
 *            schedule that was run
 * @param jobId
 *            dispatched job
 */
@Schema(
        description = "Job dispatched by a manual run")
public record RunNowResultType(@JsonProperty("schedule_id") UUID scheduleId, @JsonProperty("job_id") String jobId) {
}
