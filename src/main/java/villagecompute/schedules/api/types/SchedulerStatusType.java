package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API response type for the scheduler engine state.
 *
 * @param running
 *            whether the background loop is active
 * @param intervalMs
 *            time between ticks
 * @param batchSize
 *            max schedules per tick
 * @param autostart
 *            whether the loop starts at boot
 */
@Schema(
        description = "Scheduler engine state")
public record SchedulerStatusType(boolean running, @JsonProperty("interval_ms") long intervalMs,
        @JsonProperty("batch_size") int batchSize, boolean autostart) {
}
