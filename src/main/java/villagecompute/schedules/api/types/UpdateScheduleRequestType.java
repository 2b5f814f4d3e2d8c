package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * API request type for updating a schedule.
 *
 * <p>
 * All fields are optional to support partial updates via PATCH semantics. Null values indicate "no change" rather than
 * "set to null". Changing any recurrence field reschedules the next run from the time of the update.
 */
@Schema(
        description = "Request to update a schedule (partial update)")
public record UpdateScheduleRequestType(@Schema(
        nullable = true) String name,

        @Schema(
                nullable = true) String description,

        @Schema(
                nullable = true) @JsonProperty("job_type") String jobType,

        @Schema(
                nullable = true) @JsonProperty("job_config") Map<String, Object> jobConfig,

        @Schema(
                nullable = true) String frequency,

        @Schema(
                nullable = true) @JsonProperty("cron_expression") String cronExpression,

        @Schema(
                nullable = true) @JsonProperty("day_of_week") String dayOfWeek,

        @Schema(
                nullable = true) @JsonProperty("day_of_month") Integer dayOfMonth,

        @Schema(
                nullable = true) Integer hour,

        @Schema(
                nullable = true) Integer minute,

        @Schema(
                nullable = true) String timezone,

        @Schema(
                nullable = true) @JsonProperty("start_date") Instant startDate,

        @Schema(
                nullable = true) @JsonProperty("end_date") Instant endDate,

        @Schema(
                nullable = true) @JsonProperty("delivery_method") String deliveryMethod,

        @Schema(
                nullable = true) @JsonProperty("delivery_config") Map<String, Object> deliveryConfig,

        @Schema(
                description = "Activate or deactivate without recomputing the next run",
                nullable = true) @JsonProperty("is_active") Boolean isActive) {
}
