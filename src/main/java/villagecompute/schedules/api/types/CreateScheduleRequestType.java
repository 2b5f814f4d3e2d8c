package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * API request type for creating a schedule.
 *
 * <p>
 * Range and consistency checks (hour, minute, timezone, cron) happen in the service so they report a single
 * {@code error} message.
 */
@Schema(
        description = "Request to create a schedule")
public record CreateScheduleRequestType(@Schema(
        description = "Display name",
        example = "Nightly revenue report",
        required = true) @NotBlank String name,

        @Schema(
                description = "Optional description",
                nullable = true) String description,

        @Schema(
                description = "Job type dispatched on every run",
                example = "report",
                required = true) @JsonProperty("job_type") @NotBlank String jobType,

        @Schema(
                description = "Job input dispatched on every run",
                nullable = true) @JsonProperty("job_config") Map<String, Object> jobConfig,

        @Schema(
                description = "once, daily, weekly, monthly or custom",
                example = "daily",
                required = true) @NotBlank String frequency,

        @Schema(
                description = "5-field cron expression, required for custom",
                nullable = true) @JsonProperty("cron_expression") String cronExpression,

        @Schema(
                description = "Weekday name for weekly schedules",
                example = "monday",
                nullable = true) @JsonProperty("day_of_week") String dayOfWeek,

        @Schema(
                description = "Day of month (1-31) for monthly schedules",
                nullable = true) @JsonProperty("day_of_month") Integer dayOfMonth,

        @Schema(
                description = "Hour of day (0-23)",
                nullable = true) Integer hour,

        @Schema(
                description = "Minute of hour (0-59)",
                nullable = true) Integer minute,

        @Schema(
                description = "IANA zone id, defaults to UTC",
                nullable = true) String timezone,

        @Schema(
                description = "Window start, defaults to now",
                nullable = true) @JsonProperty("start_date") Instant startDate,

        @Schema(
                description = "Window end",
                nullable = true) @JsonProperty("end_date") Instant endDate,

        @Schema(
                description = "none, email, download, webhook or storage; defaults to none",
                nullable = true) @JsonProperty("delivery_method") String deliveryMethod,

        @Schema(
                description = "Delivery settings",
                nullable = true) @JsonProperty("delivery_config") Map<String, Object> deliveryConfig) {
}
