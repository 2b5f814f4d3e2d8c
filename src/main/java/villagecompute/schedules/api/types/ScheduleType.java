package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * API response type for a schedule.
 *
 * <p>
 * Exposes definition and run state. Lease columns are internal to the engine and never leave the service.
 *
 * @param id
 *            schedule id
 * @param organizationId
 *            owning tenant
 * @param name
 *            display name
 * @param description
 *            optional description
 * @param jobType
 *            job type dispatched on every run
 * @param jobConfig
 *            job input dispatched on every run
 * @param frequency
 *            once, daily, weekly, monthly or custom
 * @param cronExpression
 *            cron for custom schedules
 * @param dayOfWeek
 *            weekday for weekly schedules (lower-case English name)
 * @param dayOfMonth
 *            day for monthly schedules
 * @param hour
 *            hour of day
 * @param minute
 *            minute of hour
 * @param timezone
 *            zone id the wall-clock fields are read in
 * @param startDate
 *            window start
 * @param endDate
 *            window end
 * @param deliveryMethod
 *            how job output is delivered
 * @param deliveryConfig
 *            delivery settings
 * @param isActive
 *            whether the engine may dispatch the schedule
 * @param lastRunAt
 *            last dispatch time
 * @param lastJobId
 *            last dispatched job
 * @param nextRunAt
 *            next due time, null when the schedule will not run again
 * @param failureCount
 *            consecutive failed dispatches
 * @param createdBy
 *            creating user
 * @param createdAt
 *            creation timestamp
 * @param updatedAt
 *            last modification timestamp
 */
@Schema(
        description = "Recurring job definition with its run state")
public record ScheduleType(@Schema(
        description = "Schedule identifier",
        required = true) UUID id,

        @Schema(
                description = "Owning organization",
                example = "org_acme",
                required = true) @JsonProperty("organization_id") String organizationId,

        @Schema(
                description = "Display name",
                example = "Nightly revenue report",
                required = true) String name,

        @Schema(
                description = "Optional description",
                nullable = true) String description,

        @Schema(
                description = "Job type dispatched on every run",
                example = "report",
                required = true) @JsonProperty("job_type") String jobType,

        @Schema(
                description = "Job input dispatched on every run",
                nullable = true) @JsonProperty("job_config") Map<String, Object> jobConfig,

        @Schema(
                description = "Recurrence shape",
                example = "daily",
                required = true) String frequency,

        @Schema(
                description = "5-field cron expression (custom only)",
                example = "*/15 * * * *",
                nullable = true) @JsonProperty("cron_expression") String cronExpression,

        @Schema(
                description = "Weekday for weekly schedules",
                example = "monday",
                nullable = true) @JsonProperty("day_of_week") String dayOfWeek,

        @Schema(
                description = "Day of month for monthly schedules (clamped to 28)",
                example = "15",
                nullable = true) @JsonProperty("day_of_month") Integer dayOfMonth,

        @Schema(
                description = "Hour of day",
                example = "9",
                nullable = true) Integer hour,

        @Schema(
                description = "Minute of hour",
                example = "0",
                nullable = true) Integer minute,

        @Schema(
                description = "IANA zone id",
                example = "America/New_York",
                required = true) String timezone,

        @Schema(
                description = "No run happens before this instant",
                required = true) @JsonProperty("start_date") Instant startDate,

        @Schema(
                description = "No run happens at or after this instant",
                nullable = true) @JsonProperty("end_date") Instant endDate,

        @Schema(
                description = "Delivery method for job output",
                example = "email",
                required = true) @JsonProperty("delivery_method") String deliveryMethod,

        @Schema(
                description = "Delivery settings",
                nullable = true) @JsonProperty("delivery_config") Map<String, Object> deliveryConfig,

        @Schema(
                description = "Whether the scheduler may dispatch this schedule",
                required = true) @JsonProperty("is_active") boolean isActive,

        @Schema(
                description = "Last dispatch time",
                nullable = true) @JsonProperty("last_run_at") Instant lastRunAt,

        @Schema(
                description = "Last dispatched job id",
                nullable = true) @JsonProperty("last_job_id") String lastJobId,

        @Schema(
                description = "Next due time; null when the schedule will not run again",
                nullable = true) @JsonProperty("next_run_at") Instant nextRunAt,

        @Schema(
                description = "Consecutive failed dispatches; the schedule disables itself at 5",
                required = true) @JsonProperty("failure_count") int failureCount,

        @Schema(
                description = "Creating user",
                required = true) @JsonProperty("created_by") String createdBy,

        @Schema(
                description = "Creation timestamp",
                required = true) @JsonProperty("created_at") Instant createdAt,

        @Schema(
                description = "Last modification timestamp",
                required = true) @JsonProperty("updated_at") Instant updatedAt) {
}
