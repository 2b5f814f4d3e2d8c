package villagecompute.schedules.data;

import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.scheduling.ScheduleFrequency;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Map;

/**
 * Partial update for a {@link ScheduledJob}.
 *
 * <p>
 * A {@code null} field means "leave unchanged". {@code nextRunAt} is the exception: it may legitimately be cleared, so
 * it carries an explicit presence flag set by {@link #nextRunAt(Instant)}.
 */
public class ScheduledJobPatch {

    private String jobType;
    private Map<String, Object> jobConfig;
    private String name;
    private String description;
    private ScheduleFrequency frequency;
    private String cronExpression;
    private DayOfWeek dayOfWeek;
    private Integer dayOfMonth;
    private Integer hour;
    private Integer minute;
    private String timezone;
    private Instant startDate;
    private Instant endDate;
    private ScheduledJob.DeliveryMethod deliveryMethod;
    private Map<String, Object> deliveryConfig;
    private Boolean isActive;
    private Instant lastRunAt;
    private String lastJobId;
    private Integer failureCount;
    private Instant nextRunAt;
    private boolean nextRunAtPresent;

    public ScheduledJobPatch jobType(String jobType) {
        this.jobType = jobType;
        return this;
    }

    public ScheduledJobPatch jobConfig(Map<String, Object> jobConfig) {
        this.jobConfig = jobConfig;
        return this;
    }

    public ScheduledJobPatch name(String name) {
        this.name = name;
        return this;
    }

    public ScheduledJobPatch description(String description) {
        this.description = description;
        return this;
    }

    public ScheduledJobPatch frequency(ScheduleFrequency frequency) {
        this.frequency = frequency;
        return this;
    }

    public ScheduledJobPatch cronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
        return this;
    }

    public ScheduledJobPatch dayOfWeek(DayOfWeek dayOfWeek) {
        this.dayOfWeek = dayOfWeek;
        return this;
    }

    public ScheduledJobPatch dayOfMonth(Integer dayOfMonth) {
        this.dayOfMonth = dayOfMonth;
        return this;
    }

    public ScheduledJobPatch hour(Integer hour) {
        this.hour = hour;
        return this;
    }

    public ScheduledJobPatch minute(Integer minute) {
        this.minute = minute;
        return this;
    }

    public ScheduledJobPatch timezone(String timezone) {
        this.timezone = timezone;
        return this;
    }

    public ScheduledJobPatch startDate(Instant startDate) {
        this.startDate = startDate;
        return this;
    }

    public ScheduledJobPatch endDate(Instant endDate) {
        this.endDate = endDate;
        return this;
    }

    public ScheduledJobPatch deliveryMethod(ScheduledJob.DeliveryMethod deliveryMethod) {
        this.deliveryMethod = deliveryMethod;
        return this;
    }

    public ScheduledJobPatch deliveryConfig(Map<String, Object> deliveryConfig) {
        this.deliveryConfig = deliveryConfig;
        return this;
    }

    public ScheduledJobPatch isActive(Boolean isActive) {
        this.isActive = isActive;
        return this;
    }

    public ScheduledJobPatch lastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
        return this;
    }

    public ScheduledJobPatch lastJobId(String lastJobId) {
        this.lastJobId = lastJobId;
        return this;
    }

    public ScheduledJobPatch failureCount(Integer failureCount) {
        this.failureCount = failureCount;
        return this;
    }

    /**
     * Sets {@code nextRunAt}, including to {@code null}.
     */
    public ScheduledJobPatch nextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
        this.nextRunAtPresent = true;
        return this;
    }

    public ScheduleFrequency getFrequency() {
        return frequency;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public Integer getDayOfMonth() {
        return dayOfMonth;
    }

    public Integer getHour() {
        return hour;
    }

    public Integer getMinute() {
        return minute;
    }

    public String getTimezone() {
        return timezone;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public boolean hasNextRunAt() {
        return nextRunAtPresent;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    /**
     * Returns whether the patch touches one of the fields that define when the schedule recurs.
     */
    public boolean changesRecurrence() {
        return frequency != null || hour != null || minute != null || dayOfWeek != null || dayOfMonth != null
                || cronExpression != null || timezone != null || startDate != null || endDate != null;
    }

    /**
     * Copies every present field onto the schedule and stamps {@code updatedAt}.
     *
     * @param schedule
     *            target schedule
     * @param now
     *            update timestamp
     */
    public void applyTo(ScheduledJob schedule, Instant now) {
        if (jobType != null) {
            schedule.jobType = jobType;
        }
        if (jobConfig != null) {
            schedule.jobConfig = jobConfig;
        }
        if (name != null) {
            schedule.name = name;
        }
        if (description != null) {
            schedule.description = description;
        }
        if (frequency != null) {
            schedule.frequency = frequency;
        }
        if (cronExpression != null) {
            schedule.cronExpression = cronExpression;
        }
        if (dayOfWeek != null) {
            schedule.dayOfWeek = dayOfWeek;
        }
        if (dayOfMonth != null) {
            schedule.dayOfMonth = dayOfMonth;
        }
        if (hour != null) {
            schedule.hour = hour;
        }
        if (minute != null) {
            schedule.minute = minute;
        }
        if (timezone != null) {
            schedule.timezone = timezone;
        }
        if (startDate != null) {
            schedule.startDate = startDate;
        }
        if (endDate != null) {
            schedule.endDate = endDate;
        }
        if (deliveryMethod != null) {
            schedule.deliveryMethod = deliveryMethod;
        }
        if (deliveryConfig != null) {
            schedule.deliveryConfig = deliveryConfig;
        }
        if (isActive != null) {
            schedule.isActive = isActive;
        }
        if (lastRunAt != null) {
            schedule.lastRunAt = lastRunAt;
        }
        if (lastJobId != null) {
            schedule.lastJobId = lastJobId;
        }
        if (failureCount != null) {
            schedule.failureCount = failureCount;
        }
        if (nextRunAtPresent) {
            schedule.nextRunAt = nextRunAt;
        }
        schedule.updatedAt = now;
    }
}
