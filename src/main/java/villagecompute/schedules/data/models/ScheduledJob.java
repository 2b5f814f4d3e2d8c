package villagecompute.schedules.data.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.schedules.scheduling.ScheduleFrequency;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for a tenant-scoped recurring job definition.
 *
 * <p>
 * The scheduler engine polls this table for due rows, dispatches a job per row and writes back the run state. Rows are
 * never hard-deleted; {@code deleted_at} hides them from listings and from the poller.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier, assigned on create</li>
 * <li>{@code organization_id} (TEXT) - Owning tenant</li>
 * <li>{@code job_type} (TEXT) - Opaque job type passed through to dispatch</li>
 * <li>{@code job_config} (JSONB) - Opaque job input passed through to dispatch</li>
 * <li>{@code frequency} (TEXT) - ONCE, DAILY, WEEKLY, MONTHLY, CUSTOM</li>
 * <li>{@code cron_expression}, {@code day_of_week}, {@code day_of_month}, {@code run_hour}, {@code run_minute} -
 * recurrence fields, meaning depends on frequency</li>
 * <li>{@code timezone} (TEXT) - Zone id the wall-clock fields are read in</li>
 * <li>{@code start_date} / {@code end_date} (TIMESTAMPTZ) - Execution window</li>
 * <li>{@code delivery_method} (TEXT) / {@code delivery_config} (JSONB) - Consumed downstream, not by the engine</li>
 * <li>{@code is_active}, {@code last_run_at}, {@code last_job_id}, {@code next_run_at}, {@code failure_count} - run
 * state</li>
 * <li>{@code claimed_until} / {@code claimed_by} - Dispatch lease held by an engine instance</li>
 * <li>{@code created_by}, {@code created_at}, {@code updated_at}, {@code deleted_at} - audit and soft delete</li>
 * </ul>
 *
 * @see villagecompute.schedules.data.PanacheScheduledJobStore
 */
@Entity
@Table(
        name = "scheduled_jobs",
        indexes = {@Index(
                name = "scheduled_jobs_organization_id_idx",
                columnList = "organization_id"),
                @Index(
                        name = "scheduled_jobs_next_run_at_idx",
                        columnList = "next_run_at"),
                @Index(
                        name = "scheduled_jobs_deleted_at_idx",
                        columnList = "deleted_at")})
public class ScheduledJob extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "organization_id",
            nullable = false)
    public String organizationId;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "job_config")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> jobConfig;

    @Column(
            nullable = false)
    public String name;

    @Column
    public String description;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleFrequency frequency;

    @Column(
            name = "cron_expression")
    public String cronExpression;

    @Column(
            name = "day_of_week")
    @Enumerated(EnumType.STRING)
    public DayOfWeek dayOfWeek;

    @Column(
            name = "day_of_month")
    public Integer dayOfMonth;

    @Column(
            name = "run_hour")
    public Integer hour;

    @Column(
            name = "run_minute")
    public Integer minute;

    @Column(
            nullable = false)
    public String timezone = "UTC";

    @Column(
            name = "start_date",
            nullable = false)
    public Instant startDate;

    @Column(
            name = "end_date")
    public Instant endDate;

    @Column(
            name = "delivery_method",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public DeliveryMethod deliveryMethod = DeliveryMethod.NONE;

    @Column(
            name = "delivery_config")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> deliveryConfig;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "last_job_id")
    public String lastJobId;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "failure_count",
            nullable = false)
    public int failureCount;

    @Column(
            name = "claimed_until")
    public Instant claimedUntil;

    @Column(
            name = "claimed_by")
    public String claimedBy;

    @Column(
            name = "created_by",
            nullable = false)
    public String createdBy;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "deleted_at")
    public Instant deletedAt;

    /**
     * How the output of a dispatched job reaches its recipients. Only stored and passed along by this service.
     */
    public enum DeliveryMethod {
        NONE, EMAIL, DOWNLOAD, WEBHOOK, STORAGE;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Parses a wire value case-insensitively, returning {@code null} for blank or unknown values.
         */
        @JsonCreator
        public static DeliveryMethod fromValue(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            for (DeliveryMethod method : values()) {
                if (method.name().equalsIgnoreCase(value.trim())) {
                    return method;
                }
            }
            return null;
        }
    }

    /**
     * Finds a live (not soft-deleted) schedule within a tenant.
     *
     * @param organizationId
     *            tenant id
     * @param id
     *            schedule id
     * @return the schedule, empty when missing, deleted or owned by another tenant
     */
    public static Optional<ScheduledJob> findLive(String organizationId, UUID id) {
        if (organizationId == null || id == null) {
            return Optional.empty();
        }
        return find("id = ?1 AND organizationId = ?2 AND deletedAt IS NULL", id, organizationId).firstResultOptional();
    }

    /**
     * Finds schedules eligible for dispatch across all tenants, oldest due first.
     *
     * <p>
     * <b>Eligibility:</b> active, not soft-deleted, {@code next_run_at <= now}, {@code failure_count} below the
     * threshold, and no live dispatch lease.
     *
     * @param now
     *            reference instant
     * @param maxFailureCount
     *            failure threshold
     * @param limit
     *            max rows
     * @return due schedules ordered by {@code next_run_at} ascending
     */
    public static List<ScheduledJob> findDue(Instant now, int maxFailureCount, int limit) {
        return find("isActive = true AND deletedAt IS NULL AND nextRunAt IS NOT NULL AND nextRunAt <= :now "
                + "AND failureCount < :maxFailures AND (claimedUntil IS NULL OR claimedUntil <= :now)",
                Sort.ascending("nextRunAt").and("id"),
                Parameters.with("now", now).and("maxFailures", maxFailureCount)).page(0, limit).list();
    }

    /**
     * Takes the dispatch lease on a schedule if no other engine instance holds a live one and the row is still the
     * one the caller read: active, not deleted, and due at {@code observedNextRunAt}. A row another instance has
     * already dispatched and advanced is left alone.
     *
     * @return {@code true} if this caller now holds the lease
     */
    public static boolean claim(UUID id, String workerId, Instant observedNextRunAt, Instant now, Instant leaseUntil) {
        int updated = update("claimedUntil = :leaseUntil, claimedBy = :workerId WHERE id = :id "
                + "AND isActive = true AND deletedAt IS NULL AND nextRunAt = :observedNextRunAt "
                + "AND (claimedUntil IS NULL OR claimedUntil <= :now)",
                Parameters.with("leaseUntil", leaseUntil).and("workerId", workerId).and("id", id)
                        .and("observedNextRunAt", observedNextRunAt).and("now", now));
        return updated > 0;
    }
}
