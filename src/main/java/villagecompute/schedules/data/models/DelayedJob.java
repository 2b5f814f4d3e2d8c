package villagecompute.schedules.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
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
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Panache entity for a job handed to the asynchronous job subsystem.
 *
 * <p>
 * Schedules dispatch into this table; workers that execute the rows live outside this service. The schedule id is
 * copied out of {@code metadata} into its own indexed column so run history can be listed without JSON queries.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code tenant_id} (TEXT) - Owning organization</li>
 * <li>{@code job_type} (TEXT) - Opaque job type copied from the schedule</li>
 * <li>{@code input} (JSONB) - Job parameters copied from the schedule's job configuration</li>
 * <li>{@code metadata} (JSONB) - Provenance (scheduleId, triggeredBy, scheduledTime)</li>
 * <li>{@code schedule_id} (UUID) - Originating schedule, null for ad-hoc jobs</li>
 * <li>{@code status} (TEXT) - PENDING, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code completed_at} / {@code failed_at} / {@code last_error} - Written by workers</li>
 * <li>{@code created_by}, {@code created_at}, {@code updated_at} - Audit</li>
 * </ul>
 *
 * @see villagecompute.schedules.services.DelayedJobService for job creation
 */
@Entity
@Table(
        name = "delayed_jobs",
        indexes = {@Index(
                name = "delayed_jobs_schedule_id_idx",
                columnList = "tenant_id, schedule_id")})
public class DelayedJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(DelayedJob.class);

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "tenant_id",
            nullable = false)
    public String tenantId;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "input")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> input;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "schedule_id")
    public UUID scheduleId;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "failed_at")
    public Instant failedAt;

    @Column(
            name = "last_error")
    public String lastError;

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

    /**
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        /**
         * Job created, awaiting execution.
         */
        PENDING,

        /**
         * Job actively executing by a worker.
         */
        PROCESSING,

        /**
         * Job completed successfully.
         */
        COMPLETED,

        /**
         * Job failed after exhausting retries.
         */
        FAILED
    }

    /**
     * Finds the most recent jobs dispatched for a schedule within a tenant.
     *
     * @param tenantId
     *            owning organization
     * @param scheduleId
     *            originating schedule
     * @param limit
     *            max jobs to return
     * @return jobs ordered by created_at DESC
     */
    public static List<DelayedJob> findRecentForSchedule(String tenantId, UUID scheduleId, int limit) {
        if (tenantId == null || scheduleId == null || limit <= 0) {
            return List.of();
        }
        Sort newestFirst = Sort.descending("createdAt").and("id", Sort.Direction.Descending);
        return find("tenantId = ?1 AND scheduleId = ?2", newestFirst, tenantId, scheduleId).page(0, limit).list();
    }

    /**
     * Creates and persists a new pending job.
     *
     * @param tenantId
     *            owning organization
     * @param jobType
     *            opaque job type
     * @param createdBy
     *            creating user
     * @param input
     *            job parameters (serialized as JSONB)
     * @param metadata
     *            provenance (serialized as JSONB)
     * @param scheduleId
     *            originating schedule, may be null
     * @param now
     *            creation timestamp
     * @return persisted DelayedJob entity
     */
    public static DelayedJob create(String tenantId, String jobType, String createdBy, Map<String, Object> input,
            Map<String, Object> metadata, UUID scheduleId, Instant now) {
        DelayedJob job = new DelayedJob();
        job.id = UUID.randomUUID();
        job.tenantId = tenantId;
        job.jobType = jobType;
        job.createdBy = createdBy;
        job.input = input;
        job.metadata = metadata;
        job.scheduleId = scheduleId;
        job.status = JobStatus.PENDING;
        job.createdAt = now;
        job.updatedAt = now;

        job.persist();
        LOG.infof("Created job %s (type: %s, tenant: %s, schedule: %s)", job.id, jobType, tenantId, scheduleId);
        return job;
    }
}
