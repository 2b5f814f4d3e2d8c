package villagecompute.schedules.data;

import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.scheduling.FailurePolicy;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for scheduled jobs.
 *
 * <p>
 * Query construction only: no recurrence computation happens here. Every tenant-facing operation is scoped by
 * organization id and ignores soft-deleted rows. The engine operations ({@link #findDueBatch}, {@link #claim},
 * {@link #recordSuccess}, {@link #recordFailure}) work across tenants because the poller is a single global process.
 *
 * @see PanacheScheduledJobStore
 */
public interface ScheduledJobStore {

    /**
     * Lists live schedules of a tenant.
     *
     * @param organizationId
     *            tenant id
     * @param query
     *            filters, paging and ordering
     * @return requested page with total count
     */
    ScheduledJobPage list(String organizationId, ScheduleListQuery query);

    /**
     * Looks up a live schedule of a tenant.
     *
     * @return the schedule, empty when missing, soft-deleted or owned by another tenant
     */
    Optional<ScheduledJob> findById(String organizationId, UUID id);

    /**
     * Inserts a new schedule under a freshly generated id. The caller computes {@code nextRunAt} beforehand.
     *
     * @param schedule
     *            unsaved schedule
     * @return the stored schedule
     */
    ScheduledJob create(ScheduledJob schedule);

    /**
     * Applies a partial update to a live schedule of a tenant.
     *
     * @return the updated schedule, empty when not found
     */
    Optional<ScheduledJob> update(String organizationId, UUID id, ScheduledJobPatch patch);

    /**
     * Sets {@code deletedAt} on a live schedule of a tenant.
     *
     * @return {@code true} if a row was affected
     */
    boolean softDelete(String organizationId, UUID id);

    /**
     * Returns up to {@code batchSize} schedules eligible for dispatch at {@code now}, oldest due first.
     *
     * <p>
     * Eligible means active, not soft-deleted, {@code nextRunAt <= now}, {@code failureCount} below
     * {@code maxFailureCount}, and no live dispatch lease.
     *
     * @param maxFailureCount
     *            threshold of the failure policy in use, see {@link FailurePolicy#getMaxFailureCount()}
     */
    List<ScheduledJob> findDueBatch(Instant now, int maxFailureCount, int batchSize);

    /**
     * Takes the dispatch lease on a schedule unless another worker holds one that has not expired, or the row has
     * moved on since it was read: deactivated, deleted, or {@code nextRunAt} no longer equal to the value the caller
     * observed.
     *
     * @param id
     *            schedule id
     * @param workerId
     *            identifier of the claiming engine instance
     * @param observedNextRunAt
     *            {@code nextRunAt} as read by the due batch
     * @param now
     *            current instant, leases ending at or before it are expired
     * @param leaseUntil
     *            lease expiry
     * @return {@code true} if the caller now holds the lease
     */
    boolean claim(UUID id, String workerId, Instant observedNextRunAt, Instant now, Instant leaseUntil);

    /**
     * Records a successful dispatch: run time, job id, next run, failure count reset to 0, lease released.
     */
    void recordSuccess(UUID id, Instant ranAt, String jobId, Instant nextRunAt);

    /**
     * Records a failed dispatch by applying the failure policy to the stored failure count. Leaves {@code nextRunAt}
     * untouched and releases the lease.
     *
     * @return the new failure count, or {@code -1} if the schedule no longer exists
     */
    int recordFailure(UUID id, Instant failedAt, FailurePolicy policy);

    /**
     * Records an out-of-band run started by a user. Only {@code lastRunAt} and {@code lastJobId} change; the failure
     * count, the next run and any lease are left alone.
     */
    void recordManualRun(UUID id, Instant ranAt, String jobId);
}
