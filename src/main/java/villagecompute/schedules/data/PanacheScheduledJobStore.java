package villagecompute.schedules.data;

import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.scheduling.FailurePolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Hibernate ORM Panache implementation of {@link ScheduledJobStore}.
 *
 * <p>
 * Every method runs in its own transaction so the engine's per-schedule writes commit independently: a failing
 * accounting write for one schedule never rolls back the others in the batch.
 */
@ApplicationScoped
public class PanacheScheduledJobStore implements ScheduledJobStore {

    private static final Logger LOG = Logger.getLogger(PanacheScheduledJobStore.class);

    @Inject
    Clock clock;

    @Override
    @Transactional
    public ScheduledJobPage list(String organizationId, ScheduleListQuery query) {
        StringBuilder where = new StringBuilder("organizationId = :organizationId AND deletedAt IS NULL");
        Parameters params = Parameters.with("organizationId", organizationId);

        if (query.jobType() != null && !query.jobType().isBlank()) {
            where.append(" AND jobType = :jobType");
            params.and("jobType", query.jobType());
        }
        if (query.frequency() != null) {
            where.append(" AND frequency = :frequency");
            params.and("frequency", query.frequency());
        }
        if (query.deliveryMethod() != null) {
            where.append(" AND deliveryMethod = :deliveryMethod");
            params.and("deliveryMethod", query.deliveryMethod());
        }
        if (query.isActive() != null) {
            where.append(" AND isActive = :isActive");
            params.and("isActive", query.isActive());
        }
        if (query.hasSearch()) {
            where.append(" AND LOWER(name) LIKE :search");
            params.and("search", "%" + query.search().trim().toLowerCase(Locale.ROOT) + "%");
        }

        int page = query.resolvedPage();
        int pageSize = query.resolvedPageSize();
        Sort sort = Sort.ascending(query.resolvedOrderBy()).and("id");

        PanacheQuery<ScheduledJob> panacheQuery = ScheduledJob.find(where.toString(), sort, params);
        long totalCount = panacheQuery.count();
        List<ScheduledJob> data = panacheQuery.page(Page.of(page - 1, pageSize)).list();
        return new ScheduledJobPage(data, page, pageSize, totalCount);
    }

    @Override
    @Transactional
    public Optional<ScheduledJob> findById(String organizationId, UUID id) {
        return ScheduledJob.findLive(organizationId, id);
    }

    @Override
    @Transactional
    public ScheduledJob create(ScheduledJob schedule) {
        Instant now = clock.instant();
        schedule.id = UUID.randomUUID();
        schedule.createdAt = now;
        schedule.updatedAt = now;
        schedule.deletedAt = null;
        schedule.persist();
        LOG.infof("Created schedule %s (org: %s, type: %s, frequency: %s, nextRunAt: %s)", schedule.id,
                schedule.organizationId, schedule.jobType, schedule.frequency, schedule.nextRunAt);
        return schedule;
    }

    @Override
    @Transactional
    public Optional<ScheduledJob> update(String organizationId, UUID id, ScheduledJobPatch patch) {
        Optional<ScheduledJob> existing = ScheduledJob.findLive(organizationId, id);
        existing.ifPresent(schedule -> patch.applyTo(schedule, clock.instant()));
        return existing;
    }

    @Override
    @Transactional
    public boolean softDelete(String organizationId, UUID id) {
        Optional<ScheduledJob> existing = ScheduledJob.findLive(organizationId, id);
        if (existing.isEmpty()) {
            return false;
        }
        ScheduledJob schedule = existing.get();
        Instant now = clock.instant();
        schedule.deletedAt = now;
        schedule.updatedAt = now;
        LOG.infof("Soft-deleted schedule %s (org: %s)", id, organizationId);
        return true;
    }

    @Override
    @Transactional
    public List<ScheduledJob> findDueBatch(Instant now, int maxFailureCount, int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }
        return ScheduledJob.findDue(now, maxFailureCount, batchSize);
    }

    @Override
    @Transactional
    public boolean claim(UUID id, String workerId, Instant observedNextRunAt, Instant now, Instant leaseUntil) {
        if (observedNextRunAt == null) {
            return false;
        }
        return ScheduledJob.claim(id, workerId, observedNextRunAt, now, leaseUntil);
    }

    @Override
    @Transactional
    public void recordSuccess(UUID id, Instant ranAt, String jobId, Instant nextRunAt) {
        ScheduledJob schedule = ScheduledJob.findById(id);
        if (schedule == null) {
            LOG.warnf("Schedule %s disappeared before its success could be recorded", id);
            return;
        }
        schedule.lastRunAt = ranAt;
        schedule.lastJobId = jobId;
        schedule.nextRunAt = nextRunAt;
        schedule.failureCount = 0;
        schedule.claimedUntil = null;
        schedule.claimedBy = null;
        schedule.updatedAt = clock.instant();
    }

    @Override
    @Transactional
    public int recordFailure(UUID id, Instant failedAt, FailurePolicy policy) {
        ScheduledJob schedule = ScheduledJob.findById(id);
        if (schedule == null) {
            LOG.warnf("Schedule %s disappeared before its failure could be recorded", id);
            return -1;
        }
        FailurePolicy.Outcome outcome = policy.onFailure(schedule.failureCount);
        schedule.failureCount = outcome.failureCount();
        if (outcome.deactivate()) {
            schedule.isActive = false;
        }
        schedule.claimedUntil = null;
        schedule.claimedBy = null;
        schedule.updatedAt = failedAt;
        return outcome.failureCount();
    }

    @Override
    @Transactional
    public void recordManualRun(UUID id, Instant ranAt, String jobId) {
        ScheduledJob schedule = ScheduledJob.findById(id);
        if (schedule == null) {
            LOG.warnf("Schedule %s disappeared before its manual run could be recorded", id);
            return;
        }
        schedule.lastRunAt = ranAt;
        schedule.lastJobId = jobId;
        schedule.updatedAt = clock.instant();
    }
}
