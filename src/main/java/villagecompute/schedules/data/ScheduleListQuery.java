package villagecompute.schedules.data;

import villagecompute.schedules.data.models.ScheduledJob;
import villagecompute.schedules.scheduling.ScheduleFrequency;

import java.util.Map;

/**
 * Filters, paging and ordering for a schedule listing.
 *
 * <p>
 * Ordering is limited to an allow-list of sortable fields; any other value sorts by {@code createdAt}. Page numbers are
 * 1-based.
 *
 * @param page
 *            1-based page number, {@code null} or below 1 means 1
 * @param pageSize
 *            rows per page, {@code null} or below 1 means {@value #DEFAULT_PAGE_SIZE}
 * @param jobType
 *            exact job type filter
 * @param frequency
 *            frequency filter
 * @param deliveryMethod
 *            delivery method filter
 * @param isActive
 *            active flag filter
 * @param search
 *            case-insensitive substring match on name
 * @param orderBy
 *            one of {@code name}, {@code nextRunAt}, {@code frequency}, {@code createdAt}
 */
public record ScheduleListQuery(Integer page, Integer pageSize, String jobType, ScheduleFrequency frequency,
        ScheduledJob.DeliveryMethod deliveryMethod, Boolean isActive, String search, String orderBy) {

    public static final int DEFAULT_PAGE_SIZE = 50;

    public static final int MAX_PAGE_SIZE = 200;

    private static final String DEFAULT_ORDER_BY = "createdAt";

    private static final Map<String, String> SORTABLE_FIELDS = Map.of("name", "name", "nextRunAt", "nextRunAt",
            "frequency", "frequency", "createdAt", DEFAULT_ORDER_BY);

    /**
     * Returns an unfiltered first page.
     */
    public static ScheduleListQuery firstPage() {
        return new ScheduleListQuery(1, DEFAULT_PAGE_SIZE, null, null, null, null, null, null);
    }

    public int resolvedPage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int resolvedPageSize() {
        if (pageSize == null || pageSize < 1) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(pageSize, MAX_PAGE_SIZE);
    }

    /**
     * Maps the requested ordering onto an entity property, falling back to {@code createdAt}.
     */
    public String resolvedOrderBy() {
        if (orderBy == null) {
            return DEFAULT_ORDER_BY;
        }
        return SORTABLE_FIELDS.getOrDefault(orderBy, DEFAULT_ORDER_BY);
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }
}
