package villagecompute.schedules.data;

import villagecompute.schedules.data.models.ScheduledJob;

import java.util.List;

/**
 * One page of a schedule listing plus the metadata needed to render pagination.
 *
 * @param data
 *            schedules on this page
 * @param page
 *            1-based page number
 * @param pageSize
 *            requested page size
 * @param totalCount
 *            matching rows across all pages
 */
public record ScheduledJobPage(List<ScheduledJob> data, int page, int pageSize, long totalCount) {

    public int totalPages() {
        return (int) ((totalCount + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return (long) page * pageSize < totalCount;
    }

    public boolean hasPrevious() {
        return page > 1;
    }
}
