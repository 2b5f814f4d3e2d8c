package villagecompute.schedules.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * API response type for a page of schedules.
 *
 * @param data
 *            schedules on this page
 * @param pagination
 *            paging metadata
 */
@Schema(
        description = "Page of schedules")
public record ScheduleListType(List<ScheduleType> data, PaginationType pagination) {

    /**
     * Paging metadata.
     */
    @Schema(
            description = "Pagination metadata")
    public record PaginationType(int page, @JsonProperty("page_size") int pageSize,
            @JsonProperty("total_count") long totalCount, @JsonProperty("total_pages") int totalPages,
            @JsonProperty("has_next") boolean hasNext, @JsonProperty("has_previous") boolean hasPrevious) {
    }
}
