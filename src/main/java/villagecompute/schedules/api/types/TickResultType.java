package villagecompute.schedules.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API response type for a synchronous engine tick.
 */
@Schema(
        description = "Counts from one scheduler batch")
public record TickResultType(int processed, int succeeded, int failed) {
}
