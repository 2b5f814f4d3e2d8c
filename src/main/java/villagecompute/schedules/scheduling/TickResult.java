package villagecompute.schedules.scheduling;

/**
 * Aggregated counts of one engine tick.
 *
 * @param processed
 *            schedules dispatched or attempted in this tick (succeeded + failed)
 * @param succeeded
 *            schedules whose job was dispatched
 * @param failed
 *            schedules whose dispatch failed
 */
public record TickResult(int processed, int succeeded, int failed) {

    public static final TickResult EMPTY = new TickResult(0, 0, 0);
}
