package villagecompute.schedules.scheduling;

/**
 * What happened to one due schedule during a tick.
 */
public enum RunOutcome {
    /**
     * Job dispatched and run state advanced.
     */
    SUCCEEDED,

    /**
     * Dispatch threw or timed out; the failure count was incremented.
     */
    FAILED,

    /**
     * Another engine instance holds the dispatch lease; nothing was done.
     */
    SKIPPED
}
