package villagecompute.schedules.scheduling;

/**
 * Failure accounting for scheduled dispatches.
 *
 * <p>
 * Failed dispatches are retried on every tick (the schedule's {@code nextRunAt} is left in the past) until the
 * consecutive failure count reaches the threshold, at which point the schedule deactivates itself. A success resets the
 * count to zero. The count never decreases otherwise.
 */
public final class FailurePolicy {

    /**
     * Consecutive failures after which a schedule is deactivated.
     */
    public static final int MAX_FAILURE_COUNT = 5;

    private static final FailurePolicy DEFAULT = new FailurePolicy(MAX_FAILURE_COUNT);

    private final int maxFailureCount;

    public FailurePolicy(int maxFailureCount) {
        if (maxFailureCount < 1) {
            throw new IllegalArgumentException("maxFailureCount must be positive: " + maxFailureCount);
        }
        this.maxFailureCount = maxFailureCount;
    }

    /**
     * Returns the policy with the standard threshold of {@value #MAX_FAILURE_COUNT}.
     */
    public static FailurePolicy standard() {
        return DEFAULT;
    }

    public int getMaxFailureCount() {
        return maxFailureCount;
    }

    /**
     * Computes the state after one more failure.
     *
     * @param currentFailureCount
     *            stored count before this failure
     * @return incremented count and whether the schedule must be deactivated
     */
    public Outcome onFailure(int currentFailureCount) {
        int next = Math.max(0, currentFailureCount) + 1;
        return new Outcome(next, next >= maxFailureCount);
    }

    /**
     * Returns whether a schedule with this failure count may still be dispatched.
     */
    public boolean isEligible(int failureCount) {
        return failureCount < maxFailureCount;
    }

    /**
     * Result of recording a failure.
     *
     * @param failureCount
     *            new failure count
     * @param deactivate
     *            whether {@code isActive} must be cleared in the same write
     */
    public record Outcome(int failureCount, boolean deactivate) {
    }
}
