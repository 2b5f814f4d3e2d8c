package villagecompute.schedules.jobs;

/**
 * Result of a successful dispatch.
 *
 * @param id
 *            id of the created job, stored on the schedule as {@code lastJobId}
 */
public record DispatchedJob(String id) {
}
