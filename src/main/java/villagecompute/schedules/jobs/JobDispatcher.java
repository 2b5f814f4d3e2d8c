package villagecompute.schedules.jobs;

/**
 * Hands a job to the job subsystem for asynchronous execution.
 *
 * <p>
 * The scheduler engine and the manual run-now path depend only on this contract. Implementations must either return
 * the created job's id or throw; a thrown exception is treated as a failed run by the caller.
 *
 * @see villagecompute.schedules.services.DelayedJobService for the database-backed implementation
 */
public interface JobDispatcher {

    /**
     * Creates a job record and enqueues it.
     *
     * @param request
     *            tenant, job type, creator, opaque input and metadata
     * @return handle carrying the created job's id
     */
    DispatchedJob createAndEnqueueJob(JobDispatchRequest request);
}
