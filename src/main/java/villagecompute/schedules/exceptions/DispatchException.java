package villagecompute.schedules.exceptions;

/**
 * Exception thrown when a job could not be handed to the job-dispatch capability, including dispatch timeouts.
 *
 * <p>
 * The scheduler engine treats it as a failed run and applies the failure policy. REST resources map it to HTTP 502.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
