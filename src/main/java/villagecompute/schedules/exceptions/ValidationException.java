package villagecompute.schedules.exceptions;

/**
 * Exception thrown when schedule input is rejected (out-of-range time fields, unknown timezone, bad cron expression).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
