package villagecompute.schedules.exceptions;

/**
 * Exception thrown when a schedule does not exist, is soft-deleted, or belongs to another organization.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
