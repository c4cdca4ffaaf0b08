package triage.core.model.ratelimit;

/**
 * Raised when the coordination store cannot answer in time or answers with something unusable.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
