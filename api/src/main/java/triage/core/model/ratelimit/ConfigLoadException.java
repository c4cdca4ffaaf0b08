package triage.core.model.ratelimit;

/**
 * Thrown when a policy document or manifest cannot be read or parsed.
 */
public class ConfigLoadException extends Exception {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
