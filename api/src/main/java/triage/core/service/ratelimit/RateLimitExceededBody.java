package triage.core.service.ratelimit;

import triage.core.model.ratelimit.RateLimitDecision;

/**
 * Error body returned with a denied request.
 *
 * @param error fixed error label
 * @param message human readable message naming the operation
 * @param retryAfterSeconds seconds to wait before retrying
 * @param role subject class wire value, or {@code unknown}
 * @param emergencyBypassAvailable whether the role may request an emergency bypass
 */
public record RateLimitExceededBody(
        String error, String message, long retryAfterSeconds, String role, boolean emergencyBypassAvailable) {

    static final String ERROR = "Rate limit exceeded";

    static RateLimitExceededBody from(RateLimitDecision decision, boolean emergencyBypassAvailable) {
        return new RateLimitExceededBody(
                ERROR,
                "Too many " + decision.operation() + " requests",
                decision.retryAfterSeconds(),
                decision.role(),
                emergencyBypassAvailable);
    }
}
