package triage.core.service.ratelimit;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import triage.core.model.ratelimit.RateLimitDecision;

/**
 * Response headers describing a decision.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String ROLE = "X-RateLimit-Role";
    public static final String POLICY_VERSION = "X-RateLimit-Policy-Version";
    public static final String POLICY_SOURCE = "X-RateLimit-Policy-Source";
    public static final String TOKENS_REMAINING = "X-RateLimit-Tokens-Remaining";
    public static final String BURST_CAPACITY = "X-RateLimit-Burst-Capacity";
    public static final String TYPE = "X-RateLimit-Type";
    public static final String EMERGENCY_BYPASS = "X-RateLimit-Emergency-Bypass";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {}

    /**
     * Render the headers for a decision, in a stable order.
     *
     * <p>Denials always carry {@code Retry-After} and {@code X-RateLimit-Type}.
     *
     * @param decision the decision
     * @return header names to values
     */
    public static Map<String, String> render(RateLimitDecision decision) {
        final var headers = new LinkedHashMap<String, String>();
        headers.put(LIMIT, String.valueOf(decision.limit()));
        headers.put(REMAINING, String.valueOf(decision.remaining()));
        headers.put(RESET, String.valueOf(decision.resetAtEpochSeconds()));
        headers.put(ROLE, decision.role());
        headers.put(POLICY_VERSION, decision.policyVersion());
        headers.put(POLICY_SOURCE, decision.policySource());
        decision.tokensRemaining()
                .ifPresent(tokens -> headers.put(TOKENS_REMAINING, String.format(Locale.ROOT, "%.2f", tokens)));
        headers.put(BURST_CAPACITY, String.valueOf(decision.burstCapacity()));

        if (!decision.allowed()) {
            headers.put(RETRY_AFTER, String.valueOf(Math.max(1, decision.retryAfterSeconds())));
            headers.put(TYPE, decision.operation());
        }
        if (decision.emergencyBypassActive()) {
            headers.put(EMERGENCY_BYPASS, "active");
        }
        return headers;
    }
}
