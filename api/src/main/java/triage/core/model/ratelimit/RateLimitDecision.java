package triage.core.model.ratelimit;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Result of a rate limit check.
 *
 * <p>Carries everything a caller needs to render response headers and, on denial, an error
 * body. Decisions are never persisted.
 *
 * @param allowed whether the request may proceed
 * @param remaining requests left before a limit is hit
 * @param limit requests per minute of the applied limit
 * @param resetAt when the caller can expect capacity again
 * @param retryAfterSeconds seconds to wait before retrying, 0 when allowed
 * @param tokensRemaining fractional tokens left in the bucket, empty when the store was not consulted
 * @param burstCapacity bucket capacity of the applied limit
 * @param role subject class wire value, or {@code unknown}
 * @param operation operation type wire value, or {@code unknown}
 * @param policyVersion version of the policy in effect
 * @param policySource origin of the policy in effect
 * @param emergencyBypassActive whether an emergency grant admitted the request
 * @param degraded whether the store was unavailable and the fallback path decided
 */
public record RateLimitDecision(
        boolean allowed,
        long remaining,
        long limit,
        Instant resetAt,
        long retryAfterSeconds,
        OptionalDouble tokensRemaining,
        long burstCapacity,
        String role,
        String operation,
        String policyVersion,
        String policySource,
        boolean emergencyBypassActive,
        boolean degraded) {

    /** Remaining count reported while an emergency grant is active. */
    public static final long BYPASS_REMAINING = 999;

    /**
     * Context shared by every decision for one check.
     *
     * @param role subject class wire value
     * @param operation operation type wire value
     * @param limit the applied limit
     * @param policyVersion policy version
     * @param policySource policy source
     */
    public record Context(String role, String operation, Limit limit, String policyVersion, String policySource) {}

    /**
     * Build a decision from a store admission.
     *
     * <p>When allowed, {@code remaining} is the smallest of the whole tokens left and the room
     * left in each window, and the reset is one minute out. When denied, the reset is the retry
     * hint.
     *
     * @param context check context
     * @param result store result
     * @param now current instant
     * @return the decision
     */
    public static RateLimitDecision fromAdmission(Context context, AdmissionResult result, Instant now) {
        final var limit = context.limit();
        if (result.allowed()) {
            final var remaining = Math.max(
                    0,
                    Math.min(
                            (long) Math.floor(result.tokensRemaining()),
                            Math.min(
                                    limit.requestsPerMinute() - result.minuteCount(),
                                    limit.requestsPerHour() - result.hourCount())));
            return new RateLimitDecision(
                    true,
                    remaining,
                    limit.requestsPerMinute(),
                    now.plusSeconds(60),
                    0,
                    OptionalDouble.of(result.tokensRemaining()),
                    limit.burstCapacity(),
                    context.role(),
                    context.operation(),
                    context.policyVersion(),
                    context.policySource(),
                    false,
                    false);
        }
        return new RateLimitDecision(
                false,
                0,
                limit.requestsPerMinute(),
                now.plusSeconds(result.retryAfterSeconds()),
                result.retryAfterSeconds(),
                OptionalDouble.of(result.tokensRemaining()),
                limit.burstCapacity(),
                context.role(),
                context.operation(),
                context.policyVersion(),
                context.policySource(),
                false,
                false);
    }

    /**
     * Build an allowed decision for a subject holding an emergency grant.
     *
     * @param context check context
     * @param expiresAt grant expiry
     * @return the decision
     */
    public static RateLimitDecision bypass(Context context, Instant expiresAt) {
        return new RateLimitDecision(
                true,
                BYPASS_REMAINING,
                context.limit().requestsPerMinute(),
                expiresAt,
                0,
                OptionalDouble.empty(),
                context.limit().burstCapacity(),
                context.role(),
                context.operation(),
                context.policyVersion(),
                context.policySource(),
                true,
                false);
    }

    /**
     * Build the decision used when the store is unavailable.
     *
     * @param context check context
     * @param failOpen whether to admit the request
     * @param now current instant
     * @return an allowed decision with {@code remaining = min(burst, rpm)}, or a denial retryable
     *     after one second
     */
    public static RateLimitDecision unavailable(Context context, boolean failOpen, Instant now) {
        final var limit = context.limit();
        if (failOpen) {
            return new RateLimitDecision(
                    true,
                    Math.min(limit.burstCapacity(), limit.requestsPerMinute()),
                    limit.requestsPerMinute(),
                    now.plusSeconds(60),
                    0,
                    OptionalDouble.empty(),
                    limit.burstCapacity(),
                    context.role(),
                    context.operation(),
                    context.policyVersion(),
                    context.policySource(),
                    false,
                    true);
        }
        return new RateLimitDecision(
                false,
                0,
                limit.requestsPerMinute(),
                now.plusSeconds(1),
                1,
                OptionalDouble.empty(),
                limit.burstCapacity(),
                context.role(),
                context.operation(),
                context.policyVersion(),
                context.policySource(),
                false,
                true);
    }

    /**
     * Get the reset time as epoch seconds.
     *
     * @return epoch seconds when capacity is expected back
     */
    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
