package triage.adapter.in.dto;

import triage.core.model.ratelimit.RateLimitDecision;

/**
 * DTO for a rate limit decision.
 */
public record RateLimitDecisionDto(
        boolean allowed,
        long remaining,
        long limit,
        long resetAt,
        long retryAfterSeconds,
        Double tokensRemaining,
        long burstCapacity,
        String role,
        String operation,
        String policyVersion,
        String policySource,
        boolean emergencyBypassActive,
        boolean degraded) {

    /**
     * Create a DTO from a decision.
     */
    public static RateLimitDecisionDto fromModel(RateLimitDecision decision) {
        return new RateLimitDecisionDto(
                decision.allowed(),
                decision.remaining(),
                decision.limit(),
                decision.resetAtEpochSeconds(),
                decision.retryAfterSeconds(),
                decision.tokensRemaining().isPresent()
                        ? decision.tokensRemaining().getAsDouble()
                        : null,
                decision.burstCapacity(),
                decision.role(),
                decision.operation(),
                decision.policyVersion(),
                decision.policySource(),
                decision.emergencyBypassActive(),
                decision.degraded());
    }
}
