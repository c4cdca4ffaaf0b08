package triage.core.model.ratelimit;

/**
 * Outcome of one atomic admission against the store.
 *
 * @param allowed whether the request was admitted
 * @param tokensRemaining tokens left in the bucket after the call
 * @param minuteCount requests counted in the current minute window
 * @param hourCount requests counted in the current hour window
 * @param retryAfterSeconds seconds to wait before retrying, 0 when allowed
 */
public record AdmissionResult(
        boolean allowed, double tokensRemaining, long minuteCount, long hourCount, long retryAfterSeconds) {}
