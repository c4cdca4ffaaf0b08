package triage.core.port.out;

import io.smallrye.mutiny.Uni;

import triage.core.model.ratelimit.AdmissionResult;
import triage.core.model.ratelimit.Limit;

/**
 * Port interface for the coordination store holding token buckets and window counters.
 *
 * <p>Implementations must apply one admission atomically per subject and operation: concurrent
 * calls for the same key behave as if run one after another.
 *
 * <p>Failures are reported as failed {@link Uni}s, normally with a
 * {@link triage.core.model.ratelimit.StoreUnavailableException}. Callers decide the fallback.
 */
public interface RateLimitStore {

    /**
     * Refill, debit and count one request.
     *
     * @param subjectId opaque subject identifier
     * @param operation operation wire value
     * @param limit the limit to enforce
     * @param nowMillis current time in epoch milliseconds
     * @return the admission result
     */
    Uni<AdmissionResult> admit(String subjectId, String operation, Limit limit, long nowMillis);

    /**
     * Return the backend name for logging and health reporting.
     *
     * @return the backend name (e.g., "memory", "redis")
     */
    String name();
}
