package triage.core.model.ratelimit;

/**
 * Token bucket with fixed minute and hour windows.
 *
 * <p>A request needs one token and room in both windows. When the bucket has a token but a
 * window is full the token is returned, so a rejection never changes state. Callers must run
 * {@link #admit} atomically per key; the Redis store runs the same steps as a Lua script.
 */
public final class AdmissionAlgorithm {

    /** Retry hint when no refill is possible. */
    public static final long RETRY_AFTER_NO_REFILL_SECONDS = 3600;

    /** Retry hint when a window ceiling is reached. */
    public static final long RETRY_AFTER_WINDOW_SECONDS = 60;

    private AdmissionAlgorithm() {}

    /**
     * Result of {@link #admit}: the decision plus the state to store.
     *
     * @param result the admission result
     * @param slot state after the call, unchanged on rejection
     */
    public record Step(AdmissionResult result, LimiterSlot slot) {}

    /**
     * Run one admission.
     *
     * @param current current state, or null for a new key
     * @param limit the limit to enforce
     * @param nowMillis current time in epoch milliseconds
     * @return the result and the state to store
     */
    public static Step admit(LimiterSlot current, Limit limit, long nowMillis) {
        final var capacity = limit.burstCapacity();
        final var fillRate = limit.fillRatePerSecond();
        final var slot = current != null ? current : LimiterSlot.full(capacity, nowMillis);

        var tokens = slot.tokens();
        var lastRefill = slot.lastRefillMillis();
        if (nowMillis > lastRefill && fillRate > 0) {
            final var elapsedSeconds = (nowMillis - lastRefill) / 1000.0;
            tokens = Math.min(capacity, tokens + elapsedSeconds * fillRate);
            lastRefill = nowMillis;
        }

        final var epochMinute = nowMillis / 60_000L;
        final var epochHour = nowMillis / 3_600_000L;
        final var minuteCount = slot.minuteCountAt(epochMinute);
        final var hourCount = slot.hourCountAt(epochHour);

        if (tokens < 1) {
            final long retryAfter = fillRate > 0
                    ? Math.max(1L, (long) Math.ceil((1 - tokens) / fillRate))
                    : RETRY_AFTER_NO_REFILL_SECONDS;
            return new Step(new AdmissionResult(false, tokens, minuteCount, hourCount, retryAfter), slot);
        }

        if (minuteCount >= limit.requestsPerMinute() || hourCount >= limit.requestsPerHour()) {
            return new Step(
                    new AdmissionResult(false, tokens, minuteCount, hourCount, RETRY_AFTER_WINDOW_SECONDS), slot);
        }

        final var next = new LimiterSlot(
                tokens - 1, lastRefill, epochMinute, minuteCount + 1, epochHour, hourCount + 1);
        return new Step(new AdmissionResult(true, next.tokens(), next.minuteCount(), next.hourCount(), 0), next);
    }
}
