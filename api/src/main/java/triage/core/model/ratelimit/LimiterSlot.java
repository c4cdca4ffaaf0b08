package triage.core.model.ratelimit;

/**
 * Combined token bucket and window counter state for one subject and operation.
 *
 * <p>Window counters belong to the window index they were recorded in. A slot read in a later
 * window reports a zero count for that window.
 *
 * @param tokens tokens left in the bucket, fractional
 * @param lastRefillMillis time of the last refill in epoch milliseconds
 * @param minuteWindow epoch minute the minute counter belongs to
 * @param minuteCount requests admitted in {@code minuteWindow}
 * @param hourWindow epoch hour the hour counter belongs to
 * @param hourCount requests admitted in {@code hourWindow}
 */
public record LimiterSlot(
        double tokens, long lastRefillMillis, long minuteWindow, long minuteCount, long hourWindow, long hourCount) {

    /**
     * Create a slot with a full bucket and empty windows.
     *
     * @param capacity bucket capacity
     * @param nowMillis current time
     * @return the slot
     */
    public static LimiterSlot full(long capacity, long nowMillis) {
        return new LimiterSlot(capacity, nowMillis, nowMillis / 60_000L, 0, nowMillis / 3_600_000L, 0);
    }

    long minuteCountAt(long epochMinute) {
        return minuteWindow == epochMinute ? minuteCount : 0;
    }

    long hourCountAt(long epochHour) {
        return hourWindow == epochHour ? hourCount : 0;
    }

    /**
     * Whether nothing in this slot can influence a decision at {@code nowMillis}.
     *
     * <p>True once the hour window has rolled over and the bucket would have refilled
     * completely.
     *
     * @param nowMillis current time
     * @param idleMillis how long the bucket must have been idle
     * @return true if the slot may be discarded
     */
    public boolean isStale(long nowMillis, long idleMillis) {
        return hourWindow != nowMillis / 3_600_000L && nowMillis - lastRefillMillis >= idleMillis;
    }
}
