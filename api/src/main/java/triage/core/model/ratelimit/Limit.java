package triage.core.model.ratelimit;

import java.util.Objects;

/**
 * The resolved quota for one subject class and operation type.
 *
 * <p>A request is admitted only when the token bucket holds a token and neither the minute
 * nor the hour window counter has reached its ceiling.
 *
 * @param requestsPerMinute ceiling of the minute window, also the bucket refill rate per minute
 * @param requestsPerHour ceiling of the hour window
 * @param burstCapacity token bucket capacity
 * @param emergencyBypassAllowed whether an emergency request under this limit may grant a bypass
 * @param description human readable origin of the limit
 */
public record Limit(
        long requestsPerMinute,
        long requestsPerHour,
        long burstCapacity,
        boolean emergencyBypassAllowed,
        String description) {

    /** Requests per minute used when rate limiting is globally disabled. */
    public static final long UNLIMITED_REQUESTS_PER_MINUTE = 1_000_000L;

    /** Requests per hour used when rate limiting is globally disabled. */
    public static final long UNLIMITED_REQUESTS_PER_HOUR = 10_000_000L;

    /** Burst capacity used when rate limiting is globally disabled. */
    public static final long UNLIMITED_BURST_CAPACITY = 100_000L;

    /**
     * Create a limit with validation.
     */
    public Limit {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        if (requestsPerHour < 1) {
            throw new IllegalArgumentException("requestsPerHour must be positive");
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException("burstCapacity must be positive");
        }
        description = Objects.requireNonNullElse(description, "");
    }

    /**
     * Create a limit that does not allow emergency bypass.
     *
     * @param requestsPerMinute requests per minute
     * @param requestsPerHour requests per hour
     * @param burstCapacity burst capacity
     * @param description description
     * @return the limit
     */
    public static Limit of(long requestsPerMinute, long requestsPerHour, long burstCapacity, String description) {
        return new Limit(requestsPerMinute, requestsPerHour, burstCapacity, false, description);
    }

    /**
     * Token refill rate of the bucket.
     *
     * @return tokens per second
     */
    public double fillRatePerSecond() {
        return requestsPerMinute / 60.0;
    }

    /**
     * Return a copy with every numeric field multiplied by {@code scale}.
     *
     * <p>Each field becomes {@code max(1, round(value * scale))}. A scale of exactly 1.0 returns
     * this instance.
     *
     * @param scale positive multiplier
     * @return the scaled limit
     */
    public Limit scaled(double scale) {
        if (scale <= 0) {
            throw new IllegalArgumentException("scale must be positive");
        }
        if (scale == 1.0) {
            return this;
        }
        return new Limit(
                scale(requestsPerMinute, scale),
                scale(requestsPerHour, scale),
                scale(burstCapacity, scale),
                emergencyBypassAllowed,
                description);
    }

    /**
     * Return a copy with effectively unlimited numbers, keeping bypass eligibility and description.
     *
     * @return the unlimited limit
     */
    public Limit unlimited() {
        return new Limit(
                UNLIMITED_REQUESTS_PER_MINUTE,
                UNLIMITED_REQUESTS_PER_HOUR,
                UNLIMITED_BURST_CAPACITY,
                emergencyBypassAllowed,
                description);
    }

    private static long scale(long value, double scale) {
        return Math.max(1L, Math.round(value * scale));
    }
}
