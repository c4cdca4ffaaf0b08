package triage.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;

import triage.core.port.out.RateLimitStore;
import triage.spi.RateLimitStoreProvider;

/**
 * In-memory store provider.
 *
 * <p>This provider is always available as a fallback. It has the lowest priority (0), so
 * Redis is preferred when available.
 */
public final class InMemoryRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 0;
    private static final String NAME = "memory";

    private final Clock clock;
    private final Duration cleanupInterval;

    /**
     * Create a new in-memory provider.
     *
     * @param clock clock used by idle slot cleanup
     * @param cleanupInterval interval between cleanups
     */
    public InMemoryRateLimitStoreProvider(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        // In-memory is always available as fallback
        return true;
    }

    @Override
    public RateLimitStore createStore() {
        return new InMemoryRateLimitStore(clock, cleanupInterval);
    }
}
