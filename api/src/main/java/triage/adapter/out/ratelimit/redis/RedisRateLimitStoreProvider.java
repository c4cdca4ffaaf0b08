package triage.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import triage.core.port.out.RateLimitStore;
import triage.spi.RateLimitStoreProvider;

/**
 * Redis-based store provider for multi-instance deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is selected when Redis
 * is enabled in configuration and a data source is present.
 */
public final class RedisRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 10;
    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;

    /**
     * Creates a new Redis provider.
     *
     * @param redisDataSource the Redis data source, may be null when none is configured
     * @param keyPrefix key prefix for limiter entries
     */
    public RedisRateLimitStoreProvider(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
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
        return redisDataSource != null;
    }

    @Override
    public RateLimitStore createStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException(
                    "Provider not configured. Use RateLimitStoreProviderLoader for proper initialization.");
        }
        return new RedisRateLimitStore(redisDataSource, keyPrefix);
    }
}
