package triage.adapter.out.ratelimit;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import triage.adapter.out.ratelimit.memory.InMemoryEmergencyGrantRepository;
import triage.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import triage.adapter.out.ratelimit.memory.InMemoryRateLimitStoreProvider;
import triage.adapter.out.ratelimit.redis.RedisEmergencyGrantRepository;
import triage.adapter.out.ratelimit.redis.RedisRateLimitStoreProvider;
import triage.config.RateLimitingConfig;
import triage.core.port.out.EmergencyGrantRepository;
import triage.core.port.out.RateLimitStore;
import triage.spi.RateLimitStoreProvider;

/**
 * CDI producer for the coordination store and the emergency grant repository.
 *
 * <p>Selects the highest priority available store provider:
 * <ul>
 *   <li>Redis (priority 10) - Used when Redis is enabled and a data source is present</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 *
 * <p>Grants are kept in Redis only when {@code bypass.shared} is set and Redis is usable;
 * otherwise each instance keeps its own.
 */
@ApplicationScoped
public class RateLimitStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimitStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Clock clock;

    @Inject
    public RateLimitStoreProviderLoader(
            RateLimitingConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.clock = clock;
    }

    /**
     * Produces the coordination store for CDI injection.
     *
     * @return the selected store
     */
    @Produces
    @ApplicationScoped
    public RateLimitStore produceRateLimitStore() {
        final var provider = providers().stream()
                .filter(RateLimitStoreProvider::isAvailable)
                .max(Comparator.comparingInt(RateLimitStoreProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No rate limit store provider available"));

        LOG.infov("Using rate limit store provider: {0}", provider.name());
        return provider.createStore();
    }

    /**
     * Disposes the store, shutting down any cleanup executors.
     */
    void disposeRateLimitStore(@Disposes RateLimitStore store) {
        if (store instanceof InMemoryRateLimitStore inMemory) {
            inMemory.shutdown();
        }
    }

    /**
     * Produces the emergency grant repository for CDI injection.
     *
     * @return the grant repository
     */
    @Produces
    @ApplicationScoped
    public EmergencyGrantRepository produceEmergencyGrantRepository() {
        if (config.bypass().shared()) {
            final var ds = resolveRedis();
            if (ds != null) {
                LOG.info("Emergency grants are shared through Redis");
                return new RedisEmergencyGrantRepository(ds, config.redis().keyPrefix(), clock);
            }
            LOG.warn("Shared emergency grants requested but Redis is not available, keeping grants in memory");
        }
        return new InMemoryEmergencyGrantRepository();
    }

    private List<RateLimitStoreProvider> providers() {
        final var providers = new ArrayList<RateLimitStoreProvider>();
        providers.add(new InMemoryRateLimitStoreProvider(clock, config.memory().cleanupInterval()));
        providers.add(new RedisRateLimitStoreProvider(resolveRedis(), config.redis().keyPrefix()));
        return providers;
    }

    private ReactiveRedisDataSource resolveRedis() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis rate limiting not enabled in configuration");
            return null;
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis rate limiting enabled but ReactiveRedisDataSource not available");
            return null;
        }

        try {
            return redisDataSource.get();
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to initialize Redis data source, falling back to in-memory");
            return null;
        }
    }
}
