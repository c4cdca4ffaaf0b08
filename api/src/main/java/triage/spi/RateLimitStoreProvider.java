package triage.spi;

import triage.core.port.out.RateLimitStore;

/**
 * Service Provider Interface for coordination store implementations.
 *
 * <p>Providers are selected by priority. Higher priority providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Shared across instances, recommended for production</li>
 * </ul>
 *
 * @see triage.core.port.out.RateLimitStore
 */
public interface RateLimitStoreProvider {

    /**
     * Return the priority of this provider.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider is usable in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a store instance.
     *
     * <p>Called once during application startup. The returned instance must be thread-safe.
     *
     * @return the store
     */
    RateLimitStore createStore();
}
