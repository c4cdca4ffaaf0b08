package triage.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code triage.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code RL_DISABLE} - Replace every limit with effectively unlimited numbers</li>
 *   <li>{@code RL_GLOBAL_SCALE} - Multiply every limit by this factor</li>
 *   <li>{@code RL_YAML_PATH} - Explicit policy document path</li>
 *   <li>{@code CONFIG_DISCOVERY_ROOT} - Directory searched for policy documents</li>
 *   <li>{@code RL_EMERGENCY_DEFAULT_MINUTES} - Default emergency bypass duration</li>
 * </ul>
 */
@ConfigMapping(prefix = "triage.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Disable rate limiting globally.
     *
     * <p>Limits become effectively unlimited but checks still run, so metrics and headers
     * keep working.
     *
     * @return true if disabled (default: false)
     */
    @WithDefault("false")
    boolean disabled();

    /**
     * Global multiplier applied to every limit.
     *
     * <p>Kept as a string so an unparsable value can be reported and ignored instead of
     * failing startup.
     *
     * @return the scale factor (default: 1.0)
     */
    @WithDefault("1.0")
    String globalScale();

    /**
     * Default emergency bypass duration in minutes.
     *
     * @return minutes (default: 30)
     */
    @WithDefault("30")
    long emergencyDefaultMinutes();

    /**
     * Maximum time to wait for the coordination store before falling back.
     *
     * @return the store timeout (default: 250ms)
     */
    @WithDefault("250ms")
    Duration storeTimeout();

    /**
     * Admit requests when the coordination store is unavailable.
     *
     * @return true to fail open (default: true)
     */
    @WithDefault("true")
    boolean failOpen();

    /**
     * Policy document configuration.
     */
    PolicyConfig policy();

    /**
     * Redis backend configuration.
     */
    RedisConfig redis();

    /**
     * Emergency bypass configuration.
     */
    BypassConfig bypass();

    /**
     * In-memory backend configuration.
     */
    MemoryConfig memory();

    /**
     * Policy document location and reload.
     */
    interface PolicyConfig {

        /**
         * Explicit path of the policy document. Takes precedence over discovery.
         *
         * @return the path, if set
         */
        Optional<String> path();

        /**
         * Directory searched for {@code config_index.yml} and {@code rate_limits.yml}.
         *
         * @return discovery root (default: config)
         */
        @WithDefault("config")
        String discoveryRoot();

        /**
         * Interval of the periodic policy reload, in scheduler syntax.
         *
         * @return the interval, or {@code off} (default: off)
         */
        @WithDefault("off")
        String reloadInterval();
    }

    /**
     * Redis-specific rate limiting configuration.
     */
    interface RedisConfig {

        /**
         * Enable Redis as the coordination store.
         *
         * <p>When disabled or unavailable, falls back to in-memory.
         *
         * @return true to use Redis (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Key prefix for limiter and grant entries in Redis.
         *
         * @return key prefix (default: "triage:ratelimit:")
         */
        @WithDefault("triage:ratelimit:")
        String keyPrefix();
    }

    /**
     * Emergency bypass configuration.
     */
    interface BypassConfig {

        /**
         * Keep grants in Redis so every instance honors them.
         *
         * <p>Only takes effect when Redis is enabled and available.
         *
         * @return true to share grants (default: false)
         */
        @WithDefault("false")
        boolean shared();

        /**
         * Subject classes allowed to request a bypass.
         *
         * @return role wire values (default: doctor, nurse, admin)
         */
        @WithDefault("doctor,nurse,admin")
        List<String> privilegedRoles();

        /**
         * Interval of the expired grant sweep, in scheduler syntax.
         *
         * @return the interval (default: 60s)
         */
        @WithDefault("60s")
        String sweepInterval();
    }

    /**
     * In-memory backend configuration.
     */
    interface MemoryConfig {

        /**
         * Interval at which idle limiter slots are discarded.
         *
         * @return cleanup interval (default: 5m)
         */
        @WithDefault("5m")
        Duration cleanupInterval();
    }
}
