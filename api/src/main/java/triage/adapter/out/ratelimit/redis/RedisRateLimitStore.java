package triage.adapter.out.ratelimit.redis;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import triage.core.model.ratelimit.AdmissionResult;
import triage.core.model.ratelimit.Limit;
import triage.core.model.ratelimit.LimiterKeys;
import triage.core.model.ratelimit.StoreUnavailableException;
import triage.core.port.out.RateLimitStore;

/**
 * Redis-based coordination store for multi-instance deployments.
 *
 * <p>One Lua script refills the bucket, checks both windows and records the request, so every
 * instance sees the same counts. Redis runs scripts one at a time, which makes each admission
 * atomic.
 *
 * <p>Key format:
 * <ul>
 *   <li>Bucket: {@code <prefix>{<subjectId>:<operation>}:tb} (hash with tokens, ts)</li>
 *   <li>Minute window: {@code <prefix>{<subjectId>:<operation>}:minute:<epochMinute>}</li>
 *   <li>Hour window: {@code <prefix>{<subjectId>:<operation>}:hour:<epochHour>}</li>
 * </ul>
 *
 * <p>The braces are a literal hash tag, keeping the three keys in one cluster slot.
 */
public final class RedisRateLimitStore implements RateLimitStore {

    private static final Logger LOG = Logger.getLogger(RedisRateLimitStore.class);

    /**
     * Lua script for atomic admission.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - bucket key</li>
     *   <li>KEYS[2] - minute window key</li>
     *   <li>KEYS[3] - hour window key</li>
     *   <li>ARGV[1] - current timestamp in milliseconds</li>
     *   <li>ARGV[2] - bucket capacity</li>
     *   <li>ARGV[3] - refill rate (tokens per second)</li>
     *   <li>ARGV[4] - requests per minute</li>
     *   <li>ARGV[5] - requests per hour</li>
     * </ol>
     *
     * <p>Returns array: [allowed (0/1), tokens (string), minute_count, hour_count, retry_after]
     */
    static final String ADMISSION_SCRIPT =
            """
            local bucket_key = KEYS[1]
            local minute_key = KEYS[2]
            local hour_key = KEYS[3]
            local now_ms = tonumber(ARGV[1])
            local capacity = tonumber(ARGV[2])
            local fill_rate = tonumber(ARGV[3])
            local rpm = tonumber(ARGV[4])
            local rph = tonumber(ARGV[5])

            local data = redis.call('HMGET', bucket_key, 'tokens', 'ts')
            local tokens = tonumber(data[1])
            local ts = tonumber(data[2])
            if tokens == nil or ts == nil then
                tokens = capacity
                ts = now_ms
            end

            if now_ms > ts and fill_rate > 0 then
                tokens = math.min(capacity, tokens + ((now_ms - ts) / 1000.0) * fill_rate)
                ts = now_ms
            end

            local minute_count = tonumber(redis.call('GET', minute_key) or '0')
            local hour_count = tonumber(redis.call('GET', hour_key) or '0')

            if tokens < 1 then
                local retry_after = 3600
                if fill_rate > 0 then
                    retry_after = math.max(1, math.ceil((1 - tokens) / fill_rate))
                end
                return {0, tostring(tokens), minute_count, hour_count, retry_after}
            end

            -- Debit, then give the token back if a window is full
            tokens = tokens - 1
            if minute_count >= rpm or hour_count >= rph then
                tokens = tokens + 1
                return {0, tostring(tokens), minute_count, hour_count, 60}
            end

            minute_count = redis.call('INCR', minute_key)
            redis.call('EXPIRE', minute_key, 120)
            hour_count = redis.call('INCR', hour_key)
            redis.call('EXPIRE', hour_key, 7200)
            redis.call('HSET', bucket_key, 'tokens', tostring(tokens), 'ts', tostring(ts))
            redis.call('EXPIRE', bucket_key, 3600)

            return {1, tostring(tokens), minute_count, hour_count, 0}
            """;

    private static final String NAME = "redis";

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;

    public RedisRateLimitStore(ReactiveRedisDataSource redisDataSource, String keyPrefix) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Uni<AdmissionResult> admit(String subjectId, String operation, Limit limit, long nowMillis) {
        final var keys = LimiterKeys.of(keyPrefix, subjectId, operation, nowMillis);

        // EVAL script numkeys key [key...] arg [arg...]
        return redisDataSource
                .execute(
                        "EVAL",
                        ADMISSION_SCRIPT,
                        "3", // numkeys
                        keys.bucket(), // KEYS[1]
                        keys.minuteWindow(), // KEYS[2]
                        keys.hourWindow(), // KEYS[3]
                        String.valueOf(nowMillis), // ARGV[1]
                        String.valueOf(limit.burstCapacity()), // ARGV[2]
                        String.valueOf(limit.fillRatePerSecond()), // ARGV[3]
                        String.valueOf(limit.requestsPerMinute()), // ARGV[4]
                        String.valueOf(limit.requestsPerHour()) // ARGV[5]
                        )
                .map(RedisRateLimitStore::parseResult)
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> new StoreUnavailableException("Redis admission failed: " + error.getMessage(), error))
                .onItem()
                .invoke(result -> LOG.debugf(
                        "Admission for %s:%s allowed=%s tokens=%.2f", subjectId, operation, result.allowed(),
                        result.tokensRemaining()));
    }

    @Override
    public String name() {
        return NAME;
    }

    static AdmissionResult parseResult(Response response) {
        if (response == null || response.size() != 5) {
            throw new StoreUnavailableException("Malformed admission reply from Redis: " + response);
        }
        try {
            return new AdmissionResult(
                    response.get(0).toLong() == 1,
                    Double.parseDouble(response.get(1).toString()),
                    response.get(2).toLong(),
                    response.get(3).toLong(),
                    response.get(4).toLong());
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Malformed admission reply from Redis: " + response, e);
        }
    }
}
