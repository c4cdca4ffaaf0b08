package triage.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import triage.core.model.ratelimit.EmergencyGrant;
import triage.core.port.out.EmergencyGrantRepository;

/**
 * Redis implementation of EmergencyGrantRepository, shared by every instance.
 *
 * <p>Key format: {@code <prefix>grant:<subjectId>} (hash with role, expiresAt, reason). Limiter
 * keys always continue the prefix with a hash tag, so the two namespaces never overlap. The key
 * TTL is one second past the expiry, so Redis drops grants on its own; the stored expiry stays
 * authoritative.
 *
 * <p>A save replaces the hash and sets its TTL in one MULTI/EXEC transaction, so no reader sees
 * a half-written grant and no grant is left without a TTL.
 */
public class RedisEmergencyGrantRepository implements EmergencyGrantRepository {

    private static final Logger LOG = Logger.getLogger(RedisEmergencyGrantRepository.class);

    private static final String NAME = "redis";

    private static final String FIELD_ROLE = "role";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_REASON = "reason";

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final String grantPrefix;
    private final Clock clock;

    public RedisEmergencyGrantRepository(ReactiveRedisDataSource redisDataSource, String keyPrefix, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.grantPrefix = keyPrefix + "grant:";
        this.clock = clock;
        LOG.info("Initialized Redis emergency grant repository");
    }

    @Override
    public Uni<Void> save(EmergencyGrant grant) {
        final var key = grantPrefix + grant.subjectId();
        final var fields = Map.of(
                FIELD_ROLE, grant.role(),
                FIELD_EXPIRES_AT, String.valueOf(grant.expiresAt().toEpochMilli()),
                FIELD_REASON, grant.reason());
        final var ttlSeconds = ttlSeconds(grant.expiresAt());

        return redisDataSource
                .withTransaction(tx -> {
                    final var keys = tx.key(String.class);
                    final var hash = tx.hash(String.class, String.class, String.class);
                    return keys.del(key)
                            .chain(() -> hash.hset(key, fields))
                            .chain(() -> keys.expire(key, ttlSeconds));
                })
                .replaceWithVoid()
                .invoke(() -> LOG.debugf("Stored emergency grant for %s until %s", grant.subjectId(), grant.expiresAt()));
    }

    @Override
    public Uni<Optional<EmergencyGrant>> find(String subjectId) {
        return hashCommands.hgetall(grantPrefix + subjectId).map(fields -> toGrant(subjectId, fields));
    }

    @Override
    public Uni<Void> delete(String subjectId) {
        return keyCommands.del(grantPrefix + subjectId).replaceWithVoid();
    }

    @Override
    public Uni<Long> countActive(Instant now) {
        return loadAll().map(grants -> grants.stream()
                .filter(grant -> grant.isActiveAt(now))
                .count());
    }

    @Override
    public Uni<Integer> removeExpired(Instant now) {
        return loadAll().flatMap(grants -> {
            final var expired = grants.stream()
                    .filter(grant -> !grant.isActiveAt(now))
                    .map(grant -> grantPrefix + grant.subjectId())
                    .toArray(String[]::new);
            if (expired.length == 0) {
                return Uni.createFrom().item(0);
            }
            return keyCommands.del(expired);
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    private Uni<List<EmergencyGrant>> loadAll() {
        return keyCommands.keys(grantPrefix + "*").flatMap(keys -> {
            if (keys.isEmpty()) {
                return Uni.createFrom().item(List.<EmergencyGrant>of());
            }
            final var lookups = keys.stream()
                    .map(key -> find(key.substring(grantPrefix.length()))
                            .onFailure()
                            .recoverWithItem(error -> {
                                LOG.warnv(error, "Skipping unreadable emergency grant {0}", key);
                                return Optional.empty();
                            }))
                    .toList();
            return Uni.join().all(lookups).andCollectFailures().map(results -> results.stream()
                    .flatMap(Optional::stream)
                    .toList());
        });
    }

    private static Optional<EmergencyGrant> toGrant(String subjectId, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        final var expiresAt = fields.get(FIELD_EXPIRES_AT);
        if (expiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(new EmergencyGrant(
                subjectId,
                fields.getOrDefault(FIELD_ROLE, ""),
                Instant.ofEpochMilli(Long.parseLong(expiresAt)),
                fields.getOrDefault(FIELD_REASON, "")));
    }

    private long ttlSeconds(Instant expiresAt) {
        final var remaining = Duration.between(clock.instant(), expiresAt);
        final var seconds = remaining.toMillis() <= 0 ? 0 : (remaining.toMillis() + 999) / 1000;
        return seconds + 1;
    }
}
