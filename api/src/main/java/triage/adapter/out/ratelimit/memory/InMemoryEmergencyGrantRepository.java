package triage.adapter.out.ratelimit.memory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import triage.core.model.ratelimit.EmergencyGrant;
import triage.core.port.out.EmergencyGrantRepository;

/**
 * In-memory implementation of EmergencyGrantRepository.
 *
 * <p>
 * Grants are visible to this instance only and are lost on restart.
 */
public class InMemoryEmergencyGrantRepository implements EmergencyGrantRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryEmergencyGrantRepository.class);

    private static final String NAME = "memory";

    private final ConcurrentMap<String, EmergencyGrant> grants = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> save(EmergencyGrant grant) {
        return Uni.createFrom().item(() -> {
            grants.put(grant.subjectId(), grant);
            LOG.debugf("Stored emergency grant for %s until %s", grant.subjectId(), grant.expiresAt());
            return null;
        });
    }

    @Override
    public Uni<Optional<EmergencyGrant>> find(String subjectId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(grants.get(subjectId)));
    }

    @Override
    public Uni<Void> delete(String subjectId) {
        return Uni.createFrom().item(() -> {
            grants.remove(subjectId);
            return null;
        });
    }

    @Override
    public Uni<Long> countActive(Instant now) {
        return Uni.createFrom()
                .item(() -> grants.values().stream()
                        .filter(grant -> grant.isActiveAt(now))
                        .count());
    }

    @Override
    public Uni<Integer> removeExpired(Instant now) {
        return Uni.createFrom().item(() -> {
            final var before = grants.size();
            grants.values().removeIf(grant -> !grant.isActiveAt(now));
            return Math.max(0, before - grants.size());
        });
    }

    @Override
    public String name() {
        return NAME;
    }
}
