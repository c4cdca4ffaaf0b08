package triage.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import triage.core.model.ratelimit.AdmissionAlgorithm;
import triage.core.model.ratelimit.AdmissionResult;
import triage.core.model.ratelimit.Limit;
import triage.core.model.ratelimit.LimiterSlot;
import triage.core.port.out.RateLimitStore;

/**
 * In-memory coordination store.
 *
 * <p>
 * Keeps one {@link LimiterSlot} per subject and operation in a concurrent hash map and runs
 * {@link AdmissionAlgorithm} inside {@code compute}, so concurrent requests for the same key
 * are serialized. Suitable for single-instance deployments or development/testing.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 */
public final class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimitStore.class);

    private static final String NAME = "memory";

    // A bucket idle this long has refilled at any configurable rate
    private static final long IDLE_MILLIS = Duration.ofHours(1).toMillis();

    private final ConcurrentMap<String, LimiterSlot> slots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    /**
     * Creates a new in-memory store.
     *
     * @param clock clock used by the idle slot cleanup
     * @param cleanupInterval interval between cleanups
     */
    public InMemoryRateLimitStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "rate-limit-slot-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var intervalMillis = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(this::removeIdleSlots, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public Uni<AdmissionResult> admit(String subjectId, String operation, Limit limit, long nowMillis) {
        return Uni.createFrom().item(() -> admitNow(subjectId + ":" + operation, limit, nowMillis));
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Discard slots that can no longer affect a decision.
     *
     * @return the number of slots removed
     */
    public int removeIdleSlots() {
        final var nowMillis = clock.millis();
        final var before = slots.size();
        slots.values().removeIf(slot -> slot.isStale(nowMillis, IDLE_MILLIS));
        final var removed = before - slots.size();
        if (removed > 0) {
            LOG.debugf("Removed %d idle rate limit slots", removed);
        }
        return Math.max(0, removed);
    }

    /**
     * Returns the current number of tracked slots.
     *
     * @return the number of slots
     */
    public int slotCount() {
        return slots.size();
    }

    /**
     * Stop the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdownNow();
    }

    private AdmissionResult admitNow(String key, Limit limit, long nowMillis) {
        // Atomic compute to handle concurrent requests
        final var result = new AdmissionResult[1];

        slots.compute(key, (k, current) -> {
            final var step = AdmissionAlgorithm.admit(current, limit, nowMillis);
            result[0] = step.result();
            return step.slot();
        });

        return result[0];
    }
}
