package triage.core.service.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * Periodic policy reload and expired grant sweep.
 *
 * <p>Both jobs are best effort. Lookups already prune expired grants, and a reload only picks
 * up document edits sooner than the next explicit reload.
 */
@ApplicationScoped
public class RateLimitMaintenance {

    private static final Logger LOG = Logger.getLogger(RateLimitMaintenance.class);

    private final PolicyStore policyStore;
    private final EmergencyBypassRegistry bypassRegistry;

    @Inject
    public RateLimitMaintenance(PolicyStore policyStore, EmergencyBypassRegistry bypassRegistry) {
        this.policyStore = policyStore;
        this.bypassRegistry = bypassRegistry;
    }

    /**
     * Reload the policy document.
     */
    @Scheduled(
            every = "${triage.rate-limiting.policy.reload-interval:off}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void reloadPolicy() {
        final var previous = policyStore.current();
        final var reloaded = policyStore.reload();
        if (!previous.version().equals(reloaded.version()) || !previous.source().equals(reloaded.source())) {
            LOG.infof(
                    "Rate limit policy changed: %s@%s -> %s@%s",
                    previous.source(), previous.version(), reloaded.source(), reloaded.version());
        }
    }

    /**
     * Remove expired emergency grants.
     *
     * @return completion signal
     */
    @Scheduled(
            every = "${triage.rate-limiting.bypass.sweep-interval:60s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> sweepGrants() {
        return bypassRegistry
                .sweep()
                .invoke(removed -> {
                    if (removed > 0) {
                        LOG.debugf("Removed %d expired emergency grants", removed);
                    }
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Emergency grant sweep failed");
                    return 0;
                })
                .replaceWithVoid();
    }
}
