package triage.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import triage.core.port.out.RateLimitStore;
import triage.core.service.ratelimit.EmergencyBypassRegistry;
import triage.core.service.ratelimit.PolicyStore;

/**
 * Readiness check reporting the policy generation and backends in effect.
 *
 * <p>Always UP: a failed policy load falls back to the built-in table and an unavailable store
 * is handled per request, so neither makes the service unable to answer.
 */
@Readiness
@ApplicationScoped
public class RateLimitHealthCheck implements HealthCheck {

    private final PolicyStore policyStore;
    private final RateLimitStore store;
    private final EmergencyBypassRegistry bypassRegistry;

    @Inject
    public RateLimitHealthCheck(
            PolicyStore policyStore, RateLimitStore store, EmergencyBypassRegistry bypassRegistry) {
        this.policyStore = policyStore;
        this.store = store;
        this.bypassRegistry = bypassRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        final var policy = policyStore.current();
        final var builder = HealthCheckResponse.named("rate-limiting")
                .withData("policy.version", policy.version())
                .withData("policy.source", policy.source())
                .withData("policy.scale", String.valueOf(policyStore.globalScale()))
                .withData("disabled", policyStore.isDisabled())
                .withData("store", store.name())
                .withData("grants", bypassRegistry.backend());
        policyStore.lastLoadError().ifPresent(error -> builder.withData("policy.error", error));
        return builder.up().build();
    }
}
