package triage.adapter.in.rest;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import triage.adapter.in.dto.EmergencyBypassRequest;
import triage.adapter.in.dto.EmergencyBypassResponse;
import triage.adapter.in.dto.PolicyReloadResponse;
import triage.adapter.in.dto.RateLimitCheckRequest;
import triage.adapter.in.dto.RateLimitDecisionDto;
import triage.core.model.ratelimit.MetricsSnapshot;
import triage.core.model.ratelimit.RateLimitDecision;
import triage.core.service.ratelimit.PolicyStore;
import triage.core.service.ratelimit.RateLimitHeaders;
import triage.core.service.ratelimit.RateLimitService;

/**
 * REST resource for rate limit checks and administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Checking and consuming a request against a subject's limits</li>
 * <li>Granting an emergency bypass</li>
 * <li>Reading decision counters as Prometheus text or JSON</li>
 * <li>Reloading the policy document</li>
 * </ul>
 */
@Path("/rate-limits")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitResource {

    private final RateLimitService rateLimitService;
    private final PolicyStore policyStore;

    public RateLimitResource(RateLimitService rateLimitService, PolicyStore policyStore) {
        this.rateLimitService = rateLimitService;
        this.policyStore = policyStore;
    }

    /**
     * Check a request and consume from the subject's limits.
     *
     * @param request the check request
     * @return 200 with the decision when allowed, 429 with an error body when denied
     */
    @POST
    @Path("/check")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> check(@Valid @NotNull RateLimitCheckRequest request) {
        return rateLimitService
                .check(request.subjectId(), request.role(), request.operation(), request.isEmergency())
                .map(this::toResponse);
    }

    /**
     * Grant an emergency bypass.
     *
     * @param request the bypass request
     * @return 200 when granted, 403 when the role is not privileged
     */
    @POST
    @Path("/emergency-bypass")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> grantEmergencyBypass(@Valid @NotNull EmergencyBypassRequest request) {
        final var duration = request.durationMinutes() != null ? Duration.ofMinutes(request.durationMinutes()) : null;
        return rateLimitService
                .grantEmergencyBypass(request.subjectId(), request.role(), duration, request.reason())
                .map(grant -> grant.map(g -> Response.ok(
                                        new EmergencyBypassResponse(true, g.expiresAt().toString()))
                                .build())
                        .orElseGet(() -> Response.status(Response.Status.FORBIDDEN)
                                .entity(new EmergencyBypassResponse(false, null))
                                .build()));
    }

    /**
     * Decision counters in the Prometheus text format.
     *
     * @return the exposition text
     */
    @GET
    @Path("/metrics")
    @Produces(MediaType.TEXT_PLAIN)
    public Uni<String> metrics() {
        return rateLimitService.metricsExposition();
    }

    /**
     * Decision counters as JSON.
     *
     * @return the snapshot
     */
    @GET
    @Path("/metrics/snapshot")
    public MetricsSnapshot metricsSnapshot() {
        return rateLimitService.metricsSnapshot();
    }

    /**
     * Reload the policy document.
     *
     * @return the policy now in effect
     */
    @POST
    @Path("/policy/reload")
    public PolicyReloadResponse reloadPolicy() {
        final var table = policyStore.reload();
        return new PolicyReloadResponse(
                table.version(), table.source(), policyStore.lastLoadError().orElse(null));
    }

    private Response toResponse(RateLimitDecision decision) {
        final var builder = decision.allowed()
                ? Response.ok(RateLimitDecisionDto.fromModel(decision))
                : Response.status(Response.Status.TOO_MANY_REQUESTS).entity(rateLimitService.exceededBody(decision));
        RateLimitHeaders.render(decision).forEach(builder::header);
        return builder.build();
    }
}
