package triage.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import triage.config.RateLimitingConfig;
import triage.core.model.ratelimit.DecisionOutcome;
import triage.core.model.ratelimit.EmergencyGrant;
import triage.core.model.ratelimit.MetricsSnapshot;
import triage.core.model.ratelimit.OperationType;
import triage.core.model.ratelimit.RateLimitDecision;
import triage.core.model.ratelimit.StoreUnavailableException;
import triage.core.model.ratelimit.SubjectClass;
import triage.core.port.out.RateLimitMetrics;
import triage.core.port.out.RateLimitStore;

/**
 * Entry point for rate limit checks.
 *
 * <p>A check runs in this order:
 * <ol>
 *   <li>An emergency request under a limit that allows bypass grants the subject a bypass
 *       for the default duration and is admitted.</li>
 *   <li>A subject holding an active grant is admitted without touching the store.</li>
 *   <li>Otherwise the store decides, bounded by the store timeout.</li>
 * </ol>
 *
 * <p>No failure escapes {@link #check}: a store that fails or does not answer in time yields the
 * fallback decision, and a failed grant lookup falls through to normal limiting.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    static final String UNKNOWN = "unknown";
    static final String ANONYMOUS = "anonymous";
    static final String EMERGENCY_REASON = "Emergency request";

    private final PolicyStore policyStore;
    private final RateLimitStore store;
    private final EmergencyBypassRegistry bypassRegistry;
    private final RateLimitMetrics metrics;
    private final Clock clock;
    private final Duration storeTimeout;
    private final boolean failOpen;

    @Inject
    public RateLimitService(
            PolicyStore policyStore,
            RateLimitStore store,
            EmergencyBypassRegistry bypassRegistry,
            RateLimitMetrics metrics,
            Clock clock,
            RateLimitingConfig config) {
        this(policyStore, store, bypassRegistry, metrics, clock, config.storeTimeout(), config.failOpen());
    }

    public RateLimitService(
            PolicyStore policyStore,
            RateLimitStore store,
            EmergencyBypassRegistry bypassRegistry,
            RateLimitMetrics metrics,
            Clock clock,
            Duration storeTimeout,
            boolean failOpen) {
        this.policyStore = policyStore;
        this.store = store;
        this.bypassRegistry = bypassRegistry;
        this.metrics = metrics;
        this.clock = clock;
        this.storeTimeout = storeTimeout;
        this.failOpen = failOpen;
        LOG.infov(
                "Rate limiter initialized (store={0}, grants={1}, policy_version={2}, source={3})",
                store.name(), bypassRegistry.backend(), policyStore.current().version(), policyStore.current().source());
    }

    /**
     * Check a request with a known classification.
     *
     * @param subjectId opaque subject identifier
     * @param role the subject class
     * @param operation the operation type
     * @param emergency whether the caller flagged the request as an emergency
     * @return the decision, never a failure
     */
    public Uni<RateLimitDecision> check(
            String subjectId, SubjectClass role, OperationType operation, boolean emergency) {
        return check(
                subjectId,
                role != null ? role.value() : null,
                operation != null ? operation.value() : null,
                emergency);
    }

    /**
     * Check a request with a raw classification.
     *
     * <p>An unrecognized role or operation is limited by the global default limit under the
     * single classification {@code unknown}, so inventing new values never yields a fresh
     * bucket. The raw value only appears in the log.
     *
     * @param subjectId opaque subject identifier
     * @param role the role as presented
     * @param operation the operation as presented
     * @param emergency whether the caller flagged the request as an emergency
     * @return the decision, never a failure
     */
    public Uni<RateLimitDecision> check(String subjectId, String role, String operation, boolean emergency) {
        final var subject = subjectKey(subjectId);
        final var subjectClass = SubjectClass.fromValue(role);
        final var operationType = OperationType.fromValue(operation);
        if (subjectClass.isEmpty() || operationType.isEmpty()) {
            LOG.warnf(
                    "Unrecognized classification for %s (role=%s, operation=%s), applying the default limit",
                    printable(subject), printable(role), printable(operation));
        }
        final var roleValue = subjectClass.map(SubjectClass::value).orElse(UNKNOWN);
        final var operationValue = operationType.map(OperationType::value).orElse(UNKNOWN);
        final var policy = policyStore.current();
        final var limit = policy.resolve(subjectClass, operationType);
        final var context = new RateLimitDecision.Context(
                roleValue, operationValue, limit, policy.version(), policy.source());

        if (emergency && limit.emergencyBypassAllowed()) {
            return bypassRegistry
                    .record(subject, roleValue, null, EMERGENCY_REASON)
                    .ifNoItem()
                    .after(storeTimeout)
                    .fail()
                    .map(grant -> {
                        metrics.recordDecision(roleValue, operationValue, DecisionOutcome.EMERGENCY_BYPASS);
                        return RateLimitDecision.bypass(context, grant.expiresAt());
                    })
                    .onFailure()
                    .recoverWithUni(error -> {
                        LOG.warnv(error, "Emergency grant for {0} could not be stored, applying normal limits", subject);
                        return admit(subject, context);
                    });
        }

        return bypassRegistry
                .activeGrant(subject)
                .ifNoItem()
                .after(storeTimeout)
                .fail()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Emergency grant lookup for {0} failed, applying normal limits", subject);
                    return Optional.empty();
                })
                .flatMap(grant -> grant.isPresent()
                        ? Uni.createFrom().item(RateLimitDecision.bypass(context, grant.get().expiresAt()))
                        : admit(subject, context));
    }

    /**
     * Grant an emergency bypass to a privileged subject.
     *
     * @param subjectId the subject
     * @param role the subject's role as presented
     * @param duration grant duration, or null for the default
     * @param reason free-form reason
     * @return the grant, or empty if the role is not privileged
     */
    public Uni<Optional<EmergencyGrant>> grantEmergencyBypass(
            String subjectId, String role, Duration duration, String reason) {
        return bypassRegistry.grant(subjectKey(subjectId), role, duration, reason);
    }

    /**
     * Build the body returned with a denial.
     *
     * @param decision a denied decision
     * @return the body
     */
    public RateLimitExceededBody exceededBody(RateLimitDecision decision) {
        return RateLimitExceededBody.from(decision, bypassRegistry.isPrivileged(decision.role()));
    }

    /**
     * Return the decision counters with the policy in effect.
     *
     * @return the snapshot
     */
    public MetricsSnapshot metricsSnapshot() {
        final var allowed = metrics.total(DecisionOutcome.ALLOWED);
        final var denied = metrics.total(DecisionOutcome.DENIED);
        final var decided = allowed + denied;
        final var policy = policyStore.current();
        return new MetricsSnapshot(
                new MetricsSnapshot.Summary(
                        allowed,
                        denied,
                        metrics.total(DecisionOutcome.EMERGENCY_BYPASS),
                        metrics.storeFailures(),
                        decided == 0 ? 1.0 : (double) allowed / decided),
                metrics.breakdown(),
                policy.version(),
                policy.source());
    }

    /**
     * Render the decision counters in the Prometheus text format.
     *
     * @return the exposition text
     */
    public Uni<String> metricsExposition() {
        return bypassRegistry
                .activeCount()
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(error, "Failed to count active emergency grants");
                    return 0L;
                })
                .map(active -> RateLimitExposition.render(
                        metrics, policyStore.current(), policyStore.isDisabled(), active));
    }

    private Uni<RateLimitDecision> admit(String subjectId, RateLimitDecision.Context context) {
        final var now = clock.instant();
        return Uni.createFrom()
                .deferred(() -> store.admit(subjectId, context.operation(), context.limit(), now.toEpochMilli()))
                .ifNoItem()
                .after(storeTimeout)
                .failWith(() -> new StoreUnavailableException(
                        "Rate limit store did not answer within " + storeTimeout.toMillis() + "ms"))
                .map(result -> RateLimitDecision.fromAdmission(context, result, now))
                .onFailure()
                .recoverWithItem(error -> unavailable(subjectId, context, now, error))
                .invoke(decision -> {
                    if (decision.degraded()) {
                        return;
                    }
                    if (decision.allowed()) {
                        metrics.recordDecision(context.role(), context.operation(), DecisionOutcome.ALLOWED);
                        return;
                    }
                    metrics.recordDecision(context.role(), context.operation(), DecisionOutcome.DENIED);
                    LOG.warnf(
                            "Rate limit exceeded - subject=%s, role=%s, operation=%s, retry_after=%ds",
                            subjectId, context.role(), context.operation(), decision.retryAfterSeconds());
                });
    }

    private RateLimitDecision unavailable(
            String subjectId, RateLimitDecision.Context context, Instant now, Throwable error) {
        metrics.recordStoreFailure();
        LOG.warnv(
                error,
                "Rate limit store unavailable for {0}/{1}, {2} request",
                subjectId, context.operation(), failOpen ? "allowing" : "denying");
        return RateLimitDecision.unavailable(context, failOpen, now);
    }

    private static String subjectKey(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            return ANONYMOUS;
        }
        return subjectId.trim();
    }

    private static String printable(String value) {
        if (value == null) {
            return null;
        }
        final var shortened = value.length() > 64 ? value.substring(0, 64) + "..." : value;
        return shortened.replaceAll("\\p{Cntrl}", "?");
    }
}
