package triage.core.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import triage.config.RateLimitingConfig;
import triage.core.model.ratelimit.EmergencyGrant;
import triage.core.model.ratelimit.SubjectClass;
import triage.core.port.out.EmergencyGrantRepository;

/**
 * Time-boxed emergency exemptions from rate limiting.
 *
 * <p>Explicit grants are restricted to privileged subject classes. Grants triggered by an
 * emergency request are gated by the limit's bypass flag instead and use {@link #record}.
 */
@ApplicationScoped
public class EmergencyBypassRegistry {

    private static final Logger LOG = Logger.getLogger(EmergencyBypassRegistry.class);

    private final EmergencyGrantRepository repository;
    private final Set<SubjectClass> privilegedRoles;
    private final Duration defaultDuration;
    private final Clock clock;

    @Inject
    public EmergencyBypassRegistry(EmergencyGrantRepository repository, RateLimitingConfig config, Clock clock) {
        this(
                repository,
                parseRoles(config.bypass().privilegedRoles()),
                Duration.ofMinutes(config.emergencyDefaultMinutes()),
                clock);
    }

    public EmergencyBypassRegistry(
            EmergencyGrantRepository repository,
            Set<SubjectClass> privilegedRoles,
            Duration defaultDuration,
            Clock clock) {
        this.repository = repository;
        this.privilegedRoles = privilegedRoles.isEmpty()
                ? EnumSet.noneOf(SubjectClass.class)
                : EnumSet.copyOf(privilegedRoles);
        this.defaultDuration = defaultDuration;
        this.clock = clock;
    }

    /**
     * Grant a bypass if the role is privileged.
     *
     * @param subjectId the subject
     * @param role the subject's role as presented
     * @param duration grant duration, or null for the default
     * @param reason free-form reason
     * @return the grant, or empty if the role is not privileged
     */
    public Uni<Optional<EmergencyGrant>> grant(String subjectId, String role, Duration duration, String reason) {
        if (!isPrivileged(role)) {
            LOG.warnf("Emergency bypass denied - insufficient role: subject=%s, role=%s", subjectId, role);
            return Uni.createFrom().item(Optional.empty());
        }
        return record(subjectId, role, duration, reason).map(Optional::of);
    }

    /**
     * Store a grant without a role check.
     *
     * @param subjectId the subject
     * @param role the subject's role as presented
     * @param duration grant duration, or null for the default
     * @param reason free-form reason
     * @return the stored grant
     */
    public Uni<EmergencyGrant> record(String subjectId, String role, Duration duration, String reason) {
        final var effective = duration != null && !duration.isNegative() && !duration.isZero()
                ? duration
                : defaultDuration;
        final var grant = new EmergencyGrant(
                subjectId,
                role != null ? role : "",
                clock.instant().plus(effective),
                reason != null ? reason : "Medical emergency");
        return repository.save(grant).replaceWith(grant).invoke(() -> LOG.infof(
                "Emergency bypass activated - subject=%s, role=%s, duration=%dm, reason=%s",
                subjectId, grant.role(), effective.toMinutes(), grant.reason()));
    }

    /**
     * Find the active grant for a subject, pruning it if it has expired.
     *
     * @param subjectId the subject
     * @return the active grant, if any
     */
    public Uni<Optional<EmergencyGrant>> activeGrant(String subjectId) {
        return repository.find(subjectId).flatMap(grant -> {
            if (grant.isEmpty()) {
                return Uni.createFrom().item(Optional.<EmergencyGrant>empty());
            }
            if (grant.get().isActiveAt(clock.instant())) {
                return Uni.createFrom().item(grant);
            }
            return repository.delete(subjectId).replaceWith(Optional.<EmergencyGrant>empty());
        });
    }

    /**
     * Count grants active now.
     *
     * @return the number of active grants
     */
    public Uni<Long> activeCount() {
        return repository.countActive(clock.instant());
    }

    /**
     * Remove every expired grant.
     *
     * @return the number of grants removed
     */
    public Uni<Integer> sweep() {
        return repository.removeExpired(clock.instant());
    }

    /**
     * Whether a role may request a bypass.
     *
     * @param role the role as presented
     * @return true if the role is privileged
     */
    public boolean isPrivileged(String role) {
        return SubjectClass.fromValue(role).map(privilegedRoles::contains).orElse(false);
    }

    public String backend() {
        return repository.name();
    }

    static Set<SubjectClass> parseRoles(Collection<String> roles) {
        final var parsed = EnumSet.noneOf(SubjectClass.class);
        for (final var role : roles) {
            SubjectClass.fromValue(role)
                    .ifPresentOrElse(
                            parsed::add, () -> LOG.warnf("Ignoring unknown privileged role: %s", role));
        }
        return parsed;
    }
}
