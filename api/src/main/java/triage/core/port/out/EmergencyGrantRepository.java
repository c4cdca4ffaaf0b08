package triage.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import triage.core.model.ratelimit.EmergencyGrant;

/**
 * Port interface for emergency grant storage.
 *
 * <p>At most one grant is kept per subject; saving replaces any previous grant.
 */
public interface EmergencyGrantRepository {

    /**
     * Store a grant.
     *
     * @param grant the grant
     * @return completion signal
     */
    Uni<Void> save(EmergencyGrant grant);

    /**
     * Find the grant for a subject, expired or not.
     *
     * @param subjectId the subject
     * @return the grant, if any
     */
    Uni<Optional<EmergencyGrant>> find(String subjectId);

    /**
     * Remove the grant for a subject.
     *
     * @param subjectId the subject
     * @return completion signal
     */
    Uni<Void> delete(String subjectId);

    /**
     * Count grants still active at {@code now}.
     *
     * @param now the current instant
     * @return the number of active grants
     */
    Uni<Long> countActive(Instant now);

    /**
     * Remove grants that expired at or before {@code now}.
     *
     * @param now the current instant
     * @return the number of grants removed
     */
    Uni<Integer> removeExpired(Instant now);

    /**
     * Return the backend name for logging and health reporting.
     *
     * @return the backend name
     */
    String name();
}
