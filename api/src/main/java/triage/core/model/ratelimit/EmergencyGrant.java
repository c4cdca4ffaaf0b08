package triage.core.model.ratelimit;

import java.time.Instant;

/**
 * A time-boxed exemption from rate limiting for one subject.
 *
 * @param subjectId the exempted subject
 * @param role subject class wire value at grant time
 * @param expiresAt when the exemption ends
 * @param reason free-form reason recorded with the grant
 */
public record EmergencyGrant(String subjectId, String role, Instant expiresAt, String reason) {

    /**
     * Whether the grant still applies at {@code now}.
     *
     * @param now the current instant
     * @return true until {@code expiresAt}
     */
    public boolean isActiveAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
