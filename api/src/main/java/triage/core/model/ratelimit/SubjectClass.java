package triage.core.model.ratelimit;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of subject tiers a rate limit policy is keyed by.
 *
 * <p>The wire value is the lower-case constant name ({@code doctor}, {@code nurse}, ...), as used
 * in policy documents, request payloads and metric labels.
 */
public enum SubjectClass {
    ADMIN,
    DOCTOR,
    NURSE,
    RECEPTIONIST,
    BILLING,
    RESEARCH;

    /**
     * Return the wire value of this subject class.
     *
     * @return lower-case name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a subject class leniently.
     *
     * <p>Accepts the wire value or the constant name in any case. Unrecognized or blank input
     * yields an empty result, which callers resolve to the global default limit.
     *
     * @param value the raw role
     * @return the subject class, if recognized
     */
    public static Optional<SubjectClass> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        for (final var candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
