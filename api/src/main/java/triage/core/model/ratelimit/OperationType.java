package triage.core.model.ratelimit;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of operation classes a request is rate limited under.
 */
public enum OperationType {
    /** General API calls. */
    API_GENERAL,
    /** Medical literature and research queries. */
    MEDICAL_QUERY,
    /** Patient record access. */
    PATIENT_ACCESS,
    /** Document processing and uploads. */
    DOCUMENT_UPLOAD,
    /** Emergency or urgent requests, the only class eligible for bypass by default. */
    EMERGENCY,
    /** Bulk data operations. */
    BULK_OPERATION;

    /**
     * Return the wire value of this operation type.
     *
     * @return lower-case name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse an operation type leniently.
     *
     * @param value the raw operation type
     * @return the operation type, or empty if unrecognized
     */
    public static Optional<OperationType> fromValue(String value) {
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
