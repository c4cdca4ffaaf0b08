package triage.core.model.ratelimit;

import java.util.EnumMap;
import java.util.Map;

/**
 * Built-in limits used when no policy document is found, and merged under any document that
 * leaves a subject class or operation type unconfigured.
 *
 * <p>Keep in sync with {@code config/rate_limits.yml}.
 */
public final class DefaultPolicies {

    /** Limit applied to any pair with no explicit or built-in entry, and to unknown classifications. */
    public static final Limit GLOBAL_DEFAULT = Limit.of(30, 900, 5, "Default healthcare rate limit");

    /** Policy version reported when neither the document nor the manifest declares one. */
    public static final String DEFAULT_VERSION = "1";

    /** Policy source reported when the built-in table is in effect. */
    public static final String DEFAULT_SOURCE = "defaults";

    private DefaultPolicies() {}

    /**
     * Build the built-in table.
     *
     * <p>The returned map is partial: pairs without an entry inherit {@link #GLOBAL_DEFAULT}
     * once merged into a {@link PolicyTable}.
     *
     * @return a fresh mutable map of built-in limits
     */
    public static Map<SubjectClass, Map<OperationType, Limit>> limits() {
        final var limits = new EnumMap<SubjectClass, Map<OperationType, Limit>>(SubjectClass.class);

        final var doctor = new EnumMap<OperationType, Limit>(OperationType.class);
        doctor.put(OperationType.API_GENERAL, Limit.of(120, 3600, 20, "High limits for doctors during patient care"));
        doctor.put(OperationType.MEDICAL_QUERY, Limit.of(60, 1800, 15, "Medical literature and research queries"));
        doctor.put(OperationType.PATIENT_ACCESS, Limit.of(180, 5400, 30, "Patient data access during clinical care"));
        doctor.put(OperationType.EMERGENCY, new Limit(300, 7200, 50, true, "Emergency medical situations"));
        limits.put(SubjectClass.DOCTOR, doctor);

        final var nurse = new EnumMap<OperationType, Limit>(OperationType.class);
        nurse.put(OperationType.API_GENERAL, Limit.of(90, 2700, 15, "Nurse workflow support"));
        nurse.put(OperationType.MEDICAL_QUERY, Limit.of(30, 900, 10, "Medical reference lookups"));
        nurse.put(OperationType.PATIENT_ACCESS, Limit.of(120, 3600, 20, "Patient care data access"));
        limits.put(SubjectClass.NURSE, nurse);

        final var receptionist = new EnumMap<OperationType, Limit>(OperationType.class);
        receptionist.put(OperationType.API_GENERAL, Limit.of(60, 1800, 10, "Administrative operations"));
        receptionist.put(OperationType.PATIENT_ACCESS, Limit.of(90, 2700, 15, "Patient scheduling and demographics"));
        limits.put(SubjectClass.RECEPTIONIST, receptionist);

        final var billing = new EnumMap<OperationType, Limit>(OperationType.class);
        billing.put(OperationType.API_GENERAL, Limit.of(45, 1350, 8, "Billing operations"));
        billing.put(OperationType.BULK_OPERATION, Limit.of(20, 600, 5, "Bulk billing data processing"));
        limits.put(SubjectClass.BILLING, billing);

        final var research = new EnumMap<OperationType, Limit>(OperationType.class);
        research.put(OperationType.API_GENERAL, Limit.of(30, 900, 5, "Research data access"));
        research.put(OperationType.MEDICAL_QUERY, Limit.of(45, 1350, 10, "Research literature queries"));
        limits.put(SubjectClass.RESEARCH, research);

        final var admin = new EnumMap<OperationType, Limit>(OperationType.class);
        admin.put(OperationType.API_GENERAL, Limit.of(200, 6000, 40, "Administrative system access"));
        admin.put(OperationType.BULK_OPERATION, Limit.of(100, 3000, 20, "System administration operations"));
        limits.put(SubjectClass.ADMIN, admin);

        return limits;
    }

    /**
     * Build the built-in table as a total policy.
     *
     * @return the default policy table
     */
    public static PolicyTable table() {
        return PolicyTable.merge(Map.of(), limits(), GLOBAL_DEFAULT, DEFAULT_VERSION, DEFAULT_SOURCE);
    }
}
