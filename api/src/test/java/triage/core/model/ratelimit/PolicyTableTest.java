package triage.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PolicyTable")
class PolicyTableTest {

    @Test
    @DisplayName("default table should resolve every pair")
    void defaultTableShouldBeTotal() {
        var table = DefaultPolicies.table();

        for (var subject : SubjectClass.values()) {
            for (var operation : OperationType.values()) {
                assertNotNull(table.resolve(subject, operation), subject + "/" + operation);
            }
        }
        assertEquals(DefaultPolicies.DEFAULT_SOURCE, table.source());
        assertEquals("1", table.version());
    }

    @Test
    @DisplayName("should carry the built-in doctor limits")
    void shouldCarryBuiltInDoctorLimits() {
        var table = DefaultPolicies.table();

        var patientAccess = table.resolve(SubjectClass.DOCTOR, OperationType.PATIENT_ACCESS);
        assertEquals(180, patientAccess.requestsPerMinute());
        assertEquals(5400, patientAccess.requestsPerHour());
        assertEquals(30, patientAccess.burstCapacity());

        var emergency = table.resolve(SubjectClass.DOCTOR, OperationType.EMERGENCY);
        assertTrue(emergency.emergencyBypassAllowed());
        assertFalse(table.resolve(SubjectClass.BILLING, OperationType.EMERGENCY).emergencyBypassAllowed());
    }

    @Test
    @DisplayName("should fall back to the global default for unlisted pairs and unknown values")
    void shouldFallBackToGlobalDefault() {
        var table = DefaultPolicies.table();

        assertSame(DefaultPolicies.GLOBAL_DEFAULT, table.resolve(SubjectClass.BILLING, OperationType.EMERGENCY));
        assertSame(
                DefaultPolicies.GLOBAL_DEFAULT,
                table.resolve(Optional.empty(), Optional.of(OperationType.API_GENERAL)));
        assertSame(
                DefaultPolicies.GLOBAL_DEFAULT, table.resolve(Optional.of(SubjectClass.NURSE), Optional.empty()));
    }

    @Test
    @DisplayName("explicit entries should win over built-in entries for the same pair only")
    void explicitEntriesShouldWin() {
        var explicit = Map.of(
                SubjectClass.NURSE,
                Map.of(OperationType.MEDICAL_QUERY, Limit.of(99, 999, 9, "override")));

        var table = PolicyTable.merge(
                explicit, DefaultPolicies.limits(), DefaultPolicies.GLOBAL_DEFAULT, "7", "/etc/rate_limits.yml");

        assertEquals(99, table.resolve(SubjectClass.NURSE, OperationType.MEDICAL_QUERY).requestsPerMinute());
        assertEquals(120, table.resolve(SubjectClass.NURSE, OperationType.PATIENT_ACCESS).requestsPerMinute());
        assertEquals("7", table.version());
        assertEquals("/etc/rate_limits.yml", table.source());
    }

    @Test
    @DisplayName("mapLimits should transform every limit including the default")
    void mapLimitsShouldTransformEverything() {
        var table = DefaultPolicies.table().mapLimits(Limit::unlimited);

        for (var subject : SubjectClass.values()) {
            for (var operation : OperationType.values()) {
                assertEquals(Limit.UNLIMITED_BURST_CAPACITY, table.resolve(subject, operation).burstCapacity());
            }
        }
        assertEquals(Limit.UNLIMITED_REQUESTS_PER_MINUTE, table.defaultLimit().requestsPerMinute());
    }
}
