package triage.core.service.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import triage.core.model.ratelimit.ConfigLoadException;
import triage.core.model.ratelimit.DefaultPolicies;
import triage.core.model.ratelimit.Limit;
import triage.core.model.ratelimit.OperationType;
import triage.core.model.ratelimit.PolicyDocument;
import triage.core.model.ratelimit.SubjectClass;
import triage.core.port.out.PolicyDocumentLoader;

@DisplayName("PolicyStore")
@ExtendWith(MockitoExtension.class)
class PolicyStoreTest {

    @Mock
    private PolicyDocumentLoader loader;

    private static PolicyDocument document(SubjectClass subject, OperationType operation, Limit limit) {
        final var row = new EnumMap<OperationType, Limit>(OperationType.class);
        row.put(operation, limit);
        final var limits = new EnumMap<SubjectClass, Map<OperationType, Limit>>(SubjectClass.class);
        limits.put(subject, row);
        return new PolicyDocument(limits, Optional.of("7"), "/etc/triage/rate_limits.yml");
    }

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("should use the built-in table when no document is found")
        void shouldUseDefaultsWhenNoDocument() throws Exception {
            when(loader.load()).thenReturn(Optional.empty());

            final var store = new PolicyStore(loader, "1.0", false);

            assertEquals(DefaultPolicies.DEFAULT_SOURCE, store.current().source());
            assertEquals(
                    Limit.of(180, 5400, 30, "Patient data access during clinical care"),
                    store.resolve(SubjectClass.DOCTOR, OperationType.PATIENT_ACCESS));
            assertTrue(store.lastLoadError().isEmpty());
        }

        @Test
        @DisplayName("should merge document entries over the built-in table")
        void shouldMergeDocumentOverDefaults() throws Exception {
            final var custom = Limit.of(10, 100, 2, "custom");
            when(loader.load()).thenReturn(Optional.of(
                    document(SubjectClass.NURSE, OperationType.API_GENERAL, custom)));

            final var store = new PolicyStore(loader, "1.0", false);

            assertEquals(custom, store.resolve(SubjectClass.NURSE, OperationType.API_GENERAL));
            assertEquals(
                    Limit.of(120, 3600, 20, "Patient care data access"),
                    store.resolve(SubjectClass.NURSE, OperationType.PATIENT_ACCESS));
            assertEquals("7", store.current().version());
            assertEquals("/etc/triage/rate_limits.yml", store.current().source());
        }

        @Test
        @DisplayName("should fall back to defaults and keep the error when the document is unreadable")
        void shouldFallBackOnLoadError() throws Exception {
            when(loader.load()).thenThrow(new ConfigLoadException("bad yaml"));

            final var store = new PolicyStore(loader, "1.0", false);

            assertEquals(DefaultPolicies.DEFAULT_SOURCE, store.current().source());
            assertEquals(Optional.of("bad yaml"), store.lastLoadError());
        }

        @Test
        @DisplayName("should swap in a new table on reload and clear the last error")
        void shouldSwapTableOnReload() throws Exception {
            final var custom = Limit.of(10, 100, 2, "custom");
            when(loader.load())
                    .thenThrow(new ConfigLoadException("missing"))
                    .thenReturn(Optional.of(document(SubjectClass.ADMIN, OperationType.BULK_OPERATION, custom)));

            final var store = new PolicyStore(loader, "1.0", false);
            final var before = store.current();
            final var after = store.reload();

            assertSame(after, store.current());
            assertEquals(Limit.of(100, 3000, 20, "System administration operations"),
                    before.resolve(SubjectClass.ADMIN, OperationType.BULK_OPERATION));
            assertEquals(custom, after.resolve(SubjectClass.ADMIN, OperationType.BULK_OPERATION));
            assertTrue(store.lastLoadError().isEmpty());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class OverrideTests {

        @Test
        @DisplayName("should scale every limit including the global default")
        void shouldScaleLimits() throws Exception {
            when(loader.load()).thenReturn(Optional.empty());

            final var store = new PolicyStore(loader, "0.5", false);

            final var limit = store.resolve(SubjectClass.DOCTOR, OperationType.PATIENT_ACCESS);
            assertEquals(90, limit.requestsPerMinute());
            assertEquals(2700, limit.requestsPerHour());
            assertEquals(15, limit.burstCapacity());
            assertEquals(15, store.current().defaultLimit().requestsPerMinute());
        }

        @Test
        @DisplayName("should make every limit unlimited when disabled, keeping bypass eligibility")
        void shouldDisableLimits() throws Exception {
            when(loader.load()).thenReturn(Optional.empty());

            final var store = new PolicyStore(loader, "2.0", true);

            final var emergency = store.resolve(SubjectClass.DOCTOR, OperationType.EMERGENCY);
            assertEquals(Limit.UNLIMITED_BURST_CAPACITY, emergency.burstCapacity());
            assertTrue(emergency.emergencyBypassAllowed());
            assertEquals(Limit.UNLIMITED_REQUESTS_PER_MINUTE,
                    store.resolve(Optional.empty(), Optional.empty()).requestsPerMinute());
            assertTrue(store.isDisabled());
        }
    }

    @Nested
    @DisplayName("parseScale()")
    class ParseScaleTests {

        @ParameterizedTest
        @NullSource
        @ValueSource(strings = {"", "abc", "0", "-1.5", "NaN", "Infinity"})
        @DisplayName("should fall back to 1.0 for values that are not positive numbers")
        void shouldFallBackForInvalidScale(String raw) {
            assertEquals(1.0, PolicyStore.parseScale(raw));
        }

        @Test
        @DisplayName("should accept positive numbers")
        void shouldAcceptPositiveNumbers() {
            assertEquals(0.25, PolicyStore.parseScale(" 0.25 "));
            assertEquals(3.0, PolicyStore.parseScale("3"));
            assertFalse(PolicyStore.parseScale("2") == 1.0);
        }
    }
}
