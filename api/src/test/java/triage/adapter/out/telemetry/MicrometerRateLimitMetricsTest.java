package triage.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import triage.core.model.ratelimit.DecisionOutcome;

@DisplayName("MicrometerRateLimitMetrics")
class MicrometerRateLimitMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerRateLimitMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerRateLimitMetrics(registry);
    }

    @Test
    @DisplayName("should start every counter at zero")
    void shouldStartAtZero() {
        for (final var outcome : DecisionOutcome.values()) {
            assertEquals(0, metrics.total(outcome));
        }
        assertEquals(0, metrics.storeFailures());
        assertTrue(metrics.breakdown().isEmpty());
    }

    @Test
    @DisplayName("should count totals and the sorted breakdown")
    void shouldCountDecisions() {
        metrics.recordDecision("nurse", "api_general", DecisionOutcome.ALLOWED);
        metrics.recordDecision("nurse", "api_general", DecisionOutcome.ALLOWED);
        metrics.recordDecision("nurse", "api_general", DecisionOutcome.DENIED);
        metrics.recordDecision("doctor", "emergency", DecisionOutcome.EMERGENCY_BYPASS);

        assertEquals(2, metrics.total(DecisionOutcome.ALLOWED));
        assertEquals(1, metrics.total(DecisionOutcome.DENIED));
        assertEquals(1, metrics.total(DecisionOutcome.EMERGENCY_BYPASS));

        final var breakdown = metrics.breakdown();
        assertEquals(List.of("doctor", "nurse"), List.copyOf(breakdown.keySet()));
        assertEquals(Map.of("allowed", 2L, "denied", 1L), breakdown.get("nurse").get("api_general"));
        assertEquals(Map.of("emergency_bypass", 1L), breakdown.get("doctor").get("emergency"));
    }

    @Test
    @DisplayName("should mirror counts to the meter registry")
    void shouldMirrorToRegistry() {
        metrics.recordDecision("doctor", "patient_access", DecisionOutcome.DENIED);
        metrics.recordDecision("doctor", "patient_access", DecisionOutcome.DENIED);
        metrics.recordStoreFailure();

        final var denied = registry.find("triage.ratelimit.decisions")
                .tag("role", "doctor")
                .tag("operation", "patient_access")
                .tag("outcome", "denied")
                .counter();
        assertEquals(2.0, denied.count());
        assertEquals(1.0, registry.find("triage.ratelimit.store.failures").counter().count());
        assertEquals(1, metrics.storeFailures());
    }
}
