package triage.adapter.out.telemetry;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import triage.core.model.ratelimit.DecisionOutcome;
import triage.core.port.out.RateLimitMetrics;

/**
 * Decision counters kept in process and mirrored to Micrometer.
 *
 * <p>The in-process counters back the snapshot and exposition endpoints; Micrometer carries the
 * same counts to whatever registry is configured.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code triage.ratelimit.decisions} - Decisions by role, operation and outcome</li>
 *   <li>{@code triage.ratelimit.store.failures} - Checks decided without the store</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerRateLimitMetrics implements RateLimitMetrics {

    private final MeterRegistry registry;
    private final Map<DecisionOutcome, LongAdder> totals = new EnumMap<>(DecisionOutcome.class);
    private final ConcurrentMap<BreakdownKey, LongAdder> breakdown = new ConcurrentHashMap<>();
    private final LongAdder storeFailures = new LongAdder();

    private record BreakdownKey(String role, String operation, DecisionOutcome outcome) {}

    @Inject
    public MicrometerRateLimitMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (final var outcome : DecisionOutcome.values()) {
            totals.put(outcome, new LongAdder());
        }
    }

    @Override
    public void recordDecision(String role, String operation, DecisionOutcome outcome) {
        totals.get(outcome).increment();
        breakdown
                .computeIfAbsent(new BreakdownKey(role, operation, outcome), k -> new LongAdder())
                .increment();

        Counter.builder("triage.ratelimit.decisions")
                .description("Rate limit decisions")
                .tag("role", role)
                .tag("operation", operation)
                .tag("outcome", outcome.value())
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure() {
        storeFailures.increment();

        Counter.builder("triage.ratelimit.store.failures")
                .description("Rate limit checks decided without the coordination store")
                .register(registry)
                .increment();
    }

    @Override
    public long total(DecisionOutcome outcome) {
        return totals.get(outcome).sum();
    }

    @Override
    public long storeFailures() {
        return storeFailures.sum();
    }

    @Override
    public Map<String, Map<String, Map<String, Long>>> breakdown() {
        final var result = new TreeMap<String, Map<String, Map<String, Long>>>();
        breakdown.forEach((key, count) -> result.computeIfAbsent(key.role(), r -> new TreeMap<>())
                .computeIfAbsent(key.operation(), o -> new TreeMap<>())
                .put(key.outcome().value(), count.sum()));
        return result;
    }
}
