package triage.core.port.out;

import java.util.Map;

import triage.core.model.ratelimit.DecisionOutcome;

/**
 * Port interface for rate limit decision counters.
 *
 * <p>Counters are monotonic for the life of the process.
 */
public interface RateLimitMetrics {

    /**
     * Count one decision.
     *
     * @param role subject class wire value, or {@code unknown}
     * @param operation operation type wire value, or {@code unknown}
     * @param outcome the outcome
     */
    void recordDecision(String role, String operation, DecisionOutcome outcome);

    /**
     * Count one check decided without the store.
     */
    void recordStoreFailure();

    /**
     * Total decisions with an outcome.
     *
     * @param outcome the outcome
     * @return the count
     */
    long total(DecisionOutcome outcome);

    /**
     * Total checks decided without the store.
     *
     * @return the count
     */
    long storeFailures();

    /**
     * Counts by role, then operation, then outcome label.
     *
     * @return a sorted copy of the counters
     */
    Map<String, Map<String, Map<String, Long>>> breakdown();
}
