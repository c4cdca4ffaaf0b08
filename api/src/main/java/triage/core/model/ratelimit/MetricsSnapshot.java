package triage.core.model.ratelimit;

import java.util.Map;

/**
 * Point-in-time view of the decision counters.
 *
 * @param summary totals across all subjects
 * @param breakdown counts by role, then operation, then outcome
 * @param policyVersion version of the policy in effect
 * @param source origin of the policy in effect
 */
public record MetricsSnapshot(
        Summary summary, Map<String, Map<String, Map<String, Long>>> breakdown, String policyVersion, String source) {

    /**
     * Decision totals.
     *
     * @param allowed requests admitted by the limiter
     * @param denied requests rejected by the limiter
     * @param emergencyBypass emergency grants triggered by a request
     * @param storeFailures checks decided without the store
     * @param allowRate {@code allowed / (allowed + denied)}, 1.0 before any decision
     */
    public record Summary(long allowed, long denied, long emergencyBypass, long storeFailures, double allowRate) {}
}
