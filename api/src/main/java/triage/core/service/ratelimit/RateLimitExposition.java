package triage.core.service.ratelimit;

import triage.core.model.ratelimit.DecisionOutcome;
import triage.core.model.ratelimit.PolicyTable;
import triage.core.port.out.RateLimitMetrics;

/**
 * Renders decision counters in the Prometheus text format.
 *
 * <p>When limiting is disabled only the disabled flag and the policy info line are emitted.
 */
final class RateLimitExposition {

    private RateLimitExposition() {}

    static String render(RateLimitMetrics metrics, PolicyTable policy, boolean disabled, long activeGrants) {
        final var out = new StringBuilder();
        if (disabled) {
            out.append("# HELP triage_rate_limit_disabled Rate limiter disabled flag (1=disabled)\n");
            out.append("# TYPE triage_rate_limit_disabled gauge\n");
            out.append("triage_rate_limit_disabled 1\n");
            appendPolicyInfo(out, policy);
            return out.toString();
        }

        out.append("# HELP triage_rate_limit_total Requests allowed/denied counters\n");
        out.append("# TYPE triage_rate_limit_total counter\n");
        for (final var outcome : DecisionOutcome.values()) {
            out.append("triage_rate_limit_total{outcome=\"")
                    .append(outcome.value())
                    .append("\"} ")
                    .append(metrics.total(outcome))
                    .append('\n');
        }

        out.append("# HELP triage_rate_limit_breakdown_total Decisions by role, operation type and outcome\n");
        out.append("# TYPE triage_rate_limit_breakdown_total counter\n");
        metrics.breakdown().forEach((role, operations) -> operations.forEach((operation, outcomes) ->
                outcomes.forEach((outcome, count) -> out.append("triage_rate_limit_breakdown_total{role=\"")
                        .append(escape(role))
                        .append("\",type=\"")
                        .append(escape(operation))
                        .append("\",outcome=\"")
                        .append(outcome)
                        .append("\"} ")
                        .append(count)
                        .append('\n'))));

        out.append("# HELP triage_rate_limit_store_failures_total Checks decided without the coordination store\n");
        out.append("# TYPE triage_rate_limit_store_failures_total counter\n");
        out.append("triage_rate_limit_store_failures_total ").append(metrics.storeFailures()).append('\n');

        appendPolicyInfo(out, policy);

        out.append("# HELP triage_active_emergency_bypass Active emergency bypass sessions\n");
        out.append("# TYPE triage_active_emergency_bypass gauge\n");
        out.append("triage_active_emergency_bypass ").append(activeGrants).append('\n');
        return out.toString();
    }

    private static void appendPolicyInfo(StringBuilder out, PolicyTable policy) {
        out.append("# HELP triage_rate_limit_policy_info Rate limit policy in effect\n");
        out.append("# TYPE triage_rate_limit_policy_info gauge\n");
        out.append("triage_rate_limit_policy_info{policy_version=\"")
                .append(escape(policy.version()))
                .append("\",source=\"")
                .append(escape(policy.source()))
                .append("\"} 1\n");
    }

    // Label values may carry user input
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
