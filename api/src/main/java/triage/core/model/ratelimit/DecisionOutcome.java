package triage.core.model.ratelimit;

import java.util.Locale;

/**
 * Outcome label recorded for each decision.
 */
public enum DecisionOutcome {
    ALLOWED,
    DENIED,
    EMERGENCY_BYPASS;

    /**
     * Return the label used in metrics.
     *
     * @return lower-case name
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
