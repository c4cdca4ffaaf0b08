package triage.core.service.ratelimit;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import triage.config.RateLimitingConfig;
import triage.core.model.ratelimit.ConfigLoadException;
import triage.core.model.ratelimit.DefaultPolicies;
import triage.core.model.ratelimit.Limit;
import triage.core.model.ratelimit.OperationType;
import triage.core.model.ratelimit.PolicyTable;
import triage.core.model.ratelimit.SubjectClass;
import triage.core.port.out.PolicyDocumentLoader;

/**
 * Holds the policy table in effect.
 *
 * <p>Each load builds a complete table (document entries merged over the built-in defaults,
 * then scaled or disabled) and swaps it in atomically, so readers always see one whole
 * generation. Load failures fall back to the built-in defaults and never propagate.
 */
@ApplicationScoped
public class PolicyStore {

    private static final Logger LOG = Logger.getLogger(PolicyStore.class);

    private final PolicyDocumentLoader loader;
    private final double globalScale;
    private final boolean disabled;
    private final AtomicReference<PolicyTable> current = new AtomicReference<>();
    private volatile String lastLoadError;

    @Inject
    public PolicyStore(PolicyDocumentLoader loader, RateLimitingConfig config) {
        this(loader, config.globalScale(), config.disabled());
    }

    public PolicyStore(PolicyDocumentLoader loader, String globalScale, boolean disabled) {
        this.loader = loader;
        this.globalScale = parseScale(globalScale);
        this.disabled = disabled;
        if (disabled) {
            LOG.warn("Rate limiting disabled, every limit is effectively unlimited");
        }
        reload();
    }

    /**
     * Parse a global scale factor.
     *
     * @param raw the configured value
     * @return the factor, or 1.0 if {@code raw} is not a positive number
     */
    public static double parseScale(String raw) {
        if (raw != null) {
            try {
                final var scale = Double.parseDouble(raw.trim());
                if (scale > 0 && !Double.isInfinite(scale)) {
                    return scale;
                }
            } catch (NumberFormatException e) {
                LOG.debugf("Unparsable scale factor %s", raw);
            }
        }
        LOG.warnf("InvalidScaleFactor: global scale %s is not a positive number, using 1.0", raw);
        return 1.0;
    }

    /**
     * Load the policy document and swap in a new table.
     *
     * @return the table now in effect
     */
    public PolicyTable reload() {
        PolicyTable table;
        String error = null;
        try {
            table = loader.load()
                    .map(document -> PolicyTable.merge(
                            document.limits(),
                            DefaultPolicies.limits(),
                            DefaultPolicies.GLOBAL_DEFAULT,
                            document.version().orElse(DefaultPolicies.DEFAULT_VERSION),
                            document.source()))
                    .orElseGet(DefaultPolicies::table);
        } catch (ConfigLoadException e) {
            LOG.warnv(e, "Failed to load rate limit policy, using built-in defaults: {0}", e.getMessage());
            error = e.getMessage();
            table = DefaultPolicies.table();
        }

        final var effective = applyOverrides(table);
        current.set(effective);
        lastLoadError = error;
        LOG.infov(
                "Loaded rate limit policy from {0} (scale={1}, policy_version={2}, disabled={3})",
                effective.source(), globalScale, effective.version(), disabled);
        return effective;
    }

    /**
     * Return the table in effect.
     *
     * @return the current table
     */
    public PolicyTable current() {
        return current.get();
    }

    public Limit resolve(SubjectClass subject, OperationType operation) {
        return current().resolve(subject, operation);
    }

    public Limit resolve(Optional<SubjectClass> subject, Optional<OperationType> operation) {
        return current().resolve(subject, operation);
    }

    /**
     * Return the error of the most recent load, if it failed.
     *
     * @return the error message, empty after a successful load
     */
    public Optional<String> lastLoadError() {
        return Optional.ofNullable(lastLoadError);
    }

    public double globalScale() {
        return globalScale;
    }

    public boolean isDisabled() {
        return disabled;
    }

    private PolicyTable applyOverrides(PolicyTable table) {
        if (disabled) {
            return table.mapLimits(Limit::unlimited);
        }
        if (globalScale != 1.0) {
            return table.mapLimits(limit -> limit.scaled(globalScale));
        }
        return table;
    }
}
