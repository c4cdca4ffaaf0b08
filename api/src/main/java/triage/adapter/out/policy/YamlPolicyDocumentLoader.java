package triage.adapter.out.policy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import triage.config.RateLimitingConfig;
import triage.core.model.ratelimit.ConfigLoadException;
import triage.core.model.ratelimit.Limit;
import triage.core.model.ratelimit.OperationType;
import triage.core.model.ratelimit.PolicyDocument;
import triage.core.model.ratelimit.SubjectClass;
import triage.core.port.out.PolicyDocumentLoader;

/**
 * Reads the policy document from YAML.
 *
 * <p>Expected shape:
 * <pre>{@code
 * version: "3"
 * roles:
 *   DOCTOR:
 *     patient_access: { rpm: 180, rph: 5400, burst: 30 }
 *     emergency: { rpm: 300, rph: 7200, burst: 50, emergency_bypass: true }
 * }</pre>
 *
 * <p>Role and operation keys are matched case-insensitively. Entries with an unknown key or a
 * missing or non-positive number are skipped and logged; the rest of the document still applies.
 */
@ApplicationScoped
public class YamlPolicyDocumentLoader implements PolicyDocumentLoader {

    private static final Logger LOG = Logger.getLogger(YamlPolicyDocumentLoader.class);

    private final PolicyDocumentLocator locator;
    private final ObjectMapper yamlMapper;

    @Inject
    public YamlPolicyDocumentLoader(RateLimitingConfig config) {
        this(config.policy().path(), Path.of(config.policy().discoveryRoot()));
    }

    public YamlPolicyDocumentLoader(Optional<String> explicitPath, Path discoveryRoot) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.locator = new PolicyDocumentLocator(explicitPath, discoveryRoot, yamlMapper);
    }

    @Override
    public Optional<PolicyDocument> load() throws ConfigLoadException {
        final var location = locator.locate();
        if (location.isEmpty()) {
            LOG.debug("No policy document found");
            return Optional.empty();
        }

        final var path = location.get().path();
        if (!Files.isRegularFile(path)) {
            throw new ConfigLoadException("Policy document not found: " + path);
        }

        final JsonNode root;
        try {
            root = yamlMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse policy document " + path + ": " + e.getMessage(), e);
        }
        if (root != null && !root.isMissingNode() && !root.isNull() && !root.isObject()) {
            throw new ConfigLoadException("Policy document " + path + " is not a mapping");
        }

        final var limits = root != null && root.isObject()
                ? parseRoles(root.get("roles"))
                : Map.<SubjectClass, Map<OperationType, Limit>>of();
        final var manifestVersion = location.get().manifestVersion();
        final var version = documentVersion(root).or(() -> manifestVersion);
        return Optional.of(new PolicyDocument(limits, version, path.toString()));
    }

    private static Optional<String> documentVersion(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        final var version = root.get("version");
        if (version == null || version.isNull() || !version.isValueNode()) {
            return Optional.empty();
        }
        return Optional.of(version.asText());
    }

    private static Map<SubjectClass, Map<OperationType, Limit>> parseRoles(JsonNode roles) {
        final var result = new EnumMap<SubjectClass, Map<OperationType, Limit>>(SubjectClass.class);
        if (roles == null || roles.isNull()) {
            return result;
        }
        if (!roles.isObject()) {
            LOG.warn("Ignoring policy 'roles': expected a mapping");
            return result;
        }

        final var roleNames = roles.fieldNames();
        while (roleNames.hasNext()) {
            final var roleName = roleNames.next();
            final var subject = SubjectClass.fromValue(roleName);
            if (subject.isEmpty()) {
                LOG.warnf("Unknown role in policy document: %s", roleName);
                continue;
            }
            final var operations = roles.get(roleName);
            if (operations == null || !operations.isObject()) {
                LOG.warnf("Ignoring role %s: expected a mapping of operation types", roleName);
                continue;
            }

            final var row = new EnumMap<OperationType, Limit>(OperationType.class);
            final var operationNames = operations.fieldNames();
            while (operationNames.hasNext()) {
                final var operationName = operationNames.next();
                final var operation = OperationType.fromValue(operationName);
                if (operation.isEmpty()) {
                    LOG.warnf("Unknown operation type for role %s: %s", roleName, operationName);
                    continue;
                }
                parseLimit(roleName, operationName, operations.get(operationName))
                        .ifPresent(limit -> row.put(operation.get(), limit));
            }
            if (!row.isEmpty()) {
                result.merge(subject.get(), row, (existing, added) -> {
                    existing.putAll(added);
                    return existing;
                });
            }
        }
        return result;
    }

    private static Optional<Limit> parseLimit(String roleName, String operationName, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            LOG.warnf("Skipping %s/%s: expected a mapping", roleName, operationName);
            return Optional.empty();
        }
        final var rpm = positiveLong(entry, "rpm");
        final var rph = positiveLong(entry, "rph");
        final var burst = positiveLong(entry, "burst");
        if (rpm.isEmpty() || rph.isEmpty() || burst.isEmpty()) {
            LOG.warnf("Skipping %s/%s: rpm, rph and burst must be positive integers", roleName, operationName);
            return Optional.empty();
        }
        final var bypass = entry.path("emergency_bypass").asBoolean(false);
        final var description = entry.hasNonNull("description")
                ? entry.get("description").asText()
                : "Configured via policy document (role=" + roleName + ", type=" + operationName + ")";
        return Optional.of(new Limit(rpm.get(), rph.get(), burst.get(), bypass, description));
    }

    private static Optional<Long> positiveLong(JsonNode entry, String field) {
        final var value = entry.get(field);
        if (value == null || !value.canConvertToExactIntegral() && !value.isTextual()) {
            return Optional.empty();
        }
        final long parsed;
        if (value.isTextual()) {
            try {
                parsed = Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            parsed = value.asLong();
        }
        return parsed >= 1 ? Optional.of(parsed) : Optional.empty();
    }
}
