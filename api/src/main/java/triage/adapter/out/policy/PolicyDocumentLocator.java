package triage.adapter.out.policy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/**
 * Finds the policy document.
 *
 * <p>Precedence:
 * <ol>
 *   <li>Explicit path</li>
 *   <li>First {@code files} entry of {@code config_index.yml} under the discovery root that
 *       ends in {@code rate_limits.yml}</li>
 *   <li>First {@code rate_limits.yml} found walking the discovery root</li>
 * </ol>
 *
 * <p>The manifest's {@code version}, when present, is reported even if the document is found
 * by walking the tree.
 */
public final class PolicyDocumentLocator {

    private static final Logger LOG = Logger.getLogger(PolicyDocumentLocator.class);

    static final String DOCUMENT_NAME = "rate_limits.yml";
    static final String MANIFEST_NAME = "config_index.yml";

    private final Optional<String> explicitPath;
    private final Path discoveryRoot;
    private final ObjectMapper yamlMapper;

    /**
     * A located document.
     *
     * @param path document path, which may not exist when given explicitly
     * @param manifestVersion version declared by the manifest, if any
     */
    public record Location(Path path, Optional<String> manifestVersion) {}

    public PolicyDocumentLocator(Optional<String> explicitPath, Path discoveryRoot, ObjectMapper yamlMapper) {
        this.explicitPath = explicitPath.filter(p -> !p.isBlank());
        this.discoveryRoot = discoveryRoot;
        this.yamlMapper = yamlMapper;
    }

    /**
     * Locate the policy document.
     *
     * @return the location, or empty if no document was named or found
     */
    public Optional<Location> locate() {
        final var manifest = readManifest();
        final var manifestVersion = manifest.flatMap(PolicyDocumentLocator::manifestVersion);

        if (explicitPath.isPresent()) {
            return Optional.of(new Location(Path.of(explicitPath.get()), manifestVersion));
        }

        final var indexed = manifest.flatMap(this::indexedDocument);
        if (indexed.isPresent()) {
            LOG.debugf("Policy document found through %s: %s", MANIFEST_NAME, indexed.get());
            return Optional.of(new Location(indexed.get(), manifestVersion));
        }

        return walk().map(path -> new Location(path, manifestVersion));
    }

    private Optional<JsonNode> readManifest() {
        final var manifestPath = discoveryRoot.resolve(MANIFEST_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(yamlMapper.readTree(manifestPath.toFile()));
        } catch (IOException e) {
            LOG.warnf(e, "Failed to read policy manifest %s, ignoring it", manifestPath);
            return Optional.empty();
        }
    }

    private static Optional<String> manifestVersion(JsonNode manifest) {
        final var version = manifest.get("version");
        if (version == null || version.isNull() || !version.isValueNode()) {
            return Optional.empty();
        }
        return Optional.of(version.asText());
    }

    private Optional<Path> indexedDocument(JsonNode manifest) {
        final var files = manifest.get("files");
        if (files == null || !files.isArray()) {
            return Optional.empty();
        }
        for (final var entry : files) {
            String name = null;
            if (entry.isTextual()) {
                name = entry.asText();
            } else if (entry.isObject()) {
                final var value = entry.hasNonNull("path") ? entry.get("path") : entry.get("name");
                name = value != null && value.isValueNode() ? value.asText() : null;
            }
            if (name != null && name.endsWith(DOCUMENT_NAME)) {
                return Optional.of(discoveryRoot.resolve(name));
            }
        }
        return Optional.empty();
    }

    private Optional<Path> walk() {
        if (!Files.isDirectory(discoveryRoot)) {
            return Optional.empty();
        }
        try (Stream<Path> paths = Files.walk(discoveryRoot)) {
            return paths.filter(path -> path.getFileName() != null
                            && DOCUMENT_NAME.equals(path.getFileName().toString())
                            && Files.isRegularFile(path))
                    .min(Comparator.comparingInt(Path::getNameCount).thenComparing(Path::toString));
        } catch (IOException | UncheckedIOException e) {
            LOG.warnf(e, "Failed to walk policy discovery root %s", discoveryRoot);
            return Optional.empty();
        }
    }
}
