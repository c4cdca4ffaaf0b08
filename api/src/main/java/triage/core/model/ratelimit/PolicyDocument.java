package triage.core.model.ratelimit;

import java.util.Map;
import java.util.Optional;

/**
 * Limits read from an external policy document, before merging with the built-in table.
 *
 * @param limits valid entries found in the document, possibly partial
 * @param version declared version, from the document or its manifest
 * @param source where the document was read from
 */
public record PolicyDocument(
        Map<SubjectClass, Map<OperationType, Limit>> limits, Optional<String> version, String source) {}
