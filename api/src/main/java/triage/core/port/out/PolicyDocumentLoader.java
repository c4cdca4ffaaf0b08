package triage.core.port.out;

import java.util.Optional;

import triage.core.model.ratelimit.ConfigLoadException;
import triage.core.model.ratelimit.PolicyDocument;

/**
 * Port interface for locating and reading the external policy document.
 */
public interface PolicyDocumentLoader {

    /**
     * Locate and read the policy document.
     *
     * <p>Entries that fail validation are skipped; only a document that cannot be read or
     * parsed at all is an error.
     *
     * @return the document, or empty if none was found
     * @throws ConfigLoadException if a document was found but could not be read or parsed
     */
    Optional<PolicyDocument> load() throws ConfigLoadException;
}
