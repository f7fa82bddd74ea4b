package org.cognita.document.merge;

import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentParseException;

import java.io.IOException;
import java.util.Optional;

/**
 * Loads the unmerged document behind an import's {@code file} reference.
 */
@FunctionalInterface
public interface IDocumentResolver {

    /**
     * @return The parsed document, or empty if nothing is stored under the reference.
     */
    Optional<BehaviorDocument> resolve(String reference) throws IOException, DocumentParseException;
}
