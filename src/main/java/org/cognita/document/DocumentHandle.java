package org.cognita.document;

import java.util.Objects;

/**
 * A versioned, immutable reference to the document an actor loop executes.
 * <p>
 * Loops hold the current handle in a single field and replace it only between ticks, so a
 * document change never affects a tick in flight.
 *
 * @param reference The model-store reference the document was loaded from.
 * @param version A counter incremented on every replacement.
 * @param document The parsed document.
 */
public record DocumentHandle(String reference, long version, BehaviorDocument document) {

    public DocumentHandle {
        Objects.requireNonNull(document, "document");
    }

    /**
     * Creates the first handle for a document.
     */
    public static DocumentHandle initial(String reference, BehaviorDocument document) {
        return new DocumentHandle(reference, 1, document);
    }

    /**
     * Creates the successor handle for a replacement document.
     * @param replacement The new document.
     * @return A handle with the next version.
     */
    public DocumentHandle next(BehaviorDocument replacement) {
        return new DocumentHandle(reference, version + 1, replacement);
    }
}
