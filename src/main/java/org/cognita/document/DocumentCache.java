package org.cognita.document;

import org.cognita.document.merge.DocumentMerger;
import org.cognita.document.parser.DocumentParser;
import org.cognita.store.IModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of parsed behavior documents keyed by reference. Documents with imports are cached in
 * their merged form. Entries are dropped when the backing {@link IModelStore} reports an
 * update of the document or of anything it imports, so the next lookup parses the new content.
 */
public class DocumentCache {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCache.class);

    private final IModelStore store;
    private final DocumentParser parser;
    private final Map<String, BehaviorDocument> documents = new ConcurrentHashMap<>();
    // imported reference -> documents that import it, directly or transitively
    private final Map<String, Set<String>> importers = new ConcurrentHashMap<>();

    public DocumentCache(IModelStore store) {
        this(store, new DocumentParser());
    }

    public DocumentCache(IModelStore store, DocumentParser parser) {
        this.store = store;
        this.parser = parser;
        store.addUpdateListener(this::invalidate);
    }

    /**
     * Gets a document, parsing and merging its imports on first use.
     * @return The document, or empty if the store has nothing under the reference.
     * @throws IOException if the store fails.
     * @throws DocumentParseException if the stored YAML is not a valid document or its imports
     *         cannot be merged.
     */
    public Optional<BehaviorDocument> get(String reference) throws IOException, DocumentParseException {
        BehaviorDocument cached = documents.get(reference);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<BehaviorDocument> parsed = parse(reference);
        if (parsed.isEmpty()) {
            return Optional.empty();
        }
        BehaviorDocument document = parsed.get();
        if (document.hasImports()) {
            document = DocumentMerger.merge(reference, document, imported -> {
                importers.computeIfAbsent(imported, k -> ConcurrentHashMap.newKeySet()).add(reference);
                return parse(imported);
            });
        }
        BehaviorDocument winner = documents.putIfAbsent(reference, document);
        LOG.debug("Parsed document '{}' with flows {}", reference, document.getFlows().keySet());
        return Optional.of(winner != null ? winner : document);
    }

    private Optional<BehaviorDocument> parse(String reference) throws IOException, DocumentParseException {
        Optional<byte[]> bytes = store.load(reference);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parser.parse(bytes.get(), reference));
    }

    /**
     * Drops a document and every cached document that imports it.
     */
    public void invalidate(String reference) {
        for (String affected : affectedBy(reference)) {
            if (documents.remove(affected) != null) {
                LOG.debug("Invalidated cached document '{}'", affected);
            }
        }
    }

    /**
     * @return The reference itself plus every document known to import it, directly or through
     *         other imports.
     */
    public Set<String> affectedBy(String reference) {
        Set<String> result = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(reference);
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                result.add(next);
                queue.addAll(importers.getOrDefault(next, Set.of()));
            }
        }
        return result;
    }
}
