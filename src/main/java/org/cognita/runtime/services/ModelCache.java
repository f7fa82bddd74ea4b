package org.cognita.runtime.services;

import org.cognita.runtime.model.BehaviorModel;
import org.cognita.store.IModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-mostly cache of verified bytecode models, filled from an {@link IModelStore} and
 * invalidated by the store's update notifications.
 */
public class ModelCache {

    private static final Logger LOG = LoggerFactory.getLogger(ModelCache.class);

    private final IModelStore store;
    private final BehaviorModelReader reader;
    private final Map<String, BehaviorModel> models = new ConcurrentHashMap<>();

    public ModelCache(IModelStore store) {
        this(store, new BehaviorModelReader());
    }

    public ModelCache(IModelStore store, BehaviorModelReader reader) {
        this.store = store;
        this.reader = reader;
        store.addUpdateListener(this::invalidate);
    }

    /**
     * Gets a model, loading and verifying it on first use.
     * @param reference The model reference.
     * @return The model, or empty if the store has nothing under the reference.
     * @throws IOException if the store fails.
     * @throws org.cognita.runtime.model.ModelCorruptionException if the stored bytes are not a valid model.
     */
    public Optional<BehaviorModel> get(String reference) throws IOException {
        BehaviorModel cached = models.get(reference);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<byte[]> bytes = store.load(reference);
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        BehaviorModel model = reader.read(bytes.get());
        BehaviorModel winner = models.putIfAbsent(reference, model);
        LOG.debug("Loaded model '{}' ({} bytes of code)", reference, model.getCodeLength());
        return Optional.of(winner != null ? winner : model);
    }

    public void invalidate(String reference) {
        if (models.remove(reference) != null) {
            LOG.debug("Invalidated cached model '{}'", reference);
        }
    }

    public int size() {
        return models.size();
    }
}
