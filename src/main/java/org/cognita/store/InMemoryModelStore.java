package org.cognita.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link IModelStore}. Listeners are called on the saving thread.
 */
public class InMemoryModelStore implements IModelStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryModelStore.class);

    private final Map<String, byte[]> content = new ConcurrentHashMap<>();
    private final List<ModelUpdateListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Optional<byte[]> load(String reference) {
        byte[] bytes = content.get(reference);
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }

    @Override
    public void save(String reference, byte[] bytes) {
        content.put(reference, bytes.clone());
        for (ModelUpdateListener listener : listeners) {
            try {
                listener.onModelUpdated(reference);
            } catch (RuntimeException e) {
                LOG.warn("Model update listener failed for '{}': {}", reference, e.getMessage());
            }
        }
    }

    @Override
    public void addUpdateListener(ModelUpdateListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeUpdateListener(ModelUpdateListener listener) {
        listeners.remove(listener);
    }
}
