package org.cognita.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores serialized behaviors (binary models and YAML documents) by reference.
 */
public interface IModelStore {

    /**
     * Loads a behavior.
     * @param reference The behavior reference.
     * @return The stored bytes, or empty if nothing is stored under the reference.
     * @throws IOException if the store cannot be read.
     */
    Optional<byte[]> load(String reference) throws IOException;

    /**
     * Stores a behavior and notifies update listeners.
     * @throws IOException if the store cannot be written.
     */
    void save(String reference, byte[] content) throws IOException;

    void addUpdateListener(ModelUpdateListener listener);

    void removeUpdateListener(ModelUpdateListener listener);
}
