package org.cognita.store;

/**
 * Notified when a stored behavior (bytecode model or document) changes.
 */
@FunctionalInterface
public interface ModelUpdateListener {

    /**
     * @param reference The reference of the changed behavior.
     */
    void onModelUpdated(String reference);
}
