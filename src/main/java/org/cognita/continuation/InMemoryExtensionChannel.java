package org.cognita.continuation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * An in-process extension channel; {@link #deliver(ExtensionDelivery)} hands the delivery to
 * every subscriber on the calling thread.
 */
public class InMemoryExtensionChannel implements IExtensionChannel {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryExtensionChannel.class);

    private final List<Consumer<ExtensionDelivery>> consumers = new CopyOnWriteArrayList<>();

    @Override
    public void subscribe(Consumer<ExtensionDelivery> consumer) {
        consumers.add(consumer);
    }

    @Override
    public void unsubscribe(Consumer<ExtensionDelivery> consumer) {
        consumers.remove(consumer);
    }

    /**
     * Publishes a delivery to all subscribers.
     */
    public void deliver(ExtensionDelivery delivery) {
        if (consumers.isEmpty()) {
            LOG.debug("Extension for '{}' of actor {} dropped, no subscribers", delivery.continuationPointName(), delivery.actorId());
        }
        for (Consumer<ExtensionDelivery> consumer : consumers) {
            consumer.accept(delivery);
        }
    }
}
