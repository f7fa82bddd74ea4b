package org.cognita.continuation;

import java.util.function.Consumer;

/**
 * An inbound channel of extension deliveries. Deliveries may arrive with arbitrary latency or
 * never; consumers must not block the delivering thread.
 */
public interface IExtensionChannel {

    /**
     * Registers a consumer for all deliveries on this channel.
     * @param consumer The consumer.
     */
    void subscribe(Consumer<ExtensionDelivery> consumer);

    /**
     * Removes a previously registered consumer.
     * @param consumer The consumer.
     */
    void unsubscribe(Consumer<ExtensionDelivery> consumer);
}
