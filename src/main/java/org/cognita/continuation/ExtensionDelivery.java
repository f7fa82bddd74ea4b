package org.cognita.continuation;

/**
 * One inbound extension: a payload for a named continuation point of one actor.
 *
 * @param actorId The target actor.
 * @param continuationPointName The name of the continuation point.
 * @param payload The serialized extension (bytecode model or YAML document).
 */
public record ExtensionDelivery(String actorId, String continuationPointName, byte[] payload) {
}
