package org.cognita.actor;

import java.time.Instant;
import java.util.Map;

/**
 * An external stimulus delivered to an actor.
 *
 * @param type The perception type, e.g. {@code sight} or {@code message}.
 * @param source Who or what caused it.
 * @param urgency Urgency in [0, 1].
 * @param payload Arbitrary data.
 * @param timestamp When it was perceived.
 */
public record Perception(String type, String source, double urgency, Map<String, Object> payload, Instant timestamp) {

    public Perception {
        if (urgency < 0.0 || urgency > 1.0 || Double.isNaN(urgency)) {
            throw new IllegalArgumentException("urgency must be in [0, 1], got " + urgency);
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static Perception of(String type, String source, double urgency, Map<String, Object> payload) {
        return new Perception(type, source, urgency, payload, Instant.now());
    }
}
