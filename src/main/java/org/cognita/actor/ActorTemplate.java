package org.cognita.actor;

import java.time.Duration;

/**
 * How to spawn an actor.
 *
 * @param templateId The template id.
 * @param behaviorReference The model store reference of the behavior document.
 * @param tickInterval The delay between ticks.
 * @param autoSaveInterval How often the actor state is persisted.
 * @param perceptionQueueSize The capacity of the perception queue.
 * @param category A free-form grouping, e.g. {@code npc_brain} or {@code scheduled_task}.
 * @param startFlow The flow run per tick when the document has no {@code process_tick}; null for the entry flow.
 */
public record ActorTemplate(
        String templateId,
        String behaviorReference,
        Duration tickInterval,
        Duration autoSaveInterval,
        int perceptionQueueSize,
        String category,
        String startFlow
) {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_AUTO_SAVE_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_PERCEPTION_QUEUE_SIZE = 100;

    public ActorTemplate {
        if (tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
        if (autoSaveInterval == null || autoSaveInterval.isNegative()) {
            throw new IllegalArgumentException("autoSaveInterval must not be negative");
        }
        if (perceptionQueueSize <= 0) {
            throw new IllegalArgumentException("perceptionQueueSize must be positive");
        }
    }

    /**
     * Creates a template with default intervals and queue size.
     */
    public static ActorTemplate of(String templateId, String behaviorReference) {
        return new ActorTemplate(templateId, behaviorReference, DEFAULT_TICK_INTERVAL, DEFAULT_AUTO_SAVE_INTERVAL,
                DEFAULT_PERCEPTION_QUEUE_SIZE, "default", null);
    }

    public ActorTemplate withTickInterval(Duration interval) {
        return new ActorTemplate(templateId, behaviorReference, interval, autoSaveInterval, perceptionQueueSize, category, startFlow);
    }

    public ActorTemplate withAutoSaveInterval(Duration interval) {
        return new ActorTemplate(templateId, behaviorReference, tickInterval, interval, perceptionQueueSize, category, startFlow);
    }

    public ActorTemplate withPerceptionQueueSize(int size) {
        return new ActorTemplate(templateId, behaviorReference, tickInterval, autoSaveInterval, size, category, startFlow);
    }

    public ActorTemplate withStartFlow(String flow) {
        return new ActorTemplate(templateId, behaviorReference, tickInterval, autoSaveInterval, perceptionQueueSize, category, flow);
    }

    public ActorTemplate withCategory(String newCategory) {
        return new ActorTemplate(templateId, behaviorReference, tickInterval, autoSaveInterval, perceptionQueueSize, newCategory, startFlow);
    }
}
