package org.cognita.actor;

/**
 * Observes actors. Called on actor worker threads; implementations must be quick and thread-safe.
 */
public interface IActorStateListener {

    /**
     * Called after a tick that changed feelings, goals or memories, or emitted intents.
     */
    void onStateUpdate(ActorStateUpdate update);

    /**
     * Called after every lifecycle transition.
     */
    default void onStatusChanged(String actorId, ActorStatus from, ActorStatus to) {
    }
}
