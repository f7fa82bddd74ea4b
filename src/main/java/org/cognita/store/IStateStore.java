package org.cognita.store;

import org.cognita.actor.state.ActorStateSnapshot;

import java.io.IOException;
import java.util.Optional;

/**
 * Persists actor snapshots by actor id. A save replaces the previous snapshot as a whole;
 * readers never observe a partially written snapshot.
 */
public interface IStateStore {

    void save(ActorStateSnapshot snapshot) throws IOException;

    Optional<ActorStateSnapshot> load(String actorId) throws IOException;

    void delete(String actorId) throws IOException;
}
