package org.cognita.store;

import org.cognita.actor.state.ActorStateSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link IStateStore} for tests and single-process use.
 */
public class InMemoryStateStore implements IStateStore {

    private final Map<String, ActorStateSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(ActorStateSnapshot snapshot) {
        snapshots.put(snapshot.actorId(), snapshot);
    }

    @Override
    public Optional<ActorStateSnapshot> load(String actorId) {
        return Optional.ofNullable(snapshots.get(actorId));
    }

    @Override
    public void delete(String actorId) {
        snapshots.remove(actorId);
    }

    public int size() {
        return snapshots.size();
    }
}
