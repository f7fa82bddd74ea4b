package org.cognita.planning;

/**
 * Supplies the world state a search runs against. Called once per planning request; the
 * returned state is not changed during the search.
 */
@FunctionalInterface
public interface IWorldStateProvider {

    WorldState snapshot();
}
