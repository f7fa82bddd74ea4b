package org.cognita.continuation;

/**
 * A continuation point a running execution is paused at. Plain data, so it can be persisted
 * with the actor state and restored later.
 *
 * @param id The unique continuation id.
 * @param pointName The continuation point name.
 * @param nameHash The FNV-1a hash of the point name.
 * @param deadlineEpochMs The wall-clock deadline in epoch milliseconds.
 * @param defaultTarget Where execution continues without an extension: a flow name, or a bytecode offset.
 * @param state The current state.
 * @param extensionRef A description of the attached extension, or null.
 */
public record PendingContinuation(
        String id,
        String pointName,
        int nameHash,
        long deadlineEpochMs,
        String defaultTarget,
        ContinuationState state,
        String extensionRef
) {

    /**
     * Returns a copy in a new state.
     * @throws IllegalStateException if the transition is not allowed.
     */
    public PendingContinuation withState(ContinuationState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Continuation " + id + " cannot move from " + state + " to " + next);
        }
        return new PendingContinuation(id, pointName, nameHash, deadlineEpochMs, defaultTarget, next, extensionRef);
    }

    /**
     * Returns an EXTENDED copy referencing the attached extension.
     */
    public PendingContinuation withExtension(String reference) {
        PendingContinuation extended = withState(ContinuationState.EXTENDED);
        return new PendingContinuation(id, pointName, nameHash, deadlineEpochMs, defaultTarget, extended.state, reference);
    }

    /**
     * @param nowEpochMs The current time.
     * @return Remaining milliseconds until the deadline, never negative.
     */
    public long remainingMs(long nowEpochMs) {
        return Math.max(0, deadlineEpochMs - nowEpochMs);
    }
}
