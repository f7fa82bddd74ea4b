package org.cognita.continuation;

/**
 * The states of a pending continuation. {@code OPEN} moves to exactly one of {@code EXTENDED}
 * or {@code TIMED_OUT}, which both move to {@code RESOLVED}.
 */
public enum ContinuationState {
    OPEN,
    EXTENDED,
    TIMED_OUT,
    RESOLVED;

    /**
     * @param next The target state.
     * @return true if the transition is allowed.
     */
    public boolean canTransitionTo(ContinuationState next) {
        return switch (this) {
            case OPEN -> next == EXTENDED || next == TIMED_OUT;
            case EXTENDED, TIMED_OUT -> next == RESOLVED;
            case RESOLVED -> false;
        };
    }
}
