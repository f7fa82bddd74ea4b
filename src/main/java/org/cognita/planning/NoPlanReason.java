package org.cognita.planning;

/**
 * Why a search ended without a plan.
 */
public enum NoPlanReason {
    /** The search space was exhausted. */
    UNREACHABLE,
    /** Every remaining path would exceed the maximum plan length. */
    DEPTH_LIMIT,
    /** The node budget was used up. */
    NODE_BUDGET,
    /** The wall-clock budget was used up. */
    TIMEOUT,
    /** The caller cancelled the search. */
    CANCELLED
}
