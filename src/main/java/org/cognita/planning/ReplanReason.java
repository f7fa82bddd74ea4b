package org.cognita.planning;

public enum ReplanReason {
    NONE,
    PLAN_COMPLETED,
    GOAL_ALREADY_SATISFIED,
    PRECONDITION_INVALIDATED,
    BETTER_GOAL_AVAILABLE
}
