package org.cognita.planning;

import java.util.Collection;

/**
 * Decides whether an in-progress plan is still worth following.
 */
public class PlanValidator {

    /**
     * Validates a plan at a step cursor. Checks, in order: plan completed, goal already
     * satisfied, next step's preconditions, and a higher-priority unsatisfied goal.
     * @param plan The plan.
     * @param cursor The index of the next step.
     * @param state The current world state.
     * @param activeGoals All goals the actor currently holds.
     */
    public ValidationResult validate(PlanResult plan, int cursor, WorldState state, Collection<GoapGoal> activeGoals) {
        if (cursor >= plan.actions().size()) {
            return ValidationResult.of(true, ReplanReason.PLAN_COMPLETED, ValidationSuggestion.ABORT);
        }
        if (plan.goal().isSatisfiedBy(state)) {
            return ValidationResult.of(true, ReplanReason.GOAL_ALREADY_SATISFIED, ValidationSuggestion.ABORT);
        }
        if (!plan.actions().get(cursor).isApplicable(state)) {
            return ValidationResult.of(false, ReplanReason.PRECONDITION_INVALIDATED, ValidationSuggestion.REPLAN);
        }
        GoapGoal better = null;
        for (GoapGoal candidate : activeGoals) {
            if (candidate.priority() > plan.goal().priority() && !candidate.isSatisfiedBy(state)
                    && (better == null || candidate.priority() > better.priority())) {
                better = candidate;
            }
        }
        if (better != null) {
            return new ValidationResult(false, ReplanReason.BETTER_GOAL_AVAILABLE, ValidationSuggestion.REPLAN, better);
        }
        return ValidationResult.of(true, ReplanReason.NONE, ValidationSuggestion.CONTINUE);
    }
}
