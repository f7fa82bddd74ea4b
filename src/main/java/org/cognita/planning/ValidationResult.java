package org.cognita.planning;

/**
 * The verdict on an in-progress plan.
 *
 * @param valid false if the plan can no longer be followed as is.
 * @param reason The reason.
 * @param suggestion What the caller should do.
 * @param betterGoal The higher-priority goal, for {@link ReplanReason#BETTER_GOAL_AVAILABLE}.
 */
public record ValidationResult(boolean valid, ReplanReason reason, ValidationSuggestion suggestion, GoapGoal betterGoal) {

    static ValidationResult of(boolean valid, ReplanReason reason, ValidationSuggestion suggestion) {
        return new ValidationResult(valid, reason, suggestion, null);
    }
}
