package org.cognita.document.execution;

import java.util.function.BooleanSupplier;

/**
 * Per-execution options.
 *
 * @param stepBudget The maximum number of actions one execution may run.
 * @param cancellation Checked between actions; returning true cancels the execution.
 * @param effects The sink for actor effects.
 */
public record ExecutionOptions(int stepBudget, BooleanSupplier cancellation, IActorEffects effects) {

    public static final int DEFAULT_STEP_BUDGET = 100_000;

    public ExecutionOptions {
        if (stepBudget <= 0) {
            throw new IllegalArgumentException("stepBudget must be positive");
        }
        if (cancellation == null) {
            cancellation = () -> false;
        }
        if (effects == null) {
            effects = new RecordedEffects();
        }
    }

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(DEFAULT_STEP_BUDGET, null, null);
    }

    public ExecutionOptions withStepBudget(int budget) {
        return new ExecutionOptions(budget, cancellation, effects);
    }

    public ExecutionOptions withCancellation(BooleanSupplier supplier) {
        return new ExecutionOptions(stepBudget, supplier, effects);
    }

    public ExecutionOptions withEffects(IActorEffects sink) {
        return new ExecutionOptions(stepBudget, cancellation, sink);
    }
}
