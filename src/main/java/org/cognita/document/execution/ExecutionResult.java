package org.cognita.document.execution;

import org.cognita.continuation.PendingContinuation;

import java.util.List;

/**
 * The outcome of one document execution.
 */
public sealed interface ExecutionResult permits ExecutionResult.Completed, ExecutionResult.Paused, ExecutionResult.Faulted {

    /**
     * @return The messages written by {@code log} actions, in order.
     */
    List<String> logs();

    /**
     * The execution ran to the end of its flow, a {@code return} or a {@code self_terminate}.
     * @param value The returned value, or null.
     * @param logs The log messages.
     */
    record Completed(Object value, List<String> logs) implements ExecutionResult {
        public Completed {
            logs = List.copyOf(logs);
        }
    }

    /**
     * The execution stopped at a continuation point.
     * @param continuationId The id of the opened continuation.
     * @param pending The opened continuation.
     * @param logs The log messages.
     */
    record Paused(String continuationId, PendingContinuation pending, List<String> logs) implements ExecutionResult {
        public Paused {
            logs = List.copyOf(logs);
        }
    }

    /**
     * The execution was aborted: fatal action fault, unknown start flow, cancellation or step budget.
     * @param error The reason.
     * @param logs The log messages written before the abort.
     */
    record Faulted(String error, List<String> logs) implements ExecutionResult {
        public Faulted {
            logs = List.copyOf(logs);
        }
    }

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    default boolean isPaused() {
        return this instanceof Paused;
    }

    default boolean isFaulted() {
        return this instanceof Faulted;
    }
}
