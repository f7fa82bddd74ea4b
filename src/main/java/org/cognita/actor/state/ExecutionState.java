package org.cognita.actor.state;

import org.cognita.continuation.PendingContinuation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted document execution state of an actor.
 *
 * @param variables The root-scope variables.
 * @param currentFlow The flow the actor is paused in, or null.
 * @param documentVersion The version of the document handle the state belongs to.
 * @param pendingContinuations Continuations awaiting an extension or timeout.
 */
public record ExecutionState(
        Map<String, Object> variables,
        String currentFlow,
        long documentVersion,
        List<PendingContinuation> pendingContinuations
) {
    public ExecutionState {
        // variables may hold null values, so no Map.copyOf
        variables = variables == null ? Map.of() : new LinkedHashMap<>(variables);
        pendingContinuations = pendingContinuations == null ? List.of() : List.copyOf(pendingContinuations);
    }

    public static ExecutionState empty() {
        return new ExecutionState(Map.of(), null, 0L, List.of());
    }
}
