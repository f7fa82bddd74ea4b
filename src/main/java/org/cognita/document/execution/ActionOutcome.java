package org.cognita.document.execution;

import org.cognita.continuation.PendingContinuation;

import java.util.Map;

/**
 * What the executor does after an action: continue, transfer, return or stop.
 */
public sealed interface ActionOutcome
        permits ActionOutcome.Continue, ActionOutcome.Goto, ActionOutcome.Return, ActionOutcome.Pause, ActionOutcome.Halt {

    /** Shared instance for the common case. */
    ActionOutcome CONTINUE = new Continue();

    record Continue() implements ActionOutcome {
    }

    /**
     * Tail transfer to another flow of the same document.
     * @param flow The target flow.
     * @param args Variables bound before the target flow runs; may be empty.
     */
    record Goto(String flow, Map<String, Object> args) implements ActionOutcome {
    }

    /**
     * Ends the current flow with a value.
     */
    record Return(Object value) implements ActionOutcome {
    }

    /**
     * Ends the whole execution at a continuation point.
     */
    record Pause(PendingContinuation continuation) implements ActionOutcome {
    }

    /**
     * Ends the whole execution without a value.
     */
    record Halt(String reason) implements ActionOutcome {
    }
}
