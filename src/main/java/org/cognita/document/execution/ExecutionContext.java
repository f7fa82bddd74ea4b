package org.cognita.document.execution;

import org.cognita.continuation.ContinuationEngine;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.Flow;
import org.cognita.document.expression.ExpressionEvaluator;
import org.cognita.document.expression.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What an action handler sees of the running execution: the current scope and flow, the
 * expression evaluator, the effect sink and the ability to run nested action blocks.
 * <p>
 * A context is a cheap view; {@link #withScope} and {@link #forFlow} create new views that share
 * the execution-wide state (logs, step counter, options).
 */
public final class ExecutionContext {

    static final class Shared {
        final DocumentExecutor executor;
        final BehaviorDocument document;
        final ExecutionOptions options;
        final List<String> logs = new ArrayList<>();
        int steps;
        int errorHandlingDepth;

        Shared(DocumentExecutor executor, BehaviorDocument document, ExecutionOptions options) {
            this.executor = executor;
            this.document = document;
            this.options = options;
        }
    }

    private final Shared shared;
    private final VariableScope scope;
    private final Flow flow;

    ExecutionContext(Shared shared, VariableScope scope, Flow flow) {
        this.shared = shared;
        this.scope = scope;
        this.flow = flow;
    }

    public ExecutionContext withScope(VariableScope newScope) {
        return new ExecutionContext(shared, newScope, flow);
    }

    ExecutionContext forFlow(Flow newFlow, VariableScope newScope) {
        return new ExecutionContext(shared, newScope, newFlow);
    }

    public BehaviorDocument getDocument() {
        return shared.document;
    }

    public VariableScope getScope() {
        return scope;
    }

    public Flow getFlow() {
        return flow;
    }

    public IActorEffects getEffects() {
        return shared.options.effects();
    }

    public ContinuationEngine getContinuationEngine() {
        return shared.executor.getContinuationEngine();
    }

    public ExpressionEvaluator getEvaluator() {
        return shared.executor.getEvaluator();
    }

    /**
     * Resolves a raw parameter value against the current scope.
     */
    public Object resolve(Object raw) {
        return getEvaluator().resolve(raw, scope);
    }

    /**
     * Resolves a parameter to text; null stays null.
     */
    public String resolveString(Object raw) {
        Object value = resolve(raw);
        return value == null ? null : Values.format(value);
    }

    /**
     * Resolves a parameter to a number.
     * @throws org.cognita.document.expression.ExpressionException if the value is not numeric.
     */
    public double resolveNumber(Object raw) {
        return Values.toNumber(resolve(raw));
    }

    public boolean evaluateCondition(String condition) {
        return getEvaluator().evaluateCondition(condition, scope);
    }

    public void log(String message) {
        shared.logs.add(message);
    }

    public List<String> getLogs() {
        return List.copyOf(shared.logs);
    }

    /**
     * Runs a nested block of actions in the given scope.
     * @return The first outcome other than continue, or continue.
     */
    public ActionOutcome runBlock(List<ActionNode> actions, VariableScope blockScope) {
        return shared.executor.runBlock(actions, withScope(blockScope));
    }

    /**
     * Runs another flow of the document in a child scope of the current scope.
     * @param flowName The flow to call.
     * @param args Variables defined in the callee scope.
     * @return {@link ActionOutcome.Return} with the flow's value, or a pause or halt to propagate.
     */
    public ActionOutcome callFlow(String flowName, Map<String, Object> args) {
        VariableScope calleeScope = scope.createChild();
        args.forEach(calleeScope::defineLocal);
        return shared.executor.runFlowChain(flowName, calleeScope, this);
    }

    List<String> logs() {
        return shared.logs;
    }

    Shared shared() {
        return shared;
    }
}
