package org.cognita.document.execution;

import org.cognita.continuation.ContinuationEngine;
import org.cognita.continuation.Resolution;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.Flow;
import org.cognita.document.expression.ExpressionEvaluator;
import org.cognita.document.expression.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tree-walking executor of behavior documents.
 * <p>
 * Each action is dispatched through the {@link ActionHandlerRegistry}. A failing action is a
 * handler fault: the executor sets {@code _error}, {@code _error_handled} and
 * {@code _error_count}, runs the nearest error handler (action {@code on_error}, then flow
 * {@code on_error}, then the document error flow) and continues with the next action. Only
 * actions marked {@code severity: fatal}, cancellation and the step budget abort an execution.
 * <p>
 * The executor is stateless between calls and may be shared; a single execution runs on the
 * calling thread.
 */
public class DocumentExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentExecutor.class);

    public static final String ERROR_VARIABLE = "_error";
    public static final String ERROR_HANDLED_VARIABLE = "_error_handled";
    public static final String ERROR_COUNT_VARIABLE = "_error_count";
    public static final String RESULT_VARIABLE = "_result";

    private final ExpressionEvaluator evaluator;
    private final ActionHandlerRegistry registry;
    private final ContinuationEngine continuationEngine;

    public DocumentExecutor() {
        this(new ExpressionEvaluator(), ActionHandlerRegistry.withBuiltins(), new ContinuationEngine());
    }

    public DocumentExecutor(ExpressionEvaluator evaluator, ActionHandlerRegistry registry,
                            ContinuationEngine continuationEngine) {
        this.evaluator = evaluator;
        this.registry = registry;
        this.continuationEngine = continuationEngine;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public ActionHandlerRegistry getRegistry() {
        return registry;
    }

    public ContinuationEngine getContinuationEngine() {
        return continuationEngine;
    }

    /**
     * Executes a flow with default options.
     * @see #execute(BehaviorDocument, String, VariableScope, ExecutionOptions)
     */
    public ExecutionResult execute(BehaviorDocument document, String startFlow, VariableScope scope) {
        return execute(document, startFlow, scope, ExecutionOptions.defaults());
    }

    /**
     * Executes a flow of a document.
     * @param document The document.
     * @param startFlow The flow to start at; null selects the document's entry flow.
     * @param scope The root scope; variables written by the execution stay in it.
     * @param options Step budget, cancellation and effect sink.
     * @return Completed, Paused at a continuation point, or Faulted.
     */
    public ExecutionResult execute(BehaviorDocument document, String startFlow, VariableScope scope,
                                   ExecutionOptions options) {
        String flowName = startFlow != null ? startFlow : document.getEntryFlow();
        ExecutionContext.Shared shared = new ExecutionContext.Shared(this, document, options);
        if (!document.hasFlow(flowName)) {
            LOG.debug("Document {} has no flow '{}'", document.getId(), flowName);
            return new ExecutionResult.Faulted("Flow '" + flowName + "' not found", List.of());
        }
        ExecutionContext root = new ExecutionContext(shared, scope, null);
        try {
            ActionOutcome outcome = runFlowChain(flowName, scope, root);
            if (outcome instanceof ActionOutcome.Pause pause) {
                return new ExecutionResult.Paused(pause.continuation().id(), pause.continuation(), shared.logs);
            }
            if (outcome instanceof ActionOutcome.Return ret) {
                return new ExecutionResult.Completed(ret.value(), shared.logs);
            }
            return new ExecutionResult.Completed(null, shared.logs);
        } catch (ExecutionAbortedException e) {
            LOG.debug("Execution of {} flow '{}' aborted: {}", document.getId(), flowName, e.getMessage());
            return new ExecutionResult.Faulted(e.getMessage(), shared.logs);
        }
    }

    /**
     * Continues a paused execution after its continuation was resolved. An attached extension
     * document runs from its entry flow; otherwise the continuation's default flow runs.
     * @param document The document that paused.
     * @param resolution The continuation resolution.
     * @param scope The scope of the paused execution.
     * @param options The execution options.
     */
    public ExecutionResult resume(BehaviorDocument document, Resolution resolution, VariableScope scope,
                                  ExecutionOptions options) {
        if (resolution.extended()) {
            BehaviorDocument extension = resolution.extension(BehaviorDocument.class);
            LOG.debug("Resuming '{}' with extension {}", resolution.continuation().pointName(), extension.getId());
            return execute(extension, extension.getEntryFlow(), scope, options);
        }
        return execute(document, resolution.continuation().defaultTarget(), scope, options);
    }

    ActionOutcome runFlowChain(String flowName, VariableScope scope, ExecutionContext caller) {
        BehaviorDocument document = caller.getDocument();
        String current = flowName;
        while (true) {
            String target = current;
            Flow flow = document.getFlow(target)
                    .orElseThrow(() -> new IllegalArgumentException("Flow '" + target + "' not found"));
            ActionOutcome outcome = runBlock(flow.actions(), caller.forFlow(flow, scope));
            if (outcome instanceof ActionOutcome.Goto transfer) {
                transfer.args().forEach(scope::set);
                current = transfer.flow();
                if (!document.hasFlow(current)) {
                    throw new IllegalArgumentException("Flow '" + current + "' not found");
                }
                continue;
            }
            if (outcome instanceof ActionOutcome.Continue) {
                return new ActionOutcome.Return(null);
            }
            return outcome;
        }
    }

    ActionOutcome runBlock(List<ActionNode> actions, ExecutionContext context) {
        for (ActionNode action : actions) {
            step(context.shared());
            ActionOutcome outcome = runAction(action, context);
            if (!(outcome instanceof ActionOutcome.Continue)) {
                return outcome;
            }
        }
        return ActionOutcome.CONTINUE;
    }

    ActionOutcome runAction(ActionNode action, ExecutionContext context) {
        try {
            IActionHandler handler = registry.lookup(action)
                    .orElseThrow(() -> new UnsupportedOperationException("No handler registered for action '" + action.name() + "'"));
            return handler.handle(action, context);
        } catch (ExecutionAbortedException e) {
            throw e;
        } catch (Exception e) {
            return handleFault(action, context, e);
        }
    }

    private ActionOutcome handleFault(ActionNode action, ExecutionContext context, Exception error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        Flow flow = context.getFlow();
        if (action.fatal()) {
            throw new ExecutionAbortedException("Action '" + action.name() + "' in flow '" + flow.name() + "' failed: " + message, error);
        }
        LOG.warn("Action '{}' in flow '{}' failed: {}", action.name(), flow.name(), message);
        LOG.debug("Handler fault details:", error);

        VariableScope scope = context.getScope();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("message", message);
        details.put("action", action.name());
        details.put("flow", flow.name());
        details.put("path", action.path());
        Object count = scope.get(ERROR_COUNT_VARIABLE);
        double errorCount = (Values.isNumeric(count) ? Values.toNumber(count) : 0.0) + 1.0;
        setErrorVariable(scope, ERROR_VARIABLE, details);
        setErrorVariable(scope, ERROR_HANDLED_VARIABLE, Boolean.TRUE);
        setErrorVariable(scope, ERROR_COUNT_VARIABLE, errorCount);
        context.getEffects().reportFault(flow.name(), action.name(), message);

        ExecutionContext.Shared shared = context.shared();
        if (shared.errorHandlingDepth > 0) {
            // faults inside error handlers are flagged only
            return ActionOutcome.CONTINUE;
        }
        shared.errorHandlingDepth++;
        try {
            if (!action.onError().isEmpty()) {
                return runBlock(action.onError(), context);
            }
            if (!flow.onError().isEmpty()) {
                return runBlock(flow.onError(), context);
            }
            String documentHandler = context.getDocument().getOnErrorFlow();
            if (documentHandler != null) {
                if (!context.getDocument().hasFlow(documentHandler)) {
                    throw new ExecutionAbortedException("Flow '" + documentHandler + "' not found");
                }
                ActionOutcome outcome = runFlowChain(documentHandler, scope, context);
                return outcome instanceof ActionOutcome.Return ? ActionOutcome.CONTINUE : outcome;
            }
            return ActionOutcome.CONTINUE;
        } finally {
            shared.errorHandlingDepth--;
        }
    }

    private static void setErrorVariable(VariableScope scope, String name, Object value) {
        if (scope.isDefined(name)) {
            scope.set(name, value);
        } else {
            scope.setGlobal(name, value);
        }
    }

    static void step(ExecutionContext.Shared shared) {
        if (shared.options.cancellation().getAsBoolean()) {
            throw new ExecutionAbortedException("cancelled");
        }
        if (++shared.steps > shared.options.stepBudget()) {
            throw new ExecutionAbortedException("Step budget of " + shared.options.stepBudget() + " actions exceeded");
        }
    }
}
