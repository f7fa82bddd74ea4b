package org.cognita.planning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.BooleanSupplier;

/**
 * A* search from a world state to a goal over a list of actions.
 * <p>
 * The heuristic is the number of unsatisfied goal conditions times the cheapest action cost, so
 * it never exceeds the remaining cost when one action settles at most one condition. Among open nodes with equal
 * estimated total cost the planner prefers the lower path cost, then the action registered
 * earlier (its position in the action list), then the node created earlier, so results are
 * deterministic. A search that runs out of depth, nodes or time returns no plan; partial plans
 * are never returned.
 */
public class GoapPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(GoapPlanner.class);

    private final PlanningBudgets budgets;

    public GoapPlanner() {
        this(new PlanningBudgets());
    }

    public GoapPlanner(PlanningBudgets budgets) {
        this.budgets = budgets;
    }

    public PlanningBudgets getBudgets() {
        return budgets;
    }

    /**
     * Plans with the budget of the tier the urgency falls into.
     */
    public PlanResult plan(WorldState start, GoapGoal goal, List<GoapAction> actions, double urgency) {
        return plan(start, goal, actions, budgets.forUrgency(urgency), () -> false);
    }

    /**
     * Plans against a fresh snapshot from the provider.
     */
    public PlanResult plan(IWorldStateProvider provider, GoapGoal goal, List<GoapAction> actions, double urgency) {
        return plan(provider.snapshot(), goal, actions, urgency);
    }

    public PlanResult plan(WorldState start, GoapGoal goal, List<GoapAction> actions, PlanningOptions options) {
        return plan(start, goal, actions, options, () -> false);
    }

    /**
     * Runs the search.
     * @param start The initial world state.
     * @param goal The goal.
     * @param actions The available actions in registration order.
     * @param options The search budget.
     * @param cancellation Checked once per expansion.
     * @return A plan, or no plan with the reason.
     */
    public PlanResult plan(WorldState start, GoapGoal goal, List<GoapAction> actions, PlanningOptions options,
                           BooleanSupplier cancellation) {
        long startNanos = System.nanoTime();
        long deadline = startNanos + options.timeoutMs() * 1_000_000L;

        if (goal.isSatisfiedBy(start)) {
            return PlanResult.found(goal, List.of(), 0.0, 0, System.nanoTime() - startNanos, start);
        }

        PriorityQueue<Node> open = new PriorityQueue<>(Comparator
                .comparingDouble(Node::estimate)
                .thenComparingDouble(Node::cost)
                .thenComparingInt(Node::actionIndex)
                .thenComparingLong(Node::sequence));
        Map<WorldState, Double> bestCost = new HashMap<>();
        double stepCost = actions.stream().mapToDouble(GoapAction::cost).min().orElse(0.0);
        long sequence = 0;
        open.add(new Node(start, null, -1, null, 0.0, stepCost * goal.unsatisfiedCount(start), 0, sequence++));
        bestCost.put(start, 0.0);

        int expanded = 0;
        boolean depthLimited = false;
        while (!open.isEmpty()) {
            if (cancellation.getAsBoolean()) {
                return finish(goal, NoPlanReason.CANCELLED, expanded, startNanos);
            }
            if (System.nanoTime() >= deadline) {
                return finish(goal, NoPlanReason.TIMEOUT, expanded, startNanos);
            }
            Node node = open.poll();
            if (node.cost() > bestCost.getOrDefault(node.state(), Double.MAX_VALUE)) {
                continue;
            }
            if (goal.isSatisfiedBy(node.state())) {
                List<GoapAction> plan = reconstruct(node);
                long elapsed = System.nanoTime() - startNanos;
                LOG.debug("Planned {} steps for goal '{}' ({} nodes, {} us)", plan.size(), goal.id(), expanded, elapsed / 1000);
                return PlanResult.found(goal, plan, node.cost(), expanded, elapsed, node.state());
            }
            if (node.depth() >= options.maxDepth()) {
                depthLimited = true;
                continue;
            }
            if (expanded >= options.maxNodesExpanded()) {
                return finish(goal, NoPlanReason.NODE_BUDGET, expanded, startNanos);
            }
            expanded++;
            for (int i = 0; i < actions.size(); i++) {
                GoapAction action = actions.get(i);
                if (!action.isApplicable(node.state())) {
                    continue;
                }
                WorldState next = action.apply(node.state());
                double cost = node.cost() + action.cost();
                Double known = bestCost.get(next);
                if (known != null && known <= cost) {
                    continue;
                }
                bestCost.put(next, cost);
                open.add(new Node(next, node, i, action, cost, cost + stepCost * goal.unsatisfiedCount(next), node.depth() + 1, sequence++));
            }
        }
        return finish(goal, depthLimited ? NoPlanReason.DEPTH_LIMIT : NoPlanReason.UNREACHABLE, expanded, startNanos);
    }

    private static PlanResult finish(GoapGoal goal, NoPlanReason reason, int expanded, long startNanos) {
        LOG.debug("No plan for goal '{}': {} after {} nodes", goal.id(), reason, expanded);
        return PlanResult.noPlan(goal, reason, expanded, System.nanoTime() - startNanos);
    }

    private static List<GoapAction> reconstruct(Node node) {
        List<GoapAction> steps = new ArrayList<>();
        for (Node current = node; current.parent() != null; current = current.parent()) {
            steps.add(current.action());
        }
        Collections.reverse(steps);
        return steps;
    }

    private record Node(WorldState state, Node parent, int actionIndex, GoapAction action, double cost,
                        double estimate, int depth, long sequence) {
    }
}
