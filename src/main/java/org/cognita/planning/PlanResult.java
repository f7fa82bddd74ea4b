package org.cognita.planning;

import java.util.List;

/**
 * The outcome of a planning request: a complete plan, or no plan with a reason.
 *
 * @param found true if a plan was found.
 * @param goal The goal planned for.
 * @param actions The plan steps in order; empty if the goal was already satisfied or no plan was found.
 * @param totalCost The summed action cost.
 * @param reason Why no plan was found, or null.
 * @param nodesExpanded The number of expanded search nodes.
 * @param planningTimeNanos The time spent searching.
 * @param expectedFinalState The state after executing the plan, or null.
 */
public record PlanResult(
        boolean found,
        GoapGoal goal,
        List<GoapAction> actions,
        double totalCost,
        NoPlanReason reason,
        int nodesExpanded,
        long planningTimeNanos,
        WorldState expectedFinalState
) {
    public PlanResult {
        actions = List.copyOf(actions);
    }

    static PlanResult found(GoapGoal goal, List<GoapAction> actions, double cost, int nodes, long nanos, WorldState end) {
        return new PlanResult(true, goal, actions, cost, null, nodes, nanos, end);
    }

    static PlanResult noPlan(GoapGoal goal, NoPlanReason reason, int nodes, long nanos) {
        return new PlanResult(false, goal, List.of(), 0.0, reason, nodes, nanos, null);
    }

    public List<String> actionIds() {
        return actions.stream().map(GoapAction::id).toList();
    }

    public double planningTimeMs() {
        return planningTimeNanos / 1_000_000.0;
    }
}
