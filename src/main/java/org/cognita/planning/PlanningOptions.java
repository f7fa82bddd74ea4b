package org.cognita.planning;

/**
 * Search budget of one planning request.
 *
 * @param maxDepth The maximum plan length.
 * @param timeoutMs The wall-clock limit.
 * @param maxNodesExpanded The maximum number of expanded search nodes.
 */
public record PlanningOptions(int maxDepth, long timeoutMs, int maxNodesExpanded) {

    public PlanningOptions {
        if (maxDepth <= 0 || timeoutMs <= 0 || maxNodesExpanded <= 0) {
            throw new IllegalArgumentException("Planning budget values must be positive: " + maxDepth + "/" + timeoutMs + "/" + maxNodesExpanded);
        }
    }

    /**
     * @return The budget of the LOW tier.
     */
    public static PlanningOptions defaults() {
        return new PlanningOptions(10, 100, 1000);
    }
}
