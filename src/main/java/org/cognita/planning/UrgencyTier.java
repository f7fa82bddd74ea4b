package org.cognita.planning;

/**
 * Urgency bands selecting a planning budget. The thresholds are fixed; the budgets per tier are
 * configured in {@link PlanningBudgets}.
 */
public enum UrgencyTier {
    LOW,
    MEDIUM,
    HIGH;

    public static final double MEDIUM_THRESHOLD = 0.3;
    public static final double HIGH_THRESHOLD = 0.7;

    /**
     * @param urgency Urgency in [0, 1]; values outside are clamped.
     */
    public static UrgencyTier fromUrgency(double urgency) {
        if (urgency < MEDIUM_THRESHOLD) {
            return LOW;
        }
        if (urgency < HIGH_THRESHOLD) {
            return MEDIUM;
        }
        return HIGH;
    }

    /**
     * Higher tiers plan under tighter budgets, so the next lower tier searches at least as far.
     * @return The next lower tier, or LOW itself.
     */
    public UrgencyTier relax() {
        return this == HIGH ? MEDIUM : LOW;
    }

    /**
     * @return An urgency value inside this tier, used when retrying under a relaxed budget.
     */
    public double representativeUrgency() {
        return switch (this) {
            case LOW -> 0.0;
            case MEDIUM -> MEDIUM_THRESHOLD;
            case HIGH -> HIGH_THRESHOLD;
        };
    }
}
