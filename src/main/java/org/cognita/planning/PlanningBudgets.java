package org.cognita.planning;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * The budget table: one {@link PlanningOptions} per {@link UrgencyTier}.
 */
public class PlanningBudgets {

    private final Map<UrgencyTier, PlanningOptions> budgets = new EnumMap<>(UrgencyTier.class);

    /**
     * Creates the default table: low 10/100 ms/1000, medium 6/50 ms/500, high 3/20 ms/200.
     */
    public PlanningBudgets() {
        this(ConfigFactory.empty());
    }

    /**
     * @param options The {@code cognita.planner} configuration subtree; {@code tiers.<tier>.maxDepth},
     *                {@code timeoutMs} and {@code maxNodes} override the defaults.
     */
    public PlanningBudgets(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "tiers.low.maxDepth", 10, "tiers.low.timeoutMs", 100, "tiers.low.maxNodes", 1000,
                "tiers.medium.maxDepth", 6, "tiers.medium.timeoutMs", 50, "tiers.medium.maxNodes", 500,
                "tiers.high.maxDepth", 3, "tiers.high.timeoutMs", 20, "tiers.high.maxNodes", 200));
        Config finalConfig = options.withFallback(defaults);
        for (UrgencyTier tier : UrgencyTier.values()) {
            Config tierConfig = finalConfig.getConfig("tiers." + tier.name().toLowerCase(Locale.ROOT));
            budgets.put(tier, new PlanningOptions(
                    tierConfig.getInt("maxDepth"),
                    tierConfig.getLong("timeoutMs"),
                    tierConfig.getInt("maxNodes")));
        }
    }

    public PlanningOptions forTier(UrgencyTier tier) {
        return budgets.get(tier);
    }

    public PlanningOptions forUrgency(double urgency) {
        return forTier(UrgencyTier.fromUrgency(urgency));
    }
}
