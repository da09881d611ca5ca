package org.fixedratio.stresstest.core.budget;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.fixedratio.stresstest.api.chain.IChainClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps contract operations to the compute units requested for their transactions.
 * <p>
 * Most operations have a fixed cost. Fee consolidation scales with the number of pools and
 * donations get a larger budget above a size threshold. Unknown operations fall back to
 * {@link #DEFAULT_UNITS}; the budgeter never refuses to produce a budget.
 * <p>
 * Configuration (all optional):
 * <pre>
 * budget {
 *   overrides {
 *     "process_swap_execute" = 260000
 *   }
 * }
 * </pre>
 */
public class ResourceBudgeter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBudgeter.class);

    public static final String DEPOSIT = "process_liquidity_deposit";
    public static final String WITHDRAW = "process_liquidity_withdraw";
    public static final String SWAP = "process_swap_execute";
    public static final String POOL_INITIALIZE = "process_pool_initialize";
    public static final String CONSOLIDATE = "process_consolidate_pool_fees";
    public static final String DONATE = "process_treasury_donate_sol";

    public static final int DEFAULT_UNITS = 150_000;

    static final int CONSOLIDATION_BASE = 4_000;
    static final int CONSOLIDATION_PER_POOL = 5_000;
    static final int CONSOLIDATION_MAX = 150_000;
    static final int SMALL_DONATION_UNITS = 25_000;
    static final int LARGE_DONATION_UNITS = 120_000;
    static final long SMALL_DONATION_LIMIT = 1_000L * IChainClient.NATIVE_UNITS_PER_COIN;

    private static final Map<String, Integer> STATIC_BUDGETS = Map.ofEntries(
        Map.entry(DEPOSIT, 310_000),
        Map.entry(WITHDRAW, 290_000),
        Map.entry(SWAP, 250_000),
        Map.entry(POOL_INITIALIZE, 150_000),
        Map.entry(CONSOLIDATE, 150_000),
        Map.entry(DONATE, 150_000),
        Map.entry("process_system_pause", 150_000),
        Map.entry("process_system_unpause", 150_000),
        Map.entry("process_treasury_withdraw_fees", 150_000),
        Map.entry("process_treasury_get_info", 150_000),
        Map.entry("process_pool_pause", 150_000),
        Map.entry("process_pool_unpause", 150_000),
        Map.entry("process_pool_update_fees", 150_000),
        Map.entry("process_swap_set_owner_only", 150_000)
    );

    private final Map<String, Integer> overrides;

    public ResourceBudgeter() {
        this(ConfigFactory.empty());
    }

    /**
     * Creates a budgeter with optional per-operation overrides.
     *
     * @param options The {@code budget} configuration block.
     */
    public ResourceBudgeter(Config options) {
        Map<String, Integer> parsed = new HashMap<>();
        if (options.hasPath("overrides")) {
            for (Map.Entry<String, ConfigValue> entry : options.getObject("overrides").entrySet()) {
                int units = ((Number) entry.getValue().unwrapped()).intValue();
                if (units <= 0) {
                    throw new IllegalArgumentException("Compute budget override for '" + entry.getKey() + "' must be positive");
                }
                parsed.put(entry.getKey(), units);
            }
        }
        this.overrides = Collections.unmodifiableMap(parsed);
        if (!overrides.isEmpty()) {
            LOGGER.debug("Compute budget overrides: {}", overrides);
        }
    }

    public int getBudget(String operationName) {
        return getBudget(operationName, null);
    }

    /**
     * Returns the compute budget for an operation.
     *
     * @param operationName The contract instruction name.
     * @param context       Dynamic inputs, may be {@code null}. Dynamic operations then use their table value.
     * @return The number of compute units to request.
     */
    public int getBudget(String operationName, BudgetContext context) {
        Integer override = overrides.get(operationName);
        if (override != null) {
            return override;
        }
        // Without a context the dynamic operations take their table value.
        if (CONSOLIDATE.equals(operationName) && context != null) {
            int poolCount = Math.max(0, context.poolCount());
            long units = CONSOLIDATION_BASE + (long) CONSOLIDATION_PER_POOL * poolCount;
            LOGGER.debug("Calculated {} compute units for consolidation of {} pools", units, poolCount);
            return (int) Math.min(units, CONSOLIDATION_MAX);
        }
        if (DONATE.equals(operationName) && context != null) {
            long amount = context.donationAmount();
            return amount <= SMALL_DONATION_LIMIT ? SMALL_DONATION_UNITS : LARGE_DONATION_UNITS;
        }
        Integer units = STATIC_BUDGETS.get(operationName);
        if (units == null) {
            LOGGER.warn("No compute budget defined for operation '{}', using default of {}", operationName, DEFAULT_UNITS);
            return DEFAULT_UNITS;
        }
        return units;
    }
}
