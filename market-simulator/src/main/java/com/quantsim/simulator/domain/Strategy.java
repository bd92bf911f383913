package com.quantsim.simulator.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strategy interface for implementing trading decisions.
 * A strategy is a black box: it sees point-in-time price history and a copy of its
 * account, and answers with order intents. Execution is left to the engine.
 */
public interface Strategy {

    /**
     * Get the strategy name.
     */
    String getName();

    /**
     * Assets whose price history this strategy needs.
     */
    Set<String> getAssets();

    /**
     * Execution rules for this strategy's account.
     */
    MarketConfig getMarketConfig();

    BigDecimal getInitialCapital();

    /**
     * Name of the price provider to load the given asset from.
     */
    default String getDataSource(String asset) {
        return "synthetic";
    }

    /**
     * Called once after price data is loaded and before the first tick.
     *
     * @param context handle for registering conditional orders
     */
    default void onInit(StrategyContext context) {
    }

    /**
     * Called once per tick.
     *
     * @param today          the simulated date
     * @param visibleHistory per asset, the bars dated on or before {@code today}, ascending
     * @param account        a detached copy of the account
     * @return the orders to submit this tick, possibly empty
     */
    List<OrderIntent> decide(LocalDate today, Map<String, List<PriceBar>> visibleHistory, AccountState account);

    /**
     * Called after the last tick.
     *
     * @param context handle exposing the final trade log
     */
    default void onFinalize(StrategyContext context) {
    }
}
