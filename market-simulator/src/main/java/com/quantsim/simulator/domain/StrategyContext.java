package com.quantsim.simulator.domain;

import java.time.Period;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Services the simulator offers a strategy outside of {@link Strategy#decide}.
 */
public interface StrategyContext {

    /**
     * Register a conditional order, evaluated from the current tick onwards.
     */
    void promise(ConditionalOrder order);

    List<ConditionalOrder> getPendingPromises();

    List<TradeRecord> getTradeLog();

    /**
     * Names of the indicator series registered with the simulation.
     */
    Set<String> getIndicatorNames();

    /**
     * Latest bar of the named indicator dated on or before the current tick.
     * Empty for an unknown name or before the series starts.
     */
    Optional<PriceBar> indicatorToday(String name);

    /**
     * Bars of the named indicator dated within {@code window} before the current tick,
     * current tick included, ascending. Never contains later bars.
     */
    List<PriceBar> indicatorHistory(String name, Period window);
}
