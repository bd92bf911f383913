package com.quantsim.simulator.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A request to buy or sell a number of units of an asset. The quantity is what the
 * strategy asks for; the execution engine may fill less.
 */
@Value
@Builder
public class OrderIntent {

    String asset;
    TradeAction action;
    long quantity;

    public static OrderIntent buy(String asset, long quantity) {
        return new OrderIntent(asset, TradeAction.BUY, quantity);
    }

    public static OrderIntent sell(String asset, long quantity) {
        return new OrderIntent(asset, TradeAction.SELL, quantity);
    }

    /**
     * Human-readable form used for decision notifications, e.g. {@code BUY 100 AAPL}.
     */
    public String describe() {
        return action + " " + quantity + " " + asset;
    }
}
