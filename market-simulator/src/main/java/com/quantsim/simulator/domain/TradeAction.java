package com.quantsim.simulator.domain;

public enum TradeAction {
    BUY,
    SELL;

    /**
     * Sign applied to a quantity when this action mutates holdings.
     */
    public long sign() {
        return this == BUY ? 1L : -1L;
    }
}
