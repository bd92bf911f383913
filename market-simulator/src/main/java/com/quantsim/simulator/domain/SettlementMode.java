package com.quantsim.simulator.domain;

/**
 * When bought units become sellable.
 */
public enum SettlementMode {
    /** Bought units can be sold in the same tick. */
    IMMEDIATE,
    /** T+1: units bought on day D become sellable on D+1. */
    NEXT_DAY_SETTLE
}
