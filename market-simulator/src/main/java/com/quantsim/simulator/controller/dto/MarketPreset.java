package com.quantsim.simulator.controller.dto;

import com.quantsim.simulator.domain.MarketConfig;

/**
 * Market rule presets selectable from the API.
 */
public enum MarketPreset {
    US,
    CN;

    public MarketConfig toMarketConfig() {
        return this == CN ? MarketConfig.cnMarket() : MarketConfig.usMarket();
    }
}
