package com.quantsim.simulator.engine;

import com.quantsim.simulator.marketdata.PriceHistoryStore;

import java.time.LocalDate;

/**
 * Builds an initialized {@link PriceHistoryStore} for an asset.
 */
@FunctionalInterface
public interface PriceHistoryLoader {

    /**
     * @throws com.quantsim.simulator.exception.SourceFetchException when the data cannot be obtained
     */
    PriceHistoryStore load(String asset, String source, LocalDate start, LocalDate end);
}
