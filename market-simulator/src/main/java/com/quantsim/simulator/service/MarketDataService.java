package com.quantsim.simulator.service;

import com.quantsim.simulator.engine.PriceHistoryLoader;
import com.quantsim.simulator.marketdata.PriceCacheStore;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import com.quantsim.simulator.marketdata.PriceProvider;
import com.quantsim.simulator.marketdata.PriceProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.Period;

/**
 * Service for loading price history.
 * Resolves the provider for the requested source and initializes a
 * {@link PriceHistoryStore} over the configured cache store.
 */
@Service
@Slf4j
public class MarketDataService implements PriceHistoryLoader {

    private final PriceProviderRegistry priceProviderRegistry;
    private final PriceCacheStore priceCacheStore;
    private final int endSlackDays;

    public MarketDataService(PriceProviderRegistry priceProviderRegistry, PriceCacheStore priceCacheStore,
                             @Value("${simulator.cache.end-slack-days:4}") int endSlackDays) {
        this.priceProviderRegistry = priceProviderRegistry;
        this.priceCacheStore = priceCacheStore;
        this.endSlackDays = endSlackDays;
    }

    @Override
    public PriceHistoryStore load(String asset, String source, LocalDate start, LocalDate end) {
        PriceProvider provider = priceProviderRegistry.get(source);
        PriceHistoryStore store = new PriceHistoryStore(asset, provider, priceCacheStore, Period.ofDays(1),
                endSlackDays);
        store.initialize(start, end);
        log.info("Price history for {} from {} ready: {} bars, {} fetch(es)", asset, source, store.size(),
                store.getFetchCount());
        return store;
    }
}
