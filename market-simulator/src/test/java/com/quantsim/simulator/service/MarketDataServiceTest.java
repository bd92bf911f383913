package com.quantsim.simulator.service;

import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.infrastructure.cache.InMemoryPriceCacheStore;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import com.quantsim.simulator.marketdata.PriceProviderRegistry;
import com.quantsim.simulator.marketdata.StaticPriceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.quantsim.simulator.marketdata.StaticPriceProvider.bar;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketDataService.
 */
class MarketDataServiceTest {

    private static final LocalDate MON = LocalDate.of(2024, 1, 8);
    private static final LocalDate FRI = LocalDate.of(2024, 1, 12);

    private StaticPriceProvider provider;
    private MarketDataService marketDataService;

    @BeforeEach
    void setUp() {
        provider = new StaticPriceProvider(List.of(
                bar(MON, "10"), bar(MON.plusDays(1), "11"), bar(MON.plusDays(2), "12"),
                bar(MON.plusDays(3), "13"), bar(FRI, "14")));
        marketDataService = new MarketDataService(new PriceProviderRegistry(List.of(provider)),
                new InMemoryPriceCacheStore(), 4);
    }

    @Test
    void testLoad_ReturnsInitializedStore() {
        // Act
        PriceHistoryStore store = marketDataService.load("A", "static", MON, FRI);

        // Assert
        assertEquals(5, store.size());
        assertEquals(1, provider.getFetches());
        assertTrue(store.priceOn(FRI).isPresent());
    }

    @Test
    void testLoad_SecondLoadServedFromSharedCache() {
        // Arrange
        marketDataService.load("A", "static", MON, FRI);

        // Act
        PriceHistoryStore again = marketDataService.load("A", "static", MON, FRI);

        // Assert
        assertEquals(5, again.size());
        assertEquals(1, provider.getFetches());
    }

    @Test
    void testLoad_UnknownSourceThrows() {
        // Act & Assert
        assertThrows(SourceFetchException.class,
                () -> marketDataService.load("A", "nowhere", MON, FRI));
    }
}
