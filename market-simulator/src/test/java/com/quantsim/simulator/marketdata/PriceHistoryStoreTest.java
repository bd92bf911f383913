package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.CacheCorruptedException;
import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.infrastructure.cache.InMemoryPriceCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.quantsim.simulator.marketdata.StaticPriceProvider.bar;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PriceHistoryStore caching and lookups.
 */
@ExtendWith(MockitoExtension.class)
class PriceHistoryStoreTest {

    private static final LocalDate MON = LocalDate.of(2024, 1, 8);
    private static final LocalDate TUE = LocalDate.of(2024, 1, 9);
    private static final LocalDate WED = LocalDate.of(2024, 1, 10);
    private static final LocalDate FRI = LocalDate.of(2024, 1, 12);
    private static final LocalDate NEXT_FRI = LocalDate.of(2024, 1, 19);

    @Mock
    private PriceProvider provider;

    private InMemoryPriceCacheStore cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryPriceCacheStore();
        lenient().when(provider.sourceName()).thenReturn("static");
    }

    @Test
    void testInitialize_FetchesOnMissThenServesFromCache() {
        // Arrange
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("raw");
        when(provider.normalize("raw")).thenReturn(List.of(bar(MON, "10"), bar(WED, "11"), bar(FRI, "12")));

        // Act
        PriceHistoryStore first = new PriceHistoryStore("AAPL", provider, cache);
        first.initialize(MON, FRI);
        PriceHistoryStore second = new PriceHistoryStore("AAPL", provider, cache);
        second.initialize(MON, FRI);

        // Assert
        assertEquals(1, first.getFetchCount());
        assertEquals(0, second.getFetchCount());
        assertEquals(3, second.size());
        verify(provider, times(1)).fetchRaw(eq("AAPL"), eq(MON), eq(FRI), eq(Period.ofDays(1)));
        assertEquals(1, cache.size());
    }

    @Test
    void testInitialize_EndSlackCountsAsCovered() {
        // Arrange
        cache.save(entry("raw", bar(MON, "10"), bar(WED, "11")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act - end minus 4 days is Tuesday
        store.initialize(MON, LocalDate.of(2024, 1, 13));

        // Assert
        assertEquals(0, store.getFetchCount());
        verify(provider, never()).fetchRaw(any(), any(), any(), any());
    }

    @Test
    void testInitialize_PartialCacheMergesNewOverOld() {
        // Arrange
        cache.save(entry("old", bar(MON, "10"), bar(TUE, "10")));
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("new");
        when(provider.normalize("new")).thenReturn(List.of(bar(TUE, "20"), bar(WED, "21"), bar(FRI, "22")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act
        store.initialize(MON, NEXT_FRI);

        // Assert
        assertEquals(1, store.getFetchCount());
        assertEquals(4, store.size());
        assertEquals(new BigDecimal("10"), store.priceOn(MON).orElseThrow().getClose());
        assertEquals(new BigDecimal("20"), store.priceOn(TUE).orElseThrow().getClose());
        PriceCacheEntry saved = cache.load(new CacheKey("AAPL", "static", "1d")).orElseThrow();
        assertEquals(4, saved.getBars().size());
        assertEquals(MON, saved.getMinDate());
        assertEquals(FRI, saved.getMaxDate());
        assertEquals("new", saved.getRawPayload());
    }

    @Test
    void testInitialize_CorruptedCacheTriggersFetch() {
        // Arrange
        PriceCacheStore broken = mock(PriceCacheStore.class);
        when(broken.load(any())).thenThrow(new CacheCorruptedException("bad json", null));
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("raw");
        when(provider.normalize("raw")).thenReturn(List.of(bar(MON, "10")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, broken);

        // Act
        store.initialize(MON, MON);

        // Assert
        assertEquals(1, store.getFetchCount());
        assertTrue(store.priceOn(MON).isPresent());
        verify(broken).save(any(PriceCacheEntry.class));
    }

    @Test
    void testInitialize_FetchFailurePropagatesEvenWithPartialCache() {
        // Arrange
        cache.save(entry("old", bar(MON, "10")));
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any()))
                .thenThrow(new SourceFetchException("source down"));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act & Assert
        SourceFetchException thrown = assertThrows(SourceFetchException.class,
                () -> store.initialize(MON, NEXT_FRI));
        assertEquals("source down", thrown.getMessage());
    }

    @Test
    void testInitialize_UnexpectedProviderErrorIsWrapped() {
        // Arrange
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("raw");
        when(provider.normalize("raw")).thenThrow(new IllegalStateException("boom"));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act & Assert
        SourceFetchException thrown = assertThrows(SourceFetchException.class, () -> store.initialize(MON, FRI));
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }

    @Test
    void testInitialize_EmptyFetchWithoutCacheFails() {
        // Arrange
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("");
        when(provider.normalize("")).thenReturn(Collections.emptyList());
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act & Assert
        assertThrows(SourceFetchException.class, () -> store.initialize(MON, FRI));
        assertEquals(0, cache.size());
    }

    @Test
    void testInitialize_StartOnWeekendServedFromCache() {
        // Arrange
        LocalDate saturday = LocalDate.of(2024, 1, 6);
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("raw");
        when(provider.normalize("raw")).thenReturn(List.of(bar(MON, "10"), bar(WED, "11"), bar(FRI, "12")));
        new PriceHistoryStore("AAPL", provider, cache).initialize(saturday, FRI);

        // Act
        PriceHistoryStore second = new PriceHistoryStore("AAPL", provider, cache);
        second.initialize(saturday, FRI);

        // Assert
        assertEquals(0, second.getFetchCount());
        assertTrue(second.isComplete(saturday, FRI));
        PriceCacheEntry saved = cache.load(new CacheKey("AAPL", "static", "1d")).orElseThrow();
        assertEquals(saturday, saved.getCoveredFrom());
        assertEquals(FRI, saved.getCoveredTo());
        assertEquals(MON, saved.getMinDate());
        verify(provider, times(1)).fetchRaw(any(), any(), any(), any());
    }

    @Test
    void testInitialize_DisjointFetchReplacesCoveredRange() {
        // Arrange
        LocalDate march = LocalDate.of(2024, 3, 4);
        cache.save(entry("old", bar(MON, "10"), bar(FRI, "12")));
        when(provider.fetchRaw(eq("AAPL"), any(), any(), any())).thenReturn("new");
        when(provider.normalize("new")).thenReturn(List.of(bar(march, "30")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        // Act
        store.initialize(march, march.plusDays(4));

        // Assert
        assertEquals(1, store.getFetchCount());
        assertTrue(store.isComplete(march, march.plusDays(4)));
        assertFalse(store.isComplete(MON, march.plusDays(4)));
    }

    @Test
    void testHistoryUpTo_CopyCannotAlterStore() {
        // Arrange
        cache.save(entry("raw", bar(MON, "100"), bar(TUE, "101")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache, Period.ofDays(1), 0);
        store.initialize(MON, TUE);

        // Act
        List<PriceBar> history = store.historyUpTo(TUE);
        history.set(0, bar(MON, "1"));
        history.remove(1);

        // Assert
        assertEquals(new BigDecimal("100"), store.priceOn(MON).orElseThrow().getClose());
        assertEquals(2, store.historyUpTo(TUE).size());
    }

    @Test
    void testRenormalize_ReplaysRawPayloadWithoutFetching() {
        // Arrange
        cache.save(entry("raw", bar(MON, "10")));
        when(provider.normalize("raw")).thenReturn(List.of(bar(MON, "10.5"), bar(TUE, "11")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache, Period.ofDays(1), 0);
        store.initialize(MON, MON);

        // Act
        store.renormalize();

        // Assert
        assertEquals(new BigDecimal("10.5"), store.priceOn(MON).orElseThrow().getClose());
        assertEquals(2, store.size());
        verify(provider, never()).fetchRaw(any(), any(), any(), any());
        assertEquals(2, cache.load(new CacheKey("AAPL", "static", "1d")).orElseThrow().getBars().size());
    }

    @Test
    void testHistoryUpTo_InclusiveAndOrdered() {
        // Arrange
        cache.save(entry("raw", bar(MON, "10"), bar(TUE, "11"), bar(WED, "12")));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache, Period.ofDays(1), 0);
        store.initialize(MON, WED);

        // Act
        List<PriceBar> history = store.historyUpTo(TUE);

        // Assert
        assertEquals(2, history.size());
        assertEquals(MON, history.get(0).getDate());
        assertEquals(TUE, history.get(1).getDate());
        assertTrue(store.historyUpTo(MON.minusDays(1)).isEmpty());
    }

    @Test
    void testVolumeOn_ZeroWhenUnknown() {
        // Arrange
        cache.save(entry("raw", bar(MON, "10", "10", null), bar(TUE, "11", "11", 500L)));
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache, Period.ofDays(1), 0);
        store.initialize(MON, TUE);

        // Act & Assert
        assertEquals(0, store.volumeOn(MON));
        assertEquals(500, store.volumeOn(TUE));
        assertEquals(0, store.volumeOn(WED));
    }

    @Test
    void testLookupsBeforeInitialize_Rejected() {
        PriceHistoryStore store = new PriceHistoryStore("AAPL", provider, cache);

        assertThrows(IllegalStateException.class, () -> store.priceOn(MON));
        assertThrows(IllegalStateException.class, () -> store.historyUpTo(MON));
        assertFalse(store.isComplete(MON, FRI));
    }

    @Test
    void testIntervalLabel() {
        assertEquals("1d", PriceHistoryStore.intervalLabel(Period.ofDays(1)));
        assertEquals("1w", PriceHistoryStore.intervalLabel(Period.ofWeeks(1)));
    }

    private static PriceCacheEntry entry(String raw, PriceBar... bars) {
        return PriceCacheEntry.builder()
                .asset("AAPL")
                .source("static")
                .interval("1d")
                .rawPayload(raw)
                .bars(List.of(bars))
                .minDate(bars[0].getDate())
                .maxDate(bars[bars.length - 1].getDate())
                .build();
    }
}
