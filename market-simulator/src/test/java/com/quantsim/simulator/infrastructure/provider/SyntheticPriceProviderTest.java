package com.quantsim.simulator.infrastructure.provider;

import com.quantsim.simulator.domain.PriceBar;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SyntheticPriceProvider.
 */
class SyntheticPriceProviderTest {

    private final SyntheticPriceProvider provider = new SyntheticPriceProvider();

    @Test
    void testFetch_SkipsWeekendsAndStaysInRange() {
        // Arrange
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);

        // Act
        List<PriceBar> bars = provider.normalize(provider.fetchRaw("AAPL", start, end, Period.ofDays(1)));

        // Assert
        assertEquals(23, bars.size());
        for (PriceBar bar : bars) {
            assertNotEquals(DayOfWeek.SATURDAY, bar.getDate().getDayOfWeek());
            assertNotEquals(DayOfWeek.SUNDAY, bar.getDate().getDayOfWeek());
            assertFalse(bar.getDate().isBefore(start));
            assertFalse(bar.getDate().isAfter(end));
            assertTrue(bar.hasValidClose());
            assertNotNull(bar.getVolume());
        }
    }

    @Test
    void testFetch_OverlappingRangesAgree() {
        // Arrange
        Period daily = Period.ofDays(1);

        // Act
        List<PriceBar> wide = provider.normalize(
                provider.fetchRaw("MSFT", LocalDate.of(2023, 12, 1), LocalDate.of(2024, 1, 31), daily));
        List<PriceBar> narrow = provider.normalize(
                provider.fetchRaw("MSFT", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 19), daily));

        // Assert
        assertEquals(5, narrow.size());
        for (PriceBar bar : narrow) {
            PriceBar same = wide.stream().filter(b -> b.getDate().equals(bar.getDate())).findFirst().orElseThrow();
            assertEquals(same.getClose(), bar.getClose());
            assertEquals(same.getVolume(), bar.getVolume());
        }
    }

    @Test
    void testFetch_DifferentAssetsDiffer() {
        LocalDate day = LocalDate.of(2024, 1, 2);

        String aapl = provider.fetchRaw("AAPL", day, day, Period.ofDays(1));
        String msft = provider.fetchRaw("MSFT", day, day, Period.ofDays(1));

        assertNotEquals(aapl, msft);
    }

    @Test
    void testSourceName() {
        assertEquals("synthetic", provider.sourceName());
    }
}
