package com.quantsim.simulator.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketConfig presets and validation.
 */
class MarketConfigTest {

    @Test
    void testDefaults_FrictionlessSameBar() {
        MarketConfig config = MarketConfig.builder().build();

        assertEquals(0, config.getCommissionRate().signum());
        assertEquals(0, config.getSlippageRate().signum());
        assertFalse(config.isLiquidityCapped());
        assertFalse(config.isNextDaySettle());
        assertEquals(ExecutionTiming.SAME_BAR_CLOSE, config.getExecutionTiming());
    }

    @Test
    void testCnMarket_CappedAndNextDaySettle() {
        MarketConfig config = MarketConfig.cnMarket();

        assertTrue(config.isLiquidityCapped());
        assertTrue(config.isNextDaySettle());
        assertEquals(new BigDecimal("5"), config.getMinCommission());
    }

    @Test
    void testToBuilder_OverridesTimingOnly() {
        MarketConfig config = MarketConfig.usMarket().toBuilder()
                .executionTiming(ExecutionTiming.NEXT_BAR_OPEN)
                .build();

        assertEquals(ExecutionTiming.NEXT_BAR_OPEN, config.getExecutionTiming());
        assertEquals(MarketConfig.usMarket().getSlippageRate(), config.getSlippageRate());
    }

    @Test
    void testRejectsOutOfRangeRates() {
        assertThrows(IllegalArgumentException.class,
                () -> MarketConfig.builder().commissionRate(new BigDecimal("-0.01")).build());
        assertThrows(IllegalArgumentException.class,
                () -> MarketConfig.builder().slippageRate(BigDecimal.ONE).build());
        assertThrows(IllegalArgumentException.class,
                () -> MarketConfig.builder().volumeLimitFraction(BigDecimal.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> MarketConfig.builder().minCommission(new BigDecimal("-5")).build());
    }
}
