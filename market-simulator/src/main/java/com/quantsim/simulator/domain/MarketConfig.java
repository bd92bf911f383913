package com.quantsim.simulator.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Execution rules of the market a strategy trades in: cost model, slippage,
 * liquidity cap, settlement and fill timing. Immutable once built.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MarketConfig {

    private final BigDecimal commissionRate;
    private final BigDecimal minCommission;
    private final BigDecimal taxRate;
    private final BigDecimal slippageRate;
    private final BigDecimal volumeLimitFraction;
    private final SettlementMode settlementMode;
    private final ExecutionTiming executionTiming;

    @Builder(toBuilder = true)
    private MarketConfig(BigDecimal commissionRate,
                         BigDecimal minCommission,
                         BigDecimal taxRate,
                         BigDecimal slippageRate,
                         BigDecimal volumeLimitFraction,
                         SettlementMode settlementMode,
                         ExecutionTiming executionTiming) {
        this.commissionRate = commissionRate != null ? commissionRate : BigDecimal.ZERO;
        this.minCommission = minCommission != null ? minCommission : BigDecimal.ZERO;
        this.taxRate = taxRate != null ? taxRate : BigDecimal.ZERO;
        this.slippageRate = slippageRate != null ? slippageRate : BigDecimal.ZERO;
        this.volumeLimitFraction = volumeLimitFraction != null ? volumeLimitFraction : BigDecimal.ONE;
        this.settlementMode = settlementMode != null ? settlementMode : SettlementMode.IMMEDIATE;
        this.executionTiming = executionTiming != null ? executionTiming : ExecutionTiming.SAME_BAR_CLOSE;

        requireRate("commissionRate", this.commissionRate);
        requireRate("taxRate", this.taxRate);
        requireRate("slippageRate", this.slippageRate);
        if (this.minCommission.signum() < 0) {
            throw new IllegalArgumentException("minCommission must not be negative");
        }
        if (this.volumeLimitFraction.signum() <= 0 || this.volumeLimitFraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("volumeLimitFraction must be in (0, 1]");
        }
    }

    /**
     * US equities: no commission or stamp tax, light slippage, same-day settlement.
     */
    public static MarketConfig usMarket() {
        return MarketConfig.builder()
                .slippageRate(new BigDecimal("0.0005"))
                .build();
    }

    /**
     * China A-shares: commission with a 5 minimum, sell-side stamp tax, T+1 settlement
     * and a 10% share of daily volume per order.
     */
    public static MarketConfig cnMarket() {
        return MarketConfig.builder()
                .commissionRate(new BigDecimal("0.00025"))
                .minCommission(new BigDecimal("5"))
                .taxRate(new BigDecimal("0.0005"))
                .slippageRate(new BigDecimal("0.001"))
                .volumeLimitFraction(new BigDecimal("0.1"))
                .settlementMode(SettlementMode.NEXT_DAY_SETTLE)
                .build();
    }

    public boolean isLiquidityCapped() {
        return volumeLimitFraction.compareTo(BigDecimal.ONE) < 0;
    }

    public boolean isNextDaySettle() {
        return settlementMode == SettlementMode.NEXT_DAY_SETTLE;
    }

    private static void requireRate(String name, BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException(name + " must be in [0, 1)");
        }
    }
}
