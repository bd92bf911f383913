package com.quantsim.simulator.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Result of {@link PerformanceMetrics#analyze}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceReport {

    private BigDecimal initialCapital;
    private BigDecimal finalValue;
    private BigDecimal totalReturn;
    private BigDecimal cagr;
    private BigDecimal maxDrawdown;
    private BigDecimal sharpeRatio;
    private BigDecimal sortinoRatio;
    private BigDecimal volatility;
    private BigDecimal winRate;
    private int totalTrades;
    private BigDecimal totalCost;
    private BigDecimal totalSlippage;
    private int tradingDays;
}
