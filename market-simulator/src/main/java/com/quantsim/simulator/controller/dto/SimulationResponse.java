package com.quantsim.simulator.controller.dto;

import com.quantsim.simulator.domain.EquitySnapshot;
import com.quantsim.simulator.domain.TradeRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a simulation run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResponse {

    private Long id;
    private String strategyName;
    private List<String> assets;
    private String market;
    private LocalDate startDate;
    private LocalDate endDate;
    private String message;
    private Boolean isExisting;

    private BigDecimal initialCapital;
    private BigDecimal finalValue;
    private BigDecimal finalCash;
    private Map<String, Long> holdings;

    private BigDecimal totalReturn;
    private BigDecimal cagr;
    private BigDecimal volatility;
    private BigDecimal sharpeRatio;
    private BigDecimal sortinoRatio;
    private BigDecimal maxDrawdown;
    private BigDecimal winRate;
    private Integer totalTrades;
    private BigDecimal totalCost;
    private BigDecimal totalSlippage;
    private Long executionTimeMs;

    private List<TradeRecord> trades;
    private List<EquitySnapshot> equityCurve;
}
