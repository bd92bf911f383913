package com.quantsim.simulator.engine;

import com.quantsim.simulator.domain.ConditionalOrder;
import com.quantsim.simulator.domain.EquitySnapshot;
import com.quantsim.simulator.domain.PerformanceReport;
import com.quantsim.simulator.domain.TradeRecord;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one strategy after {@link SimulationKernel#finish()}.
 */
@Data
@Builder
public class StrategyRunResult {

    private String strategyName;
    private BigDecimal initialCapital;
    private BigDecimal finalCash;
    private Map<String, Long> holdings;
    private List<TradeRecord> trades;
    private List<EquitySnapshot> equityCurve;
    private List<ConditionalOrder> pendingPromises;
    private PerformanceReport report;
    private ExecutionEngine.ExecutionStats stats;
}
