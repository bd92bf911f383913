package com.quantsim.simulator.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing a finished simulation run.
 * Contains performance metrics and the trade log and equity curve in JSON format.
 */
@Entity
@Table(name = "simulation_results", indexes = {
        @Index(name = "idx_idempotency_key", columnList = "idempotency_key", unique = true)
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, length = 64)
    private String idempotencyKey;

    @Column(name = "strategy_name", nullable = false, length = 100)
    private String strategyName;

    // comma separated
    @Column(name = "assets", nullable = false, length = 500)
    private String assets;

    @Column(name = "market", nullable = false, length = 8)
    private String market;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "initial_capital", nullable = false, precision = 19, scale = 2)
    private BigDecimal initialCapital;

    @Column(name = "final_value", precision = 19, scale = 2)
    private BigDecimal finalValue;

    @Column(name = "final_cash", precision = 19, scale = 2)
    private BigDecimal finalCash;

    @Column(name = "total_return", precision = 12, scale = 6)
    private BigDecimal totalReturn;

    @Column(name = "cagr", precision = 12, scale = 6)
    private BigDecimal cagr;

    @Column(name = "volatility", precision = 12, scale = 6)
    private BigDecimal volatility;

    @Column(name = "sharpe_ratio", precision = 12, scale = 6)
    private BigDecimal sharpeRatio;

    @Column(name = "sortino_ratio", precision = 12, scale = 6)
    private BigDecimal sortinoRatio;

    @Column(name = "max_drawdown", precision = 12, scale = 6)
    private BigDecimal maxDrawdown;

    @Column(name = "win_rate", precision = 10, scale = 4)
    private BigDecimal winRate;

    @Column(name = "total_trades")
    private Integer totalTrades;

    @Column(name = "total_cost", precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "total_slippage", precision = 19, scale = 2)
    private BigDecimal totalSlippage;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "trades_json", columnDefinition = "TEXT")
    private String tradesJson;

    @Column(name = "equity_curve_json", columnDefinition = "TEXT")
    private String equityCurveJson;

    @Column(name = "holdings_json", columnDefinition = "TEXT")
    private String holdingsJson;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
