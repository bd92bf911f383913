package com.quantsim.simulator.service;

import com.quantsim.simulator.engine.ExecutionEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking simulation metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class SimulationMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter fillsCounter;
    private final Counter settlementClippedCounter;
    private final Counter liquidityClippedCounter;
    private final Counter ordersSkippedCounter;
    private final Timer runTimer;

    public SimulationMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("simulation.runs.completed")
                .description("Total number of simulations completed")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("simulation.runs.failed")
                .description("Total number of simulations aborted")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("simulation.fills")
                .description("Orders filled by the execution engine")
                .register(meterRegistry);

        this.settlementClippedCounter = Counter.builder("simulation.orders.clipped")
                .tag("reason", "settlement")
                .description("Sell orders clipped by unsettled holdings")
                .register(meterRegistry);

        this.liquidityClippedCounter = Counter.builder("simulation.orders.clipped")
                .tag("reason", "liquidity")
                .description("Orders clipped by the daily volume cap")
                .register(meterRegistry);

        this.ordersSkippedCounter = Counter.builder("simulation.orders.skipped")
                .description("Orders dropped because no price was available")
                .register(meterRegistry);

        this.runTimer = Timer.builder("simulation.run.time")
                .description("Simulation run time")
                .register(meterRegistry);
    }

    public void recordRunCompleted(long executionTimeMs, ExecutionEngine.ExecutionStats stats) {
        runsCompletedCounter.increment();
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
        fillsCounter.increment(stats.getFills());
        settlementClippedCounter.increment(stats.getSettlementClipped());
        liquidityClippedCounter.increment(stats.getLiquidityClipped());
        ordersSkippedCounter.increment(stats.getSkippedNoPrice());
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Fills=%d, AvgRunTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) fillsCounter.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
