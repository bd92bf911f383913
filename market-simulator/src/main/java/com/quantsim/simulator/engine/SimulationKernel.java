package com.quantsim.simulator.engine;

import com.quantsim.simulator.domain.ExecutionTiming;
import com.quantsim.simulator.domain.IndicatorSeries;
import com.quantsim.simulator.domain.OrderIntent;
import com.quantsim.simulator.domain.PerformanceMetrics;
import com.quantsim.simulator.domain.PerformanceReport;
import com.quantsim.simulator.domain.Strategy;
import com.quantsim.simulator.exception.SimulationStateException;
import com.quantsim.simulator.infrastructure.notification.Notifier;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives attached strategies through a discrete daily clock.
 * <p>
 * Lifecycle: {@code UNINITIALIZED -> INITIALIZING -> RUNNING -> FINALIZED}. Each tick runs,
 * per strategy: clear settlement holds, fill queued next-open orders, ask the strategy,
 * evaluate conditional orders, submit (or queue) the combined intents, record equity.
 * Indicator series are loaded with the assets and cut at the current tick.
 * Ticks run strictly in date order on the calling thread.
 */
@Slf4j
public class SimulationKernel {

    public enum State {
        UNINITIALIZED,
        INITIALIZING,
        RUNNING,
        FINALIZED
    }

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Period interval;
    private final int lookbackDays;
    private final PriceHistoryLoader priceHistoryLoader;
    private final Notifier notifier;
    private final String notificationRecipient;
    private final double riskFreeRate;

    private final List<Strategy> strategies = new ArrayList<>();
    private final Map<String, IndicatorSeries> indicators = new LinkedHashMap<>();
    private final Map<String, PriceHistoryStore> priceStores = new LinkedHashMap<>();
    private final Map<String, PriceHistoryStore> indicatorStores = new LinkedHashMap<>();
    private final List<StrategySession> sessions = new ArrayList<>();

    @Getter
    private State state = State.UNINITIALIZED;
    @Getter
    private LocalDate currentDate;

    @Builder
    private SimulationKernel(LocalDate startDate, LocalDate endDate, Period interval, int lookbackDays,
                             PriceHistoryLoader priceHistoryLoader, Notifier notifier,
                             String notificationRecipient, double riskFreeRate) {
        if (startDate == null || endDate == null || startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate must be on or before endDate");
        }
        if (priceHistoryLoader == null) {
            throw new IllegalArgumentException("priceHistoryLoader is required");
        }
        this.startDate = startDate;
        this.endDate = endDate;
        this.interval = interval != null ? interval : Period.ofDays(1);
        if (this.interval.isZero() || this.interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.lookbackDays = Math.max(0, lookbackDays);
        this.priceHistoryLoader = priceHistoryLoader;
        this.notifier = notifier;
        this.notificationRecipient = notificationRecipient;
        this.riskFreeRate = riskFreeRate;
        this.currentDate = startDate;
    }

    public void addStrategy(Strategy strategy) {
        if (state != State.UNINITIALIZED) {
            throw new SimulationStateException("Strategies must be added before initialization");
        }
        strategies.add(strategy);
    }

    /**
     * Register an indicator series shown to every strategy through its context.
     */
    public void addIndicator(IndicatorSeries series) {
        if (state != State.UNINITIALIZED) {
            throw new SimulationStateException("Indicators must be added before initialization");
        }
        if (indicators.putIfAbsent(series.getName(), series) != null) {
            throw new IllegalArgumentException("Duplicate indicator: " + series.getName());
        }
    }

    /**
     * Load price history for every referenced asset and call each strategy's init hook.
     *
     * @throws com.quantsim.simulator.exception.SourceFetchException when any asset cannot be loaded
     */
    public void initialize() {
        if (state != State.UNINITIALIZED) {
            throw new SimulationStateException("Kernel already initialized (state " + state + ")");
        }
        if (strategies.isEmpty()) {
            throw new SimulationStateException("No strategy attached");
        }
        state = State.INITIALIZING;

        LocalDate loadFrom = startDate.minusDays(lookbackDays);
        for (Strategy strategy : strategies) {
            for (String asset : strategy.getAssets()) {
                if (!priceStores.containsKey(asset)) {
                    String source = strategy.getDataSource(asset);
                    log.info("Loading {} from {} ({} to {})", asset, source, loadFrom, endDate);
                    priceStores.put(asset, priceHistoryLoader.load(asset, source, loadFrom, endDate));
                }
            }
        }

        for (IndicatorSeries series : indicators.values()) {
            log.info("Loading indicator {} ({} from {})", series.getName(), series.getAsset(), series.getSource());
            indicatorStores.put(series.getName(),
                    priceHistoryLoader.load(series.getAsset(), series.getSource(), loadFrom, endDate));
        }

        Map<String, PriceHistoryStore> readOnlyStores = Collections.unmodifiableMap(priceStores);
        Map<String, PriceHistoryStore> readOnlyIndicators = Collections.unmodifiableMap(indicatorStores);
        for (Strategy strategy : strategies) {
            StrategySession session = new StrategySession(strategy, readOnlyStores, readOnlyIndicators, startDate);
            sessions.add(session);
            strategy.onInit(session);
        }

        currentDate = startDate;
        state = State.RUNNING;
        log.info("Initialized {} strategy(ies) over {} asset(s) and {} indicator(s), {} to {}",
                strategies.size(), priceStores.size(), indicatorStores.size(), startDate, endDate);
    }

    /**
     * Run every remaining tick up to and including the end date.
     */
    public void run() {
        requireState(State.RUNNING);
        while (!currentDate.isAfter(endDate)) {
            step();
        }
    }

    /**
     * Run one tick and advance the clock by the interval.
     *
     * @return false when the clock is already past the end date
     */
    public boolean step() {
        requireState(State.RUNNING);
        if (currentDate.isAfter(endDate)) {
            return false;
        }
        LocalDate today = currentDate;
        for (StrategySession session : sessions) {
            tick(session, today);
        }
        currentDate = currentDate.plus(interval);
        return true;
    }

    /**
     * Call each strategy's teardown hook and compute its performance.
     */
    public List<StrategyRunResult> finish() {
        requireState(State.RUNNING);
        if (!currentDate.isAfter(endDate)) {
            log.warn("Finishing before the end date; last simulated day is {}", currentDate.minus(interval));
        }

        List<StrategyRunResult> results = new ArrayList<>();
        for (StrategySession session : sessions) {
            Strategy strategy = session.getStrategy();
            strategy.onFinalize(session);

            PerformanceReport report = PerformanceMetrics.analyze(session.getEquityCurve(),
                    session.getTradeLog(), strategy.getInitialCapital(), riskFreeRate);
            ExecutionEngine engine = session.getEngine();
            if (!session.getOpenQueue().isEmpty()) {
                log.info("{} order(s) of {} still queued at end of run; discarded",
                        session.getOpenQueue().size(), strategy.getName());
            }

            results.add(StrategyRunResult.builder()
                    .strategyName(strategy.getName())
                    .initialCapital(strategy.getInitialCapital())
                    .finalCash(engine.getCash())
                    .holdings(engine.getAccount().getHoldings())
                    .trades(new ArrayList<>(session.getTradeLog()))
                    .equityCurve(new ArrayList<>(session.getEquityCurve()))
                    .pendingPromises(session.getPendingPromises())
                    .report(report)
                    .stats(engine.getStats())
                    .build());

            log.info("Strategy {} finished - trades: {}, final value: {}, return: {}, max DD: {}",
                    strategy.getName(), report.getTotalTrades(), report.getFinalValue(),
                    report.getTotalReturn(), report.getMaxDrawdown());
        }
        state = State.FINALIZED;
        return results;
    }

    public Map<String, PriceHistoryStore> getPriceStores() {
        return Collections.unmodifiableMap(priceStores);
    }

    private void tick(StrategySession session, LocalDate today) {
        ExecutionEngine engine = session.getEngine();
        Strategy strategy = session.getStrategy();

        session.advanceTo(today);
        engine.clearSettlement();
        session.drainOpenQueue(today);

        List<OrderIntent> decided = strategy.decide(today, session.visibleHistory(today), engine.getAccount());
        List<OrderIntent> fired = session.getConditionalOrders().evaluate(today);

        List<OrderIntent> combined = new ArrayList<>(fired);
        if (decided != null) {
            combined.addAll(decided);
        }

        if (!combined.isEmpty()) {
            if (engine.getMarketConfig().getExecutionTiming() == ExecutionTiming.NEXT_BAR_OPEN) {
                session.enqueueForNextOpen(combined);
            } else {
                engine.submit(combined, today);
            }
            notifyDecisions(strategy, today, combined);
        }

        session.recordEquity(today);
    }

    private void notifyDecisions(Strategy strategy, LocalDate today, List<OrderIntent> intents) {
        if (notifier == null || notificationRecipient == null || notificationRecipient.isBlank()) {
            return;
        }
        List<String> decisions = new ArrayList<>();
        for (OrderIntent intent : intents) {
            decisions.add(today + " " + strategy.getName() + ": " + intent.describe());
        }
        try {
            notifier.sendDecisions(notificationRecipient, decisions);
        } catch (RuntimeException e) {
            log.warn("Failed to deliver decisions to {}: {}", notificationRecipient, e.getMessage());
        }
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new SimulationStateException("Expected state " + expected + " but was " + state);
        }
    }
}
