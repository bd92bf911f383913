package com.quantsim.simulator.engine;

import com.quantsim.simulator.domain.ConditionalOrder;
import com.quantsim.simulator.domain.EquitySnapshot;
import com.quantsim.simulator.domain.OrderIntent;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.domain.Strategy;
import com.quantsim.simulator.domain.StrategyContext;
import com.quantsim.simulator.domain.TradeRecord;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-strategy run state: the strategy's own ledger, conditional orders, next-open
 * queue and equity curve. Nothing here is shared between strategies.
 */
@Getter
class StrategySession implements StrategyContext {

    private final Strategy strategy;
    private final Map<String, PriceHistoryStore> priceStores;
    private final Map<String, PriceHistoryStore> indicatorStores;
    private final ExecutionEngine engine;
    private final ConditionalOrderManager conditionalOrders;
    private final List<EquitySnapshot> equityCurve = new ArrayList<>();

    // FIFO of intents waiting for the next bar's open
    private final Deque<OrderIntent> openQueue = new ArrayDeque<>();

    // date the indicator views are cut at
    private LocalDate today;

    StrategySession(Strategy strategy, Map<String, PriceHistoryStore> priceStores,
                    Map<String, PriceHistoryStore> indicatorStores, LocalDate startDate) {
        this.strategy = strategy;
        this.priceStores = priceStores;
        this.indicatorStores = indicatorStores;
        this.today = startDate;
        this.engine = new ExecutionEngine(strategy.getMarketConfig(), strategy.getInitialCapital(), priceStores);
        this.conditionalOrders = new ConditionalOrderManager(priceStores);
    }

    @Override
    public void promise(ConditionalOrder order) {
        conditionalOrders.add(order);
    }

    @Override
    public List<ConditionalOrder> getPendingPromises() {
        return conditionalOrders.getPending();
    }

    @Override
    public List<TradeRecord> getTradeLog() {
        return engine.getTradeLog();
    }

    @Override
    public Set<String> getIndicatorNames() {
        return indicatorStores.keySet();
    }

    @Override
    public Optional<PriceBar> indicatorToday(String name) {
        List<PriceBar> history = indicatorHistory(name, null);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public List<PriceBar> indicatorHistory(String name, Period window) {
        PriceHistoryStore store = indicatorStores.get(name);
        if (store == null) {
            return Collections.emptyList();
        }
        List<PriceBar> history = store.historyUpTo(today);
        if (window == null) {
            return history;
        }
        LocalDate from = today.minus(window);
        history.removeIf(bar -> !bar.getDate().isAfter(from));
        return history;
    }

    void advanceTo(LocalDate date) {
        this.today = date;
    }

    /**
     * Execute queued intents at today's open. Intents whose asset has no opening price today
     * wait for the next bar; every other intent is executed or dropped, and leaves the queue.
     */
    List<TradeRecord> drainOpenQueue(LocalDate today) {
        if (openQueue.isEmpty()) {
            return Collections.emptyList();
        }
        List<OrderIntent> due = new ArrayList<>();
        List<OrderIntent> waiting = new ArrayList<>();
        while (!openQueue.isEmpty()) {
            OrderIntent intent = openQueue.pollFirst();
            if (hasOpen(intent.getAsset(), today)) {
                due.add(intent);
            } else {
                waiting.add(intent);
            }
        }
        openQueue.addAll(waiting);
        return engine.submitAtOpen(due, today);
    }

    void enqueueForNextOpen(List<OrderIntent> intents) {
        openQueue.addAll(intents);
    }

    Map<String, List<PriceBar>> visibleHistory(LocalDate today) {
        Map<String, List<PriceBar>> history = new LinkedHashMap<>();
        for (String asset : strategy.getAssets()) {
            history.put(asset, priceStores.get(asset).historyUpTo(today));
        }
        return history;
    }

    /**
     * Record today's mark-to-market equity. Skipped when no asset of the strategy traded
     * today or when a held asset has no valid close.
     *
     * @return whether a snapshot was recorded
     */
    boolean recordEquity(LocalDate today) {
        boolean tradingDay = strategy.getAssets().stream().anyMatch(asset -> hasBar(asset, today));
        if (!tradingDay) {
            return false;
        }

        Map<String, BigDecimal> closes = new HashMap<>();
        for (String asset : engine.getAccount().getHoldings().keySet()) {
            Optional<PriceBar> bar = closeOn(asset, today);
            bar.ifPresent(b -> closes.put(asset, b.getClose()));
        }
        BigDecimal equity = engine.getAccount().markToMarket(closes);
        if (equity == null) {
            return false;
        }
        equityCurve.add(new EquitySnapshot(today, equity));
        return true;
    }

    private boolean hasBar(String asset, LocalDate day) {
        return closeOn(asset, day).isPresent();
    }

    private boolean hasOpen(String asset, LocalDate day) {
        PriceHistoryStore store = priceStores.get(asset);
        return store != null && store.priceOn(day).filter(PriceBar::hasValidOpen).isPresent();
    }

    private Optional<PriceBar> closeOn(String asset, LocalDate day) {
        PriceHistoryStore store = priceStores.get(asset);
        if (store == null) {
            return Optional.empty();
        }
        return store.priceOn(day).filter(PriceBar::hasValidClose);
    }
}
