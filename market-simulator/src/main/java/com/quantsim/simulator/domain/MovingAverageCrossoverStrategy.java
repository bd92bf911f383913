package com.quantsim.simulator.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moving Average Crossover Strategy.
 * Per asset, buys when the short MA crosses above the long MA and sells the settled units
 * when it crosses back below. Cash is shared equally among assets not currently held.
 * Both averages are recomputed from the visible history, so the strategy keeps no price
 * state between ticks.
 * <p>
 * With a risk indicator set, buys are skipped while that indicator trades more than
 * {@code riskThreshold} times its own long moving average. Sells are never blocked.
 */
@Slf4j
public class MovingAverageCrossoverStrategy implements Strategy {

    private final Set<String> assets;
    private final int shortPeriod;
    private final int longPeriod;
    private final BigDecimal initialCapital;
    private final MarketConfig marketConfig;
    private final String dataSource;
    private final String riskIndicator;
    private final BigDecimal riskThreshold;

    private StrategyContext context;

    public MovingAverageCrossoverStrategy(List<String> assets, int shortPeriod, int longPeriod,
                                          BigDecimal initialCapital, MarketConfig marketConfig) {
        this(assets, shortPeriod, longPeriod, initialCapital, marketConfig, "synthetic");
    }

    public MovingAverageCrossoverStrategy(List<String> assets, int shortPeriod, int longPeriod,
                                          BigDecimal initialCapital, MarketConfig marketConfig, String dataSource) {
        this(assets, shortPeriod, longPeriod, initialCapital, marketConfig, dataSource, null, null);
    }

    public MovingAverageCrossoverStrategy(List<String> assets, int shortPeriod, int longPeriod,
                                          BigDecimal initialCapital, MarketConfig marketConfig, String dataSource,
                                          String riskIndicator, BigDecimal riskThreshold) {
        if (assets == null || assets.isEmpty()) {
            throw new IllegalArgumentException("At least one asset is required");
        }
        if (shortPeriod <= 0) {
            throw new IllegalArgumentException("Short period must be positive");
        }
        if (shortPeriod >= longPeriod) {
            throw new IllegalArgumentException("Short period must be less than long period");
        }
        this.assets = Collections.unmodifiableSet(new LinkedHashSet<>(assets));
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.initialCapital = initialCapital;
        this.marketConfig = marketConfig;
        this.dataSource = dataSource;
        this.riskIndicator = riskIndicator;
        this.riskThreshold = riskThreshold != null ? riskThreshold : new BigDecimal("1.05");
        if (this.riskThreshold.signum() <= 0) {
            throw new IllegalArgumentException("Risk threshold must be positive");
        }
    }

    @Override
    public void onInit(StrategyContext context) {
        this.context = context;
    }

    @Override
    public List<OrderIntent> decide(LocalDate today, Map<String, List<PriceBar>> visibleHistory, AccountState account) {
        List<OrderIntent> orders = new ArrayList<>();
        BigDecimal remainingCash = account.getCash();
        long unheld = assets.stream().filter(asset -> account.getHolding(asset) == 0).count();
        boolean riskElevated = isRiskElevated();

        for (String asset : assets) {
            List<PriceBar> history = visibleHistory.getOrDefault(asset, Collections.emptyList());
            // Wait until we have enough data, and only act on days with a bar
            if (history.size() < longPeriod + 1 || !today.equals(history.get(history.size() - 1).getDate())) {
                continue;
            }

            int last = history.size() - 1;
            BigDecimal shortMA = calculateMA(history, last, shortPeriod);
            BigDecimal longMA = calculateMA(history, last, longPeriod);
            BigDecimal previousShortMA = calculateMA(history, last - 1, shortPeriod);
            BigDecimal previousLongMA = calculateMA(history, last - 1, longPeriod);
            BigDecimal closePrice = history.get(last).getClose();

            boolean wasBelowLong = previousShortMA.compareTo(previousLongMA) < 0;
            boolean isAboveLong = shortMA.compareTo(longMA) > 0;
            boolean wasAboveLong = previousShortMA.compareTo(previousLongMA) > 0;
            boolean isBelowLong = shortMA.compareTo(longMA) < 0;

            // Golden cross - buy signal
            if (wasBelowLong && isAboveLong && riskElevated) {
                log.debug("MA Crossover: BUY signal for {} on {} skipped, {} above its average",
                        asset, today, riskIndicator);
            } else if (wasBelowLong && isAboveLong && account.getHolding(asset) == 0 && unheld > 0) {
                BigDecimal budget = remainingCash.divide(BigDecimal.valueOf(unheld), 2, RoundingMode.DOWN);
                long unitsToBuy = budget.divide(closePrice, 0, RoundingMode.DOWN).longValue();
                if (unitsToBuy > 0) {
                    log.debug("MA Crossover: BUY {} {} at {} on {} (Short MA: {}, Long MA: {})",
                            unitsToBuy, asset, closePrice, today, shortMA, longMA);
                    orders.add(OrderIntent.buy(asset, unitsToBuy));
                    remainingCash = remainingCash.subtract(closePrice.multiply(BigDecimal.valueOf(unitsToBuy)));
                    unheld--;
                }
            }
            // Death cross - sell signal
            else if (wasAboveLong && isBelowLong) {
                long unitsToSell = account.getSellable(asset);
                if (unitsToSell > 0) {
                    log.debug("MA Crossover: SELL {} {} at {} on {} (Short MA: {}, Long MA: {})",
                            unitsToSell, asset, closePrice, today, shortMA, longMA);
                    orders.add(OrderIntent.sell(asset, unitsToSell));
                }
            }
        }
        return orders;
    }

    @Override
    public void onFinalize(StrategyContext context) {
        log.debug("MA Crossover strategy completed. Trades: {}", context.getTradeLog().size());
    }

    @Override
    public String getName() {
        String name = "MovingAverageCrossover(" + shortPeriod + "," + longPeriod + ")";
        return riskIndicator != null ? name + "[risk=" + riskIndicator + "]" : name;
    }

    @Override
    public Set<String> getAssets() {
        return assets;
    }

    @Override
    public MarketConfig getMarketConfig() {
        return marketConfig;
    }

    @Override
    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    @Override
    public String getDataSource(String asset) {
        return dataSource;
    }

    private boolean isRiskElevated() {
        if (riskIndicator == null || context == null) {
            return false;
        }
        List<PriceBar> history = new ArrayList<>(
                context.indicatorHistory(riskIndicator, Period.ofDays(longPeriod * 2 + 30)));
        history.removeIf(bar -> !bar.hasValidClose());
        if (history.size() <= longPeriod) {
            return false;
        }
        int last = history.size() - 1;
        BigDecimal average = calculateMA(history, last, longPeriod);
        return history.get(last).getClose().compareTo(average.multiply(riskThreshold)) > 0;
    }

    // average of the `period` closes ending at index `end`, inclusive
    private BigDecimal calculateMA(List<PriceBar> history, int end, int period) {
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = end - period + 1; i <= end; i++) {
            sum = sum.add(history.get(i).getClose());
        }
        return sum.divide(BigDecimal.valueOf(period), 4, RoundingMode.HALF_UP);
    }
}
