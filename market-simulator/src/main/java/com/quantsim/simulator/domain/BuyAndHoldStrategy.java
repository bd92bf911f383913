package com.quantsim.simulator.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simple buy-and-hold strategy.
 * Splits the initial capital equally across its assets and buys each one on the first day
 * it has a price, then holds until the end. With a positive entry discount it instead places
 * a buy promise below that day's close, which is forced after {@code promiseDays} if the
 * price never comes down.
 */
@Slf4j
public class BuyAndHoldStrategy implements Strategy {

    private final Set<String> assets;
    private final BigDecimal initialCapital;
    private final MarketConfig marketConfig;
    private final BigDecimal entryDiscount;
    private final int promiseDays;
    private final String dataSource;

    private final Set<String> entered = new HashSet<>();
    private StrategyContext context;

    public BuyAndHoldStrategy(List<String> assets, BigDecimal initialCapital, MarketConfig marketConfig) {
        this(assets, initialCapital, marketConfig, BigDecimal.ZERO, 0, "synthetic");
    }

    public BuyAndHoldStrategy(List<String> assets, BigDecimal initialCapital, MarketConfig marketConfig,
                              BigDecimal entryDiscount, int promiseDays, String dataSource) {
        if (assets == null || assets.isEmpty()) {
            throw new IllegalArgumentException("At least one asset is required");
        }
        if (entryDiscount.signum() < 0 || entryDiscount.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("Entry discount must be in [0, 1)");
        }
        if (promiseDays < 0) {
            throw new IllegalArgumentException("Promise days must not be negative");
        }
        this.assets = Collections.unmodifiableSet(new LinkedHashSet<>(assets));
        this.initialCapital = initialCapital;
        this.marketConfig = marketConfig;
        this.entryDiscount = entryDiscount;
        this.promiseDays = promiseDays;
        this.dataSource = dataSource;
    }

    @Override
    public void onInit(StrategyContext context) {
        this.context = context;
    }

    @Override
    public List<OrderIntent> decide(LocalDate today, Map<String, List<PriceBar>> visibleHistory, AccountState account) {
        if (entered.size() == assets.size()) {
            return Collections.emptyList();
        }

        BigDecimal budgetPerAsset = initialCapital.divide(BigDecimal.valueOf(assets.size()), 2, RoundingMode.DOWN);
        BigDecimal remainingCash = account.getCash();
        List<OrderIntent> orders = new ArrayList<>();

        for (String asset : assets) {
            if (entered.contains(asset)) {
                continue;
            }
            PriceBar latest = barOn(today, visibleHistory.get(asset));
            if (latest == null) {
                continue;
            }

            BigDecimal budget = budgetPerAsset.min(remainingCash);
            BigDecimal price = entryDiscount.signum() > 0
                    ? latest.getClose().multiply(BigDecimal.ONE.subtract(entryDiscount))
                    : latest.getClose();
            long quantity = budget.divide(price, 0, RoundingMode.DOWN).longValue();
            if (quantity <= 0) {
                continue;
            }
            entered.add(asset);
            remainingCash = remainingCash.subtract(price.multiply(BigDecimal.valueOf(quantity)));

            if (entryDiscount.signum() > 0) {
                LocalDate expiry = today.plusDays(promiseDays);
                context.promise(ConditionalOrder.buyBelow(asset, price, expiry, quantity));
                log.debug("Buy and Hold: promised {} units of {} at or below {} until {}", quantity, asset, price, expiry);
            } else {
                log.debug("Buy and Hold: buying {} units of {} at {} on {}", quantity, asset, price, today);
                orders.add(OrderIntent.buy(asset, quantity));
            }
        }
        return orders;
    }

    @Override
    public void onFinalize(StrategyContext context) {
        log.debug("Buy and Hold strategy completed. Trades: {}, pending promises: {}",
                context.getTradeLog().size(), context.getPendingPromises().size());
    }

    @Override
    public String getName() {
        return entryDiscount.signum() > 0
                ? "BuyAndHold(discount=" + entryDiscount.stripTrailingZeros().toPlainString() + ")"
                : "BuyAndHold";
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

    // today's bar if the history ends today with a usable close
    private static PriceBar barOn(LocalDate today, List<PriceBar> history) {
        if (history == null || history.isEmpty()) {
            return null;
        }
        PriceBar latest = history.get(history.size() - 1);
        return today.equals(latest.getDate()) && latest.hasValidClose() ? latest : null;
    }
}
