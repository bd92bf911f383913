package com.quantsim.simulator.engine;

import com.quantsim.simulator.domain.AccountState;
import com.quantsim.simulator.domain.MarketConfig;
import com.quantsim.simulator.domain.OrderIntent;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.domain.TradeAction;
import com.quantsim.simulator.domain.TradeRecord;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns order intents into fills against one account.
 * <p>
 * Per intent the rules apply in this order: settlement check (sells), liquidity cap,
 * price resolution with slippage, cash cap (buys), cost model, ledger mutation.
 * An intent that clips to zero units, or has no price, leaves the account untouched
 * and produces no trade.
 */
@Slf4j
public class ExecutionEngine {

    private static final int MONEY_SCALE = 2;

    @Getter
    private final MarketConfig marketConfig;
    private final Map<String, PriceHistoryStore> priceStores;
    private final AccountState account;
    private final List<TradeRecord> tradeLog = new ArrayList<>();

    @Getter
    private final ExecutionStats stats = new ExecutionStats();

    public ExecutionEngine(MarketConfig marketConfig, BigDecimal initialCash, Map<String, PriceHistoryStore> priceStores) {
        this.marketConfig = marketConfig;
        this.account = new AccountState(initialCash);
        this.priceStores = priceStores;
    }

    /**
     * Fill intents at the close of {@code asOf}, in the given order.
     *
     * @return the trades executed, one per non-zero fill
     */
    public List<TradeRecord> submit(List<OrderIntent> intents, LocalDate asOf) {
        return execute(intents, asOf, PriceReference.CLOSE);
    }

    /**
     * Fill intents queued on an earlier tick at the open of {@code asOf}.
     */
    public List<TradeRecord> submitAtOpen(List<OrderIntent> intents, LocalDate asOf) {
        return execute(intents, asOf, PriceReference.OPEN);
    }

    /**
     * Release settlement holds. Called at the start of every tick, before any order.
     */
    public void clearSettlement() {
        if (marketConfig.isNextDaySettle()) {
            account.clearFrozen();
        }
    }

    public AccountState getAccount() {
        return account.copy();
    }

    public BigDecimal getCash() {
        return account.getCash();
    }

    public List<TradeRecord> getTradeLog() {
        return Collections.unmodifiableList(tradeLog);
    }

    private List<TradeRecord> execute(List<OrderIntent> intents, LocalDate asOf, PriceReference reference) {
        List<TradeRecord> executed = new ArrayList<>();
        for (OrderIntent intent : intents) {
            executeOne(intent, asOf, reference).ifPresent(trade -> {
                tradeLog.add(trade);
                executed.add(trade);
            });
        }
        return executed;
    }

    private Optional<TradeRecord> executeOne(OrderIntent intent, LocalDate asOf, PriceReference reference) {
        String asset = intent.getAsset();
        TradeAction action = intent.getAction();
        long quantity = intent.getQuantity();
        if (quantity <= 0) {
            return Optional.empty();
        }

        if (action == TradeAction.SELL) {
            quantity = clipToSellable(asset, quantity, asOf);
            if (quantity <= 0) {
                return Optional.empty();
            }
        }

        PriceHistoryStore store = priceStores.get(asset);
        Optional<PriceBar> bar = store == null ? Optional.empty() : store.priceOn(asOf);

        if (marketConfig.isLiquidityCapped() && bar.isPresent() && bar.get().getVolume() != null) {
            long cap = BigDecimal.valueOf(bar.get().getVolume())
                    .multiply(marketConfig.getVolumeLimitFraction())
                    .setScale(0, RoundingMode.DOWN)
                    .longValueExact();
            if (quantity > cap) {
                log.warn("Liquidity limit exceeded on {} for {} {}: requested {}, volume cap {}",
                        asOf, action, asset, quantity, cap);
                stats.liquidityClipped++;
                quantity = cap;
            }
            if (quantity <= 0) {
                return Optional.empty();
            }
        }

        BigDecimal rawPrice = bar.map(reference::priceOf).orElse(null);
        if (rawPrice == null) {
            log.debug("No {} price for {} on {}; skipping {} order", reference, asset, asOf, action);
            stats.skippedNoPrice++;
            return Optional.empty();
        }
        BigDecimal executedPrice = applySlippage(rawPrice, action);

        if (action == TradeAction.BUY) {
            long affordable = affordableQuantity(executedPrice);
            if (quantity > affordable) {
                log.debug("Insufficient cash for {} {} on {}: requested {}, affordable {}",
                        asset, action, asOf, quantity, affordable);
                stats.cashClipped++;
                quantity = affordable;
            }
            if (quantity <= 0) {
                return Optional.empty();
            }
        }

        TradeRecord trade = price(asOf, asset, action, quantity, rawPrice, executedPrice);
        boolean freeze = action == TradeAction.BUY && marketConfig.isNextDaySettle();
        account.applyFill(asset, trade.getSignedQuantity(), trade.getNetCashDelta(), freeze);
        stats.fills++;

        log.debug("{} {} {} @ {} (raw {}) on {}, cash now {}",
                action, quantity, asset, executedPrice, rawPrice, asOf, account.getCash());
        return Optional.of(trade);
    }

    private long clipToSellable(String asset, long requested, LocalDate asOf) {
        long held = account.getHolding(asset);
        long sellable = account.getSellable(asset);
        if (requested > sellable && sellable < held) {
            log.warn("Settlement violation on {}: tried to sell {} {}, only {} settled ({} frozen)",
                    asOf, requested, asset, sellable, account.getFrozen(asset));
            stats.settlementClipped++;
        } else if (requested > held) {
            log.debug("Insufficient units of {} on {}: requested {}, held {}", asset, asOf, requested, held);
        }
        return Math.min(requested, sellable);
    }

    private BigDecimal applySlippage(BigDecimal rawPrice, TradeAction action) {
        BigDecimal factor = action == TradeAction.BUY
                ? BigDecimal.ONE.add(marketConfig.getSlippageRate())
                : BigDecimal.ONE.subtract(marketConfig.getSlippageRate());
        return rawPrice.multiply(factor);
    }

    /**
     * Largest whole quantity whose gross value plus commission fits in the cash balance.
     */
    private long affordableQuantity(BigDecimal executedPrice) {
        BigDecimal cash = account.getCash();
        BigDecimal perUnit = executedPrice.multiply(BigDecimal.ONE.add(marketConfig.getCommissionRate()));
        long quantity = cash.divide(perUnit, 0, RoundingMode.DOWN).longValue();
        while (quantity > 0) {
            BigDecimal gross = executedPrice.multiply(BigDecimal.valueOf(quantity));
            if (gross.add(commission(gross)).compareTo(cash) <= 0) {
                break;
            }
            quantity--;
        }
        return quantity;
    }

    private TradeRecord price(LocalDate asOf, String asset, TradeAction action, long quantity,
                              BigDecimal rawPrice, BigDecimal executedPrice) {
        BigDecimal units = BigDecimal.valueOf(quantity);
        BigDecimal gross = executedPrice.multiply(units);
        BigDecimal commission = commission(gross);
        BigDecimal tax = action == TradeAction.SELL
                ? gross.multiply(marketConfig.getTaxRate()).setScale(MONEY_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(MONEY_SCALE);
        BigDecimal cost = commission.add(tax);
        BigDecimal netCashDelta = action == TradeAction.BUY
                ? gross.negate().subtract(cost)
                : gross.subtract(cost);
        BigDecimal slippageCost = executedPrice.subtract(rawPrice).abs().multiply(units);

        return TradeRecord.builder()
                .date(asOf)
                .asset(asset)
                .action(action)
                .rawPrice(rawPrice)
                .executedPrice(executedPrice)
                .quantity(quantity)
                .grossValue(gross)
                .netCashDelta(netCashDelta)
                .commission(commission)
                .tax(tax)
                .slippageCost(slippageCost)
                .build();
    }

    private BigDecimal commission(BigDecimal gross) {
        BigDecimal proportional = gross.multiply(marketConfig.getCommissionRate())
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        return proportional.max(marketConfig.getMinCommission().setScale(MONEY_SCALE, RoundingMode.HALF_UP));
    }

    private enum PriceReference {
        CLOSE,
        OPEN;

        BigDecimal priceOf(PriceBar bar) {
            if (this == OPEN) {
                return bar.hasValidOpen() ? bar.getOpen() : null;
            }
            return bar.hasValidClose() ? bar.getClose() : null;
        }
    }

    /**
     * Counters of how intents were clipped or dropped.
     */
    @Getter
    public static class ExecutionStats {
        private long fills;
        private long settlementClipped;
        private long liquidityClipped;
        private long cashClipped;
        private long skippedNoPrice;
    }
}
