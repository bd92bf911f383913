package com.quantsim.simulator.domain;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cash, holdings and settlement-frozen units of one simulated account.
 * <p>
 * Invariants kept by the execution engine: {@code frozen(asset) <= holding(asset)}
 * and {@code cash >= 0} after every fill.
 */
@Getter
public class AccountState {

    private BigDecimal cash;
    private final Map<String, Long> holdings;
    private final Map<String, Long> frozen;

    public AccountState(BigDecimal cash) {
        this(cash, new TreeMap<>(), new TreeMap<>());
    }

    private AccountState(BigDecimal cash, Map<String, Long> holdings, Map<String, Long> frozen) {
        if (cash == null || cash.signum() < 0) {
            throw new IllegalArgumentException("Cash must be non-negative");
        }
        this.cash = cash;
        this.holdings = holdings;
        this.frozen = frozen;
    }

    public long getHolding(String asset) {
        return holdings.getOrDefault(asset, 0L);
    }

    public long getFrozen(String asset) {
        return frozen.getOrDefault(asset, 0L);
    }

    /**
     * Units that may be sold right now: held minus not yet settled.
     */
    public long getSellable(String asset) {
        return Math.max(0L, getHolding(asset) - getFrozen(asset));
    }

    public Map<String, Long> getHoldings() {
        return Collections.unmodifiableMap(holdings);
    }

    public Map<String, Long> getFrozen() {
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Apply a fill to the ledger. Bought units are frozen as well when {@code freeze} is set.
     */
    public void applyFill(String asset, long signedQuantity, BigDecimal netCashDelta, boolean freeze) {
        BigDecimal newCash = cash.add(netCashDelta);
        long newHolding = getHolding(asset) + signedQuantity;
        if (newCash.signum() < 0) {
            throw new IllegalStateException("Fill would overdraw cash: " + newCash);
        }
        if (newHolding < getFrozen(asset) + (freeze && signedQuantity > 0 ? signedQuantity : 0L)) {
            throw new IllegalStateException("Fill would sell unsettled units of " + asset);
        }

        cash = newCash;
        if (newHolding == 0L) {
            holdings.remove(asset);
        } else {
            holdings.put(asset, newHolding);
        }
        if (freeze && signedQuantity > 0) {
            frozen.merge(asset, signedQuantity, Long::sum);
        }
    }

    /**
     * Release every settlement hold.
     */
    public void clearFrozen() {
        frozen.clear();
    }

    /**
     * Cash plus holdings valued at the given prices. Returns null when any held
     * asset has no price, so the caller can skip the day instead of under-valuing.
     */
    public BigDecimal markToMarket(Map<String, BigDecimal> prices) {
        BigDecimal total = cash;
        for (Map.Entry<String, Long> holding : holdings.entrySet()) {
            BigDecimal price = prices.get(holding.getKey());
            if (price == null) {
                return null;
            }
            total = total.add(price.multiply(BigDecimal.valueOf(holding.getValue())));
        }
        return total;
    }

    /**
     * Detached copy handed to strategies so they cannot mutate the ledger.
     */
    public AccountState copy() {
        return new AccountState(cash, new TreeMap<>(holdings), new TreeMap<>(frozen));
    }
}
