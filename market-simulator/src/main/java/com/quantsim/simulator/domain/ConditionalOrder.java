package com.quantsim.simulator.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A deferred order ("promise"). A buy fires once the close falls to or below the
 * trigger price, a sell once it rises to or above it. Either is forced once the
 * evaluation date is past {@code expiryDate}.
 */
@Value
@Builder
public class ConditionalOrder {

    String asset;
    TradeAction action;
    BigDecimal triggerPrice;
    LocalDate expiryDate;
    long quantity;

    public static ConditionalOrder buyBelow(String asset, BigDecimal triggerPrice, LocalDate expiryDate, long quantity) {
        return new ConditionalOrder(asset, TradeAction.BUY, triggerPrice, expiryDate, quantity);
    }

    public static ConditionalOrder sellAbove(String asset, BigDecimal triggerPrice, LocalDate expiryDate, long quantity) {
        return new ConditionalOrder(asset, TradeAction.SELL, triggerPrice, expiryDate, quantity);
    }

    public boolean isTriggeredBy(BigDecimal close) {
        int cmp = close.compareTo(triggerPrice);
        return action == TradeAction.BUY ? cmp <= 0 : cmp >= 0;
    }

    public boolean isExpiredOn(LocalDate asOf) {
        return asOf.isAfter(expiryDate);
    }

    public OrderIntent toOrderIntent() {
        return new OrderIntent(asset, action, quantity);
    }
}
