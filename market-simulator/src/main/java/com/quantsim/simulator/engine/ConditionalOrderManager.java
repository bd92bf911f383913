package com.quantsim.simulator.engine;

import com.quantsim.simulator.domain.ConditionalOrder;
import com.quantsim.simulator.domain.OrderIntent;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.marketdata.PriceHistoryStore;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pending conditional orders of one strategy, evaluated once per tick.
 * <p>
 * An order fires when the day's close crosses its trigger, or is forced once the day is
 * past its expiry. Orders on an asset without a valid close that day stay pending, even
 * when expired; they are forced on the next day that has a price.
 */
@Slf4j
public class ConditionalOrderManager {

    private final Map<String, PriceHistoryStore> priceStores;
    private final List<ConditionalOrder> pending = new ArrayList<>();

    public ConditionalOrderManager(Map<String, PriceHistoryStore> priceStores) {
        this.priceStores = priceStores;
    }

    public void add(ConditionalOrder order) {
        if (order.getQuantity() <= 0) {
            throw new IllegalArgumentException("Conditional order quantity must be positive");
        }
        if (order.getTriggerPrice() == null || order.getExpiryDate() == null) {
            throw new IllegalArgumentException("Conditional order needs a trigger price and an expiry date");
        }
        pending.add(order);
    }

    /**
     * Fire every order whose condition holds on {@code asOf}, in registration order.
     * Each fired order is removed and yields exactly one intent.
     */
    public List<OrderIntent> evaluate(LocalDate asOf) {
        List<OrderIntent> fired = new ArrayList<>();
        Iterator<ConditionalOrder> it = pending.iterator();
        while (it.hasNext()) {
            ConditionalOrder order = it.next();
            Optional<PriceBar> bar = Optional.ofNullable(priceStores.get(order.getAsset()))
                    .flatMap(store -> store.priceOn(asOf))
                    .filter(PriceBar::hasValidClose);
            if (bar.isEmpty()) {
                continue;
            }

            if (order.isTriggeredBy(bar.get().getClose())) {
                log.info("Conditional {} on {} triggered at {} (trigger {})",
                        order.getAction(), order.getAsset(), bar.get().getClose(), order.getTriggerPrice());
            } else if (order.isExpiredOn(asOf)) {
                log.info("Conditional {} on {} expired on {}; forcing execution",
                        order.getAction(), order.getAsset(), order.getExpiryDate());
            } else {
                continue;
            }
            it.remove();
            fired.add(order.toOrderIntent());
        }
        return fired;
    }

    public List<ConditionalOrder> getPending() {
        return Collections.unmodifiableList(new ArrayList<>(pending));
    }
}
