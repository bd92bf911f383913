package com.quantsim.simulator.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One executed fill. Appended to the trade log and never modified afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TradeRecord {

    LocalDate date;
    String asset;
    TradeAction action;
    BigDecimal rawPrice;
    BigDecimal executedPrice;
    long quantity;
    BigDecimal grossValue;
    BigDecimal netCashDelta;
    BigDecimal commission;
    BigDecimal tax;
    BigDecimal slippageCost;

    /**
     * Commission plus tax.
     */
    public BigDecimal getCost() {
        return commission.add(tax);
    }

    public long getSignedQuantity() {
        return action.sign() * quantity;
    }
}
