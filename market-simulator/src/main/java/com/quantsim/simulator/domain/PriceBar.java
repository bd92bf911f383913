package com.quantsim.simulator.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily bar of an asset (OHLCV plus optional dividend and valuation data).
 * Only {@code date} and {@code close} are guaranteed; the other fields may be null
 * when the provider does not supply them.
 */
@Value
@Builder
@Jacksonized
public class PriceBar {

    LocalDate date;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    Long volume;
    BigDecimal dividend;
    BigDecimal peTtm;

    /**
     * A bar is usable for pricing only when it carries a positive close.
     */
    public boolean hasValidClose() {
        return close != null && close.signum() > 0;
    }

    public boolean hasValidOpen() {
        return open != null && open.signum() > 0;
    }
}
