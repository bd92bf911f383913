package com.quantsim.simulator.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Mark-to-market account value at the close of one tick.
 */
@Value
@AllArgsConstructor
@Builder
@Jacksonized
public class EquitySnapshot {

    LocalDate date;
    BigDecimal totalEquity;
}
