package com.quantsim.simulator.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Entity representing one ingested daily bar stored in the database.
 * Served to simulations through the {@code database} price source.
 */
@Entity
@Table(name = "historical_market_data", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbol_date", columnNames = { "symbol", "date" })
}, indexes = {
        @Index(name = "idx_symbol_date", columnList = "symbol, date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalMarketData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "open", precision = 12, scale = 4)
    private BigDecimal open;

    @Column(name = "high", precision = 12, scale = 4)
    private BigDecimal high;

    @Column(name = "low", precision = 12, scale = 4)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 12, scale = 4)
    private BigDecimal close;

    // null when the source file had no volume column
    @Column(name = "volume")
    private Long volume;

    @Column(name = "dividend", precision = 12, scale = 4)
    private BigDecimal dividend;

    public PriceBar toPriceBar() {
        return PriceBar.builder()
                .date(this.date)
                .open(this.open)
                .high(this.high)
                .low(this.low)
                .close(this.close)
                .volume(this.volume)
                .dividend(this.dividend)
                .build();
    }

    public static HistoricalMarketData fromPriceBar(String symbol, PriceBar bar) {
        return HistoricalMarketData.builder()
                .symbol(symbol)
                .date(bar.getDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .dividend(bar.getDividend())
                .build();
    }
}
