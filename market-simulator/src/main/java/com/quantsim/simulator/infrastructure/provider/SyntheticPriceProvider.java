package com.quantsim.simulator.infrastructure.provider;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.marketdata.CsvBarParser;
import com.quantsim.simulator.marketdata.PriceProvider;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Random;

/**
 * Deterministic random-walk prices for demos and tests.
 * The walk is seeded by the asset name and starts at a fixed anchor date (or at the requested
 * start when that is earlier), so fetches of overlapping ranges agree on every shared day.
 * Weekends have no bars.
 */
@Component
public class SyntheticPriceProvider implements PriceProvider {

    public static final String SOURCE_NAME = "synthetic";

    static final LocalDate ANCHOR = LocalDate.of(2000, 1, 3);

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public String fetchRaw(String asset, LocalDate start, LocalDate end, Period interval) {
        Random random = new Random(asset.hashCode());
        StringBuilder csv = new StringBuilder("date,open,high,low,close,volume\n");

        BigDecimal basePrice = new BigDecimal("100.00");
        LocalDate from = start.isBefore(ANCHOR) ? start : ANCHOR;
        LocalDate currentDate = from;

        while (!currentDate.isAfter(end)) {
            if (currentDate.getDayOfWeek() != DayOfWeek.SATURDAY && currentDate.getDayOfWeek() != DayOfWeek.SUNDAY) {
                // 2% volatility, 0.03% daily drift
                double changePercent = (random.nextGaussian() * 0.02) + 0.0003;
                basePrice = basePrice.add(basePrice.multiply(BigDecimal.valueOf(changePercent)))
                        .setScale(6, RoundingMode.HALF_UP);
                if (basePrice.compareTo(BigDecimal.ONE) < 0) {
                    basePrice = BigDecimal.ONE;
                }

                BigDecimal open = basePrice;
                BigDecimal high = basePrice.multiply(BigDecimal.valueOf(1 + Math.abs(random.nextGaussian()) * 0.01));
                BigDecimal low = basePrice.multiply(BigDecimal.valueOf(1 - Math.abs(random.nextGaussian()) * 0.01));
                BigDecimal close = basePrice.multiply(BigDecimal.valueOf(1 + (random.nextGaussian() * 0.005)));
                long volume = 1_000_000 + random.nextInt(500_000);

                if (!currentDate.isBefore(start)) {
                    csv.append(currentDate).append(',')
                            .append(open.setScale(2, RoundingMode.HALF_UP)).append(',')
                            .append(high.setScale(2, RoundingMode.HALF_UP)).append(',')
                            .append(low.setScale(2, RoundingMode.HALF_UP)).append(',')
                            .append(close.setScale(2, RoundingMode.HALF_UP)).append(',')
                            .append(volume).append('\n');
                }
            }
            currentDate = currentDate.plusDays(1);
        }
        return csv.toString();
    }

    @Override
    public List<PriceBar> normalize(String rawPayload) {
        return CsvBarParser.parse(rawPayload);
    }
}
