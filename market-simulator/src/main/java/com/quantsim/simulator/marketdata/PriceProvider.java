package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.SourceFetchException;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;

/**
 * Adapter to one external source of daily bars.
 */
public interface PriceProvider {

    /**
     * Name used in cache keys and by {@code Strategy#getDataSource}.
     */
    String sourceName();

    /**
     * Fetch the provider's payload for an asset. Providers may return more than the
     * requested range.
     *
     * @throws SourceFetchException when the source cannot deliver
     */
    String fetchRaw(String asset, LocalDate start, LocalDate end, Period interval);

    /**
     * Turn a payload returned by {@link #fetchRaw} into bars ordered by date, one per date.
     * Rows without a usable date or close are dropped; missing volume or dividend stays null.
     *
     * @throws SourceFetchException when the payload as a whole cannot be understood
     */
    List<PriceBar> normalize(String rawPayload);
}
