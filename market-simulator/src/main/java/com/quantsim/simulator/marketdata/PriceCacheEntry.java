package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.domain.PriceBar;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of one cache unit: the provider's raw payload next to the normalized bars,
 * so normalization can be replayed without fetching again.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PriceCacheEntry {

    private String asset;
    private String source;
    private String interval;
    private String rawPayload;

    @Builder.Default
    private List<PriceBar> bars = new ArrayList<>();

    private LocalDate minDate;
    private LocalDate maxDate;
    private LocalDate coveredFrom;
    private LocalDate coveredTo;
    private Instant fetchedAt;

    public CacheKey key() {
        return new CacheKey(asset, source, interval);
    }
}
