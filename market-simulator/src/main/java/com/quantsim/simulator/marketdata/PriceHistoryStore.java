package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.CacheCorruptedException;
import com.quantsim.simulator.exception.SourceFetchException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Date-indexed daily bars of one asset, backed by a {@link PriceCacheStore}.
 * <p>
 * Lifecycle: {@link #initialize} either reuses a cache unit that covers the requested
 * range, or fetches from the provider and merges the result into whatever was cached.
 * After that the store is read-only and all lookups are in memory.
 */
@Slf4j
public class PriceHistoryStore {

    public static final int DEFAULT_END_SLACK_DAYS = 4;

    @Getter
    private final String asset;
    private final PriceProvider provider;
    private final PriceCacheStore cacheStore;
    private final Period interval;
    private final int endSlackDays;

    private final NavigableMap<LocalDate, PriceBar> bars = new TreeMap<>();
    private String rawPayload;
    private boolean initialized;

    // requested range the bars were fetched for; may extend past the first and last bar
    private LocalDate coveredFrom;
    private LocalDate coveredTo;

    @Getter
    private int fetchCount;

    public PriceHistoryStore(String asset, PriceProvider provider, PriceCacheStore cacheStore) {
        this(asset, provider, cacheStore, Period.ofDays(1), DEFAULT_END_SLACK_DAYS);
    }

    public PriceHistoryStore(String asset, PriceProvider provider, PriceCacheStore cacheStore,
                             Period interval, int endSlackDays) {
        if (endSlackDays < 0) {
            throw new IllegalArgumentException("endSlackDays must not be negative");
        }
        this.asset = asset;
        this.provider = provider;
        this.cacheStore = cacheStore;
        this.interval = interval;
        this.endSlackDays = endSlackDays;
    }

    /**
     * Make {@code [start, end]} available, fetching only when the cache does not cover it.
     *
     * @throws SourceFetchException when data has to be fetched and the provider fails
     */
    public void initialize(LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }

        CacheKey key = cacheKey();
        Optional<PriceCacheEntry> cached;
        try {
            cached = cacheStore.load(key);
        } catch (CacheCorruptedException e) {
            log.warn("Failed to load cache {}: {}. Re-fetching.", key.asString(), e.getMessage());
            bars.clear();
            coveredFrom = null;
            coveredTo = null;
            fetchAndMerge(start, end);
            initialized = true;
            return;
        }

        if (cached.isPresent()) {
            PriceCacheEntry entry = cached.get();
            rawPayload = entry.getRawPayload();
            coveredFrom = entry.getCoveredFrom() != null ? entry.getCoveredFrom() : entry.getMinDate();
            coveredTo = entry.getCoveredTo() != null ? entry.getCoveredTo() : entry.getMaxDate();
            merge(entry.getBars());
            if (!isComplete(start, end)) {
                log.info("Cache miss or partial for {} ({} to {}). Fetching...", asset, start, end);
                fetchAndMerge(start, end);
            } else {
                log.debug("Cache hit for {} covering {} to {}", key.asString(), start, end);
            }
        } else {
            log.info("No cache for {}. Fetching {} to {}", key.asString(), start, end);
            fetchAndMerge(start, end);
        }
        initialized = true;
    }

    /**
     * Whether the fetched range covers {@code [start, end - slack]}. The range is the one
     * requested from the provider, so a start on a non-trading day still counts as covered.
     */
    public boolean isComplete(LocalDate start, LocalDate end) {
        if (bars.isEmpty() || coveredFrom == null || coveredTo == null) {
            return false;
        }
        return !coveredFrom.isAfter(start) && !coveredTo.isBefore(end.minusDays(endSlackDays));
    }

    /**
     * Re-run normalization on the cached raw payload and merge the result.
     * No fetch is performed.
     */
    public void renormalize() {
        requireInitialized();
        if (rawPayload == null) {
            log.warn("No raw payload cached for {}; nothing to re-normalize", asset);
            return;
        }
        merge(provider.normalize(rawPayload));
        cacheStore.save(toEntry());
    }

    public Optional<PriceBar> priceOn(LocalDate date) {
        requireInitialized();
        return Optional.ofNullable(bars.get(date));
    }

    /**
     * Bars dated on or before {@code date}, ascending.
     */
    public List<PriceBar> historyUpTo(LocalDate date) {
        requireInitialized();
        return new ArrayList<>(bars.headMap(date, true).values());
    }

    /**
     * Traded volume on {@code date}, 0 when unknown.
     */
    public long volumeOn(LocalDate date) {
        return priceOn(date)
                .map(PriceBar::getVolume)
                .orElse(0L);
    }

    public int size() {
        return bars.size();
    }

    private void fetchAndMerge(LocalDate start, LocalDate end) {
        fetchCount++;
        String payload;
        List<PriceBar> fetched;
        try {
            payload = provider.fetchRaw(asset, start, end, interval);
            fetched = provider.normalize(payload);
        } catch (SourceFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceFetchException("Failed to fetch " + asset + " from " + provider.sourceName(), e);
        }

        if (fetched.isEmpty() && bars.isEmpty()) {
            throw new SourceFetchException("Source " + provider.sourceName() + " returned no data for " + asset);
        }

        rawPayload = payload;
        merge(fetched);
        extendCoverage(start, end);
        log.info("Fetched {} bars for {} from {}; {} bars cached", fetched.size(), asset, provider.sourceName(),
                bars.size());
        cacheStore.save(toEntry());
    }

    // disjoint ranges leave a gap, so only the latest fetch counts as covered
    private void extendCoverage(LocalDate start, LocalDate end) {
        boolean joined = coveredFrom != null && coveredTo != null
                && !start.isAfter(coveredTo.plusDays(1)) && !end.isBefore(coveredFrom.minusDays(1));
        if (joined) {
            coveredFrom = start.isBefore(coveredFrom) ? start : coveredFrom;
            coveredTo = end.isAfter(coveredTo) ? end : coveredTo;
        } else {
            coveredFrom = start;
            coveredTo = end;
        }
    }

    // new bars override old ones on the same date
    private void merge(Collection<PriceBar> incoming) {
        for (PriceBar bar : incoming) {
            if (bar != null && bar.getDate() != null) {
                bars.put(bar.getDate(), bar);
            }
        }
    }

    private PriceCacheEntry toEntry() {
        CacheKey key = cacheKey();
        return PriceCacheEntry.builder()
                .asset(key.getAsset())
                .source(key.getSource())
                .interval(key.getInterval())
                .rawPayload(rawPayload)
                .bars(new ArrayList<>(bars.values()))
                .minDate(bars.isEmpty() ? null : bars.firstKey())
                .maxDate(bars.isEmpty() ? null : bars.lastKey())
                .coveredFrom(coveredFrom)
                .coveredTo(coveredTo)
                .fetchedAt(Instant.now())
                .build();
    }

    private CacheKey cacheKey() {
        return new CacheKey(asset, provider.sourceName(), intervalLabel(interval));
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Price history for " + asset + " is not initialized");
        }
    }

    static String intervalLabel(Period interval) {
        if (interval.getYears() == 0 && interval.getMonths() == 0 && interval.getDays() % 7 == 0) {
            return (interval.getDays() / 7) + "w";
        }
        return interval.toTotalMonths() == 0 ? interval.getDays() + "d" : interval.toString();
    }
}
