package com.quantsim.simulator.infrastructure.cache;

import com.quantsim.simulator.marketdata.CacheKey;
import com.quantsim.simulator.marketdata.PriceCacheEntry;
import com.quantsim.simulator.marketdata.PriceCacheStore;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache store. Entries are copied in and out so callers cannot
 * mutate what is stored.
 */
public class InMemoryPriceCacheStore implements PriceCacheStore {

    private final Map<CacheKey, PriceCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<PriceCacheEntry> load(CacheKey key) {
        return Optional.ofNullable(entries.get(key)).map(InMemoryPriceCacheStore::copyOf);
    }

    @Override
    public void save(PriceCacheEntry entry) {
        entries.put(entry.key(), copyOf(entry));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private static PriceCacheEntry copyOf(PriceCacheEntry entry) {
        return entry.toBuilder()
                .bars(new ArrayList<>(entry.getBars()))
                .build();
    }
}
