package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.exception.CacheCorruptedException;

import java.util.Optional;

/**
 * Persistence for price cache units, one per {@link CacheKey}.
 */
public interface PriceCacheStore {

    /**
     * Load a cache unit.
     *
     * @return the unit, or empty when nothing is cached under the key
     * @throws CacheCorruptedException when a unit exists but cannot be decoded
     */
    Optional<PriceCacheEntry> load(CacheKey key);

    /**
     * Create or replace the unit under {@link PriceCacheEntry#key()}.
     */
    void save(PriceCacheEntry entry);
}
