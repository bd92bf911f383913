package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.exception.SourceFetchException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Looks up providers by their source name.
 */
public class PriceProviderRegistry {

    private final Map<String, PriceProvider> providers = new LinkedHashMap<>();

    public PriceProviderRegistry(Collection<? extends PriceProvider> providers) {
        for (PriceProvider provider : providers) {
            PriceProvider previous = this.providers.put(provider.sourceName(), provider);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate price source: " + provider.sourceName());
            }
        }
    }

    /**
     * @throws SourceFetchException when no provider has that name
     */
    public PriceProvider get(String sourceName) {
        PriceProvider provider = providers.get(sourceName);
        if (provider == null) {
            throw new SourceFetchException("Unknown data source '" + sourceName + "'; available: " + providers.keySet());
        }
        return provider;
    }

    public Set<String> sourceNames() {
        return providers.keySet();
    }
}
