package com.quantsim.simulator.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.domain.PriceCacheRecord;
import com.quantsim.simulator.exception.CacheCorruptedException;
import com.quantsim.simulator.marketdata.CacheKey;
import com.quantsim.simulator.marketdata.PriceCacheEntry;
import com.quantsim.simulator.marketdata.PriceCacheStore;
import com.quantsim.simulator.repository.PriceCacheRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Cache store backed by the {@code price_cache} table. Normalized bars are kept as JSON
 * next to the raw payload.
 */
@RequiredArgsConstructor
@Slf4j
public class JpaPriceCacheStore implements PriceCacheStore {

    private static final TypeReference<List<PriceBar>> BAR_LIST = new TypeReference<>() {
    };

    private final PriceCacheRepository priceCacheRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<PriceCacheEntry> load(CacheKey key) {
        Optional<PriceCacheRecord> record = priceCacheRepository
                .findByAssetAndSourceAndSamplingInterval(key.getAsset(), key.getSource(), key.getInterval());
        if (record.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toEntry(record.get()));
    }

    @Override
    @Transactional
    public void save(PriceCacheEntry entry) {
        PriceCacheRecord record = priceCacheRepository
                .findByAssetAndSourceAndSamplingInterval(entry.getAsset(), entry.getSource(), entry.getInterval())
                .orElseGet(() -> PriceCacheRecord.builder()
                        .asset(entry.getAsset())
                        .source(entry.getSource())
                        .samplingInterval(entry.getInterval())
                        .build());

        try {
            record.setBarsJson(objectMapper.writeValueAsString(entry.getBars()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bars for " + entry.key().asString(), e);
        }
        record.setRawPayload(entry.getRawPayload());
        record.setMinDate(entry.getMinDate());
        record.setMaxDate(entry.getMaxDate());
        record.setCoveredFrom(entry.getCoveredFrom());
        record.setCoveredTo(entry.getCoveredTo());
        record.setFetchedAt(entry.getFetchedAt());

        priceCacheRepository.save(record);
        log.debug("Saved cache unit {} ({} bars)", entry.key().asString(), entry.getBars().size());
    }

    private PriceCacheEntry toEntry(PriceCacheRecord record) {
        List<PriceBar> bars;
        try {
            bars = objectMapper.readValue(record.getBarsJson(), BAR_LIST);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CacheCorruptedException("Unreadable bars in cache unit "
                    + record.getSource() + ":" + record.getAsset() + ":" + record.getSamplingInterval(), e);
        }
        return PriceCacheEntry.builder()
                .asset(record.getAsset())
                .source(record.getSource())
                .interval(record.getSamplingInterval())
                .rawPayload(record.getRawPayload())
                .bars(bars)
                .minDate(record.getMinDate())
                .maxDate(record.getMaxDate())
                .coveredFrom(record.getCoveredFrom())
                .coveredTo(record.getCoveredTo())
                .fetchedAt(record.getFetchedAt())
                .build();
    }
}
