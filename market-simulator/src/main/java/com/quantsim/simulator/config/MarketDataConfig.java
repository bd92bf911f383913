package com.quantsim.simulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.infrastructure.cache.InMemoryPriceCacheStore;
import com.quantsim.simulator.infrastructure.cache.JpaPriceCacheStore;
import com.quantsim.simulator.infrastructure.provider.CsvPriceProvider;
import com.quantsim.simulator.marketdata.PriceCacheStore;
import com.quantsim.simulator.marketdata.PriceProvider;
import com.quantsim.simulator.marketdata.PriceProviderRegistry;
import com.quantsim.simulator.repository.PriceCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;

/**
 * Price providers and the database or in-memory price cache.
 * The Redis cache lives in {@link RedisConfig}.
 */
@Configuration
@Slf4j
public class MarketDataConfig {

    @Bean
    public CsvPriceProvider csvPriceProvider(@Value("${simulator.data.csv-directory:data}") String csvDirectory) {
        log.info("CSV price source reads from {}", Path.of(csvDirectory).toAbsolutePath());
        return new CsvPriceProvider(Path.of(csvDirectory));
    }

    @Bean
    public PriceProviderRegistry priceProviderRegistry(List<PriceProvider> providers) {
        PriceProviderRegistry registry = new PriceProviderRegistry(providers);
        log.info("Registered price sources: {}", registry.sourceNames());
        return registry;
    }

    @Bean
    @ConditionalOnProperty(name = "simulator.cache.store", havingValue = "jpa", matchIfMissing = true)
    public PriceCacheStore jpaPriceCacheStore(PriceCacheRepository priceCacheRepository, ObjectMapper objectMapper) {
        return new JpaPriceCacheStore(priceCacheRepository, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "simulator.cache.store", havingValue = "memory")
    public PriceCacheStore inMemoryPriceCacheStore() {
        return new InMemoryPriceCacheStore();
    }
}
