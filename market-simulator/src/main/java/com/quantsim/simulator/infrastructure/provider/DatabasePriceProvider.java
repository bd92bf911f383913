package com.quantsim.simulator.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantsim.simulator.domain.HistoricalMarketData;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.marketdata.PriceProvider;
import com.quantsim.simulator.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Serves bars previously ingested into {@code historical_market_data}.
 * The payload is the JSON array of the matching bars.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatabasePriceProvider implements PriceProvider {

    public static final String SOURCE_NAME = "database";

    private static final TypeReference<List<PriceBar>> BAR_LIST = new TypeReference<>() {
    };

    private final HistoricalMarketDataRepository historicalMarketDataRepository;
    private final ObjectMapper objectMapper;

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public String fetchRaw(String asset, LocalDate start, LocalDate end, Period interval) {
        List<HistoricalMarketData> rows = historicalMarketDataRepository.findBySymbolAndDateRange(asset, start, end);
        if (rows.isEmpty()) {
            throw new SourceFetchException("No ingested data for " + asset + " between " + start + " and " + end);
        }
        log.info("Loaded {} historical data points for {} from database", rows.size(), asset);

        List<PriceBar> bars = new ArrayList<>(rows.size());
        for (HistoricalMarketData row : rows) {
            bars.add(row.toPriceBar());
        }
        try {
            return objectMapper.writeValueAsString(bars);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("Failed to encode bars for " + asset, e);
        }
    }

    @Override
    public List<PriceBar> normalize(String rawPayload) {
        List<PriceBar> decoded;
        try {
            decoded = objectMapper.readValue(rawPayload, BAR_LIST);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("Unreadable database payload", e);
        }
        NavigableMap<LocalDate, PriceBar> byDate = new TreeMap<>();
        for (PriceBar bar : decoded) {
            if (bar.getDate() != null && bar.hasValidClose()) {
                byDate.put(bar.getDate(), bar);
            }
        }
        return new ArrayList<>(byDate.values());
    }
}
