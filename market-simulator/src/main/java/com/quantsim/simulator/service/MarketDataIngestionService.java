package com.quantsim.simulator.service;

import com.quantsim.simulator.domain.HistoricalMarketData;
import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.marketdata.CsvBarParser;
import com.quantsim.simulator.repository.HistoricalMarketDataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for ingesting CSV bars into the database, where the {@code database}
 * price source picks them up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketDataIngestionService {

    static final int BATCH_SIZE = 1000;

    private final HistoricalMarketDataRepository historicalMarketDataRepository;

    /**
     * Ingest CSV data from an input stream.
     *
     * @return number of records stored for the symbol after ingestion
     */
    @Transactional
    public int ingestCSV(String symbol, InputStream inputStream) throws IOException {
        return ingestCSVFromString(symbol, new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Ingest CSV from string content. Rows already stored for a date are updated in place;
     * malformed rows are skipped with a warning.
     */
    @Transactional
    public int ingestCSVFromString(String symbol, String csvContent) {
        log.info("Starting CSV ingestion for symbol: {}", symbol);

        List<PriceBar> bars;
        try {
            bars = CsvBarParser.parse(csvContent);
        } catch (SourceFetchException e) {
            throw new IllegalArgumentException("Invalid CSV for " + symbol + ": " + e.getMessage(), e);
        }
        List<HistoricalMarketData> dataToInsert = new ArrayList<>();

        for (PriceBar bar : bars) {
            HistoricalMarketData row = HistoricalMarketData.fromPriceBar(symbol, bar);
            Optional<HistoricalMarketData> existing = historicalMarketDataRepository
                    .findBySymbolAndDate(symbol, bar.getDate());
            existing.ifPresent(e -> row.setId(e.getId()));
            dataToInsert.add(row);

            if (dataToInsert.size() >= BATCH_SIZE) {
                historicalMarketDataRepository.saveAll(dataToInsert);
                log.info("Batch inserted {} records for {}", dataToInsert.size(), symbol);
                dataToInsert.clear();
            }
        }

        if (!dataToInsert.isEmpty()) {
            historicalMarketDataRepository.saveAll(dataToInsert);
            log.info("Inserted final batch of {} records for {}", dataToInsert.size(), symbol);
        }

        long totalRecords = historicalMarketDataRepository.countBySymbol(symbol);
        log.info("CSV ingestion completed for {}. Total records in DB: {}", symbol, totalRecords);
        return (int) totalRecords;
    }

    /**
     * Delete all data for a symbol (useful for reloading).
     */
    @Transactional
    public void deleteSymbolData(String symbol) {
        log.info("Deleting all data for symbol: {}", symbol);
        historicalMarketDataRepository.deleteBySymbol(symbol);
    }
}
