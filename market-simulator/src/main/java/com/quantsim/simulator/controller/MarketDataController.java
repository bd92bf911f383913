package com.quantsim.simulator.controller;

import com.quantsim.simulator.service.MarketDataIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for loading bars into the database price source.
 */
@RestController
@RequestMapping("/market-data")
@RequiredArgsConstructor
@Slf4j
public class MarketDataController {

    private final MarketDataIngestionService marketDataIngestionService;

    /**
     * Ingest a CSV body for a symbol.
     *
     * @return the number of bars stored for the symbol
     */
    @PostMapping(value = "/{symbol}/csv", consumes = { "text/csv", "text/plain" })
    public ResponseEntity<Map<String, Object>> ingestCsv(@PathVariable String symbol, @RequestBody String csv) {

        log.info("POST /market-data/{}/csv - {} bytes", symbol, csv.length());

        int stored = marketDataIngestionService.ingestCSVFromString(symbol, csv);

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("symbol", symbol, "storedBars", stored));
    }

    @DeleteMapping("/{symbol}")
    public ResponseEntity<Void> deleteSymbol(@PathVariable String symbol) {

        log.info("DELETE /market-data/{}", symbol);

        marketDataIngestionService.deleteSymbolData(symbol);
        return ResponseEntity.noContent().build();
    }
}
