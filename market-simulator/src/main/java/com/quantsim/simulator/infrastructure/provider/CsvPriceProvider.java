package com.quantsim.simulator.infrastructure.provider;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.SourceFetchException;
import com.quantsim.simulator.marketdata.CsvBarParser;
import com.quantsim.simulator.marketdata.PriceProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;

/**
 * Reads {@code <asset>.csv} from a local directory. The whole file is returned as the
 * payload whatever range was requested.
 */
@Slf4j
public class CsvPriceProvider implements PriceProvider {

    public static final String SOURCE_NAME = "csv";

    private final Path directory;

    public CsvPriceProvider(Path directory) {
        this.directory = directory;
    }

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public String fetchRaw(String asset, LocalDate start, LocalDate end, Period interval) {
        Path file = directory.resolve(asset + ".csv");
        if (!Files.isRegularFile(file)) {
            throw new SourceFetchException("No CSV file for " + asset + " at " + file.toAbsolutePath());
        }
        try {
            log.debug("Reading {} for {} to {}", file, start, end);
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceFetchException("Failed to read " + file.toAbsolutePath(), e);
        }
    }

    @Override
    public List<PriceBar> normalize(String rawPayload) {
        return CsvBarParser.parse(rawPayload);
    }
}
