package com.quantsim.simulator.marketdata;

import com.quantsim.simulator.domain.PriceBar;
import com.quantsim.simulator.exception.SourceFetchException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses comma separated daily bars with a header row.
 * The date column is the first of date, trade_date, datetime or time present; other columns are
 * matched case-insensitively. Supports Yahoo Finance exports.
 */
@Slf4j
public final class CsvBarParser {

    // in priority order
    private static final String[] DATE_COLUMNS = { "date", "trade_date", "datetime", "time" };

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("yyyyMMdd")
    };

    private CsvBarParser() {
    }

    /**
     * Parse CSV content into bars sorted by date. Later rows win on duplicate dates.
     *
     * @throws SourceFetchException when there is no header, date column or close column
     */
    public static List<PriceBar> parse(String content) {
        if (content == null || content.isBlank()) {
            return new ArrayList<>();
        }

        String[] lines = content.split("\\r?\\n");
        Map<String, Integer> columns = readHeader(lines[0]);

        Integer dateIdx = firstPresent(columns, DATE_COLUMNS);
        if (dateIdx == null) {
            throw new SourceFetchException("Could not identify a date column in header: " + lines[0]);
        }
        Integer closeIdx = columns.get("close");
        if (closeIdx == null) {
            throw new SourceFetchException("Missing close column in header: " + lines[0]);
        }

        TreeMap<LocalDate, PriceBar> bars = new TreeMap<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(",", -1);
            try {
                LocalDate date = parseDate(cell(parts, dateIdx));
                BigDecimal close = decimal(cell(parts, closeIdx));
                if (close == null) {
                    log.debug("Skipping row without close: {}", line);
                    continue;
                }
                bars.put(date, PriceBar.builder()
                        .date(date)
                        .open(decimal(cell(parts, columns.get("open"))))
                        .high(decimal(cell(parts, columns.get("high"))))
                        .low(decimal(cell(parts, columns.get("low"))))
                        .close(close)
                        .volume(volume(cell(parts, columns.get("volume"))))
                        .dividend(decimal(cell(parts, firstPresent(columns, "dividends", "dividend"))))
                        .peTtm(decimal(cell(parts, firstPresent(columns, "pe_ttm", "pe"))))
                        .build());
            } catch (RuntimeException e) {
                log.warn("Failed to parse CSV line: {} - Error: {}", line, e.getMessage());
            }
        }
        return new ArrayList<>(bars.values());
    }

    /**
     * Parse a date in any of the supported formats; a time part is ignored.
     */
    public static LocalDate parseDate(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing date");
        }
        String trimmed = value.trim();
        if (trimmed.length() > 10 && (trimmed.charAt(10) == ' ' || trimmed.charAt(10) == 'T')) {
            try {
                return LocalDateTime.parse(trimmed.substring(0, 19).replace(' ', 'T')).toLocalDate();
            } catch (DateTimeParseException | StringIndexOutOfBoundsException e) {
                trimmed = trimmed.substring(0, 10);
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(trimmed, formatter);
            } catch (DateTimeParseException e) {
                // Try next formatter
            }
        }
        throw new IllegalArgumentException("Unable to parse date: " + value);
    }

    private static Map<String, Integer> readHeader(String header) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = header.split(",");
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT).replace(' ', '_'), i);
        }
        return columns;
    }

    private static Integer firstPresent(Map<String, Integer> columns, String... names) {
        for (String name : names) {
            if (columns.containsKey(name)) {
                return columns.get(name);
            }
        }
        return null;
    }

    private static String cell(String[] parts, Integer idx) {
        if (idx == null || idx >= parts.length) {
            return null;
        }
        String value = parts[idx].trim();
        return value.isEmpty() || value.equalsIgnoreCase("nan") || value.equalsIgnoreCase("null") ? null : value;
    }

    private static BigDecimal decimal(String value) {
        return value == null ? null : new BigDecimal(value);
    }

    private static Long volume(String value) {
        return value == null ? null : new BigDecimal(value).longValue();
    }
}
