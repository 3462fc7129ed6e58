package com.perptrader.marketdata;

import com.perptrader.domain.model.Bar;
import com.perptrader.exception.MarketDataException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads OHLCV bars from CSV.
 *
 * <p>The first line is a header. Columns are matched by name ({@code timestamp, open, high,
 * low, close, volume}, case-insensitive); when no column is called {@code timestamp} the
 * first column is used, which covers files exported with a datetime index. Timestamps are
 * ISO-8601 (with or without offset, UTC assumed when absent) or epoch milliseconds.
 *
 * <p>The result is sorted by timestamp. Rows with an unparseable number fail the load with
 * the line number.
 */
public class CsvBarLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvBarLoader.class);

    private static final String[] PRICE_COLUMNS = {"open", "high", "low", "close", "volume"};

    public List<Bar> load(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Bar> bars = read(reader, file.toString());
            log.info("Loaded {} bars from {}", bars.size(), file);
            return bars;
        } catch (IOException e) {
            throw new MarketDataException("Failed to read bar file " + file, e);
        }
    }

    /**
     * Loads a {@code timestamp,rate} funding file (header first) into a time-keyed map. An
     * absent file yields an empty map.
     */
    public NavigableMap<Instant, BigDecimal> loadFundingRates(Path file) {
        NavigableMap<Instant, BigDecimal> rates = new TreeMap<>();
        if (!Files.exists(file)) {
            return rates;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            reader.readLine();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split(",");
                rates.put(parseTimestamp(fields[0].trim()), new BigDecimal(fields[1].trim()));
            }
        } catch (IOException | RuntimeException e) {
            throw new MarketDataException("Failed to read funding file " + file, e);
        }
        return rates;
    }

    public List<Bar> read(Reader source, String sourceName) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String header = reader.readLine();
        if (header == null) {
            return List.of();
        }
        Map<String, Integer> columns = indexColumns(header, sourceName);

        List<Bar> bars = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            bars.add(parseRow(line.split(",", -1), columns, sourceName, lineNumber));
        }
        bars.sort(Comparator.comparing(Bar::getTimestamp));
        return bars;
    }

    private Map<String, Integer> indexColumns(String header, String sourceName) {
        String[] names = header.split(",", -1);
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            columns.put(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        columns.putIfAbsent("timestamp", 0);
        for (String required : PRICE_COLUMNS) {
            if (!columns.containsKey(required)) {
                throw new MarketDataException("Bar file " + sourceName + " is missing column '" + required + "'");
            }
        }
        return columns;
    }

    private Bar parseRow(String[] fields, Map<String, Integer> columns, String sourceName, int lineNumber) {
        try {
            return Bar.builder()
                    .timestamp(parseTimestamp(field(fields, columns, "timestamp")))
                    .open(new BigDecimal(field(fields, columns, "open")))
                    .high(new BigDecimal(field(fields, columns, "high")))
                    .low(new BigDecimal(field(fields, columns, "low")))
                    .close(new BigDecimal(field(fields, columns, "close")))
                    .volume(new BigDecimal(field(fields, columns, "volume")))
                    .build();
        } catch (NumberFormatException | DateTimeParseException | ArrayIndexOutOfBoundsException e) {
            throw new MarketDataException("Malformed row at " + sourceName + ":" + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private static String field(String[] fields, Map<String, Integer> columns, String name) {
        return fields[columns.get(name)].trim();
    }

    static Instant parseTimestamp(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(value));
        }
        String iso = value.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
        }
    }
}
