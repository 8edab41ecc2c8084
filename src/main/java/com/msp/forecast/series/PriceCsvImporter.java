package com.msp.forecast.series;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads the agmarknet historical price export into the {@link TimeSeriesStore}.
 *
 * Rows without a parseable price date or modal price are skipped and counted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PriceCsvImporter {

    static final String COL_STATE = "State";
    static final String COL_DISTRICT = "District Name";
    static final String COL_MARKET = "Market Name";
    static final String COL_COMMODITY = "Commodity";
    static final String COL_VARIETY = "Variety";
    static final String COL_GRADE = "Grade";
    static final String COL_MIN = "Min Price (Rs./Quintal)";
    static final String COL_MAX = "Max Price (Rs./Quintal)";
    static final String COL_MODAL = "Modal Price (Rs./Quintal)";
    static final String COL_DATE = "Price Date";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);
    private static final int BATCH_SIZE = 1000;

    private final TimeSeriesStore store;
    private final CsvMapper csvMapper = new CsvMapper();

    @Value("${prices.csv.path:}")
    private String csvPath;

    @PostConstruct
    public void init() {
        if (csvPath == null || csvPath.isBlank()) {
            log.info("No price CSV configured, skipping startup import");
            return;
        }
        if (store.size() > 0) {
            log.info("Price store already populated ({} rows), skipping import of {}", store.size(), csvPath);
            return;
        }
        importFrom(Path.of(csvPath));
    }

    public ImportResult importFrom(Path path) {
        if (!Files.exists(path)) {
            log.error("Price data not found at {}", path);
            return new ImportResult(0, 0);
        }
        log.info("Loading price data from {}...", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importFrom(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read price data from " + path, e);
        }
    }

    public ImportResult importFrom(Reader reader) throws IOException {
        long startTime = System.currentTimeMillis();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        int imported = 0;
        int skipped = 0;
        List<PricePoint> batch = new ArrayList<>(BATCH_SIZE);

        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(reader)) {
            while (rows.hasNext()) {
                PricePoint point = toPricePoint(rows.next());
                if (point == null) {
                    skipped++;
                    continue;
                }
                batch.add(point);
                if (batch.size() >= BATCH_SIZE) {
                    imported += store.ingest(batch);
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            imported += store.ingest(batch);
        }

        log.info("Loaded {} price records ({} skipped) in {}ms",
                imported, skipped, System.currentTimeMillis() - startTime);
        return new ImportResult(imported, skipped);
    }

    private PricePoint toPricePoint(Map<String, String> row) {
        LocalDate date = parseDate(row.get(COL_DATE));
        BigDecimal modal = parsePrice(row.get(COL_MODAL));
        String commodity = trimToNull(row.get(COL_COMMODITY));
        String market = trimToNull(row.get(COL_MARKET));
        String state = trimToNull(row.get(COL_STATE));
        if (date == null || modal == null || commodity == null || market == null || state == null) {
            return null;
        }
        return PricePoint.builder()
                .commodity(commodity)
                .region(state)
                .district(trimToNull(row.get(COL_DISTRICT)))
                .market(market)
                .variety(trimToNull(row.get(COL_VARIETY)))
                .grade(trimToNull(row.get(COL_GRADE)))
                .date(date)
                .minPrice(parsePrice(row.get(COL_MIN)))
                .maxPrice(parsePrice(row.get(COL_MAX)))
                .modalPrice(modal)
                .build();
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static BigDecimal parsePrice(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
