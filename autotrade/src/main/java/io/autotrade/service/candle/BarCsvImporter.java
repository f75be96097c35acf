package io.autotrade.service.candle;

import io.autotrade.domain.common.ConflictException;
import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.market.Market;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Bulk-load bars into one partition from CSV.
 *
 * Format: {@code timestamp,open,high,low,close,volume}, where timestamp is
 * ISO-8601 or epoch seconds. A header line and blank lines are skipped.
 * Every row goes through {@link PriceSeriesStore#ingestBar}, so existing
 * bars are never overwritten.
 */
public final class BarCsvImporter {
    private static final Logger log = LoggerFactory.getLogger(BarCsvImporter.class);

    public record ImportReport(int inserted, int unchanged, int conflicts, int invalid) {
        public int total() {
            return inserted + unchanged + conflicts + invalid;
        }
    }

    private final PriceSeriesStore store;

    public BarCsvImporter(PriceSeriesStore store) {
        this.store = store;
    }

    public ImportReport importFile(Path file, Market market, Interval interval) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            log.info("Importing {} into {}_{}", file, market, interval.label());
            return importFrom(reader, market, interval);
        }
    }

    public ImportReport importFrom(Reader source, Market market, Interval interval) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        int inserted = 0;
        int unchanged = 0;
        int conflicts = 0;
        int invalid = 0;
        int lineNo = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || (lineNo == 1 && line.toLowerCase(Locale.ROOT).startsWith("timestamp"))) {
                continue;
            }
            try {
                OhlcvBar bar = parse(line, market, interval);
                if (store.ingestBar(bar) == IngestResult.INSERTED) {
                    inserted++;
                } else {
                    unchanged++;
                }
            } catch (ConflictException e) {
                conflicts++;
            } catch (InvalidBarException e) {
                invalid++;
                log.warn("Line {}: {}", lineNo, e.getMessage());
            }
        }

        ImportReport report = new ImportReport(inserted, unchanged, conflicts, invalid);
        log.info("Imported {} rows into {}_{}: {} inserted, {} unchanged, {} conflicts, {} invalid",
            report.total(), market, interval.label(), inserted, unchanged, conflicts, invalid);
        return report;
    }

    /**
     * Parse one CSV row.
     *
     * @throws InvalidBarException if the row is malformed
     */
    static OhlcvBar parse(String line, Market market, Interval interval) {
        String[] parts = line.split(",");
        if (parts.length < 6) {
            throw new InvalidBarException("Invalid CSV line: " + line);
        }
        try {
            return new OhlcvBar(market, interval, parseTimestamp(parts[0].trim()),
                new BigDecimal(parts[1].trim()),
                new BigDecimal(parts[2].trim()),
                new BigDecimal(parts[3].trim()),
                new BigDecimal(parts[4].trim()),
                new BigDecimal(parts[5].trim()));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidBarException("Invalid CSV line: " + line, e);
        }
    }

    private static Instant parseTimestamp(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }
        return Instant.parse(value);
    }
}
