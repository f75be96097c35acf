package io.autotrade.service.candle;

import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.market.Market;
import io.autotrade.repository.InMemoryPriceSeriesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BarCsvImporterTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private PriceSeriesStore store;
    private BarCsvImporter importer;

    @BeforeEach
    void setUp() {
        store = new PriceSeriesStore(new InMemoryPriceSeriesRepository(),
            Clock.fixed(Instant.parse("2024-01-02T00:00:00Z"), ZoneOffset.UTC));
        importer = new BarCsvImporter(store);
    }

    @Test
    void testParsesIsoAndEpochTimestamps() {
        OhlcvBar iso = BarCsvImporter.parse("2024-01-01T00:01:00Z,1,2,0.5,1.5,10", MARKET, Interval.ONE_MINUTE);
        OhlcvBar epoch = BarCsvImporter.parse(" 1704067260 , 1 , 2 , 0.5 , 1.5 , 10 ", MARKET, Interval.ONE_MINUTE);

        assertEquals(T0.plusSeconds(60), iso.periodStart());
        assertTrue(iso.samePayload(epoch));
        assertEquals(0, new BigDecimal("0.5").compareTo(iso.low()));
    }

    @Test
    void testMalformedRows() {
        assertThrows(InvalidBarException.class, () -> BarCsvImporter.parse("2024-01-01T00:00:00Z,1,2,3", MARKET, Interval.ONE_MINUTE));
        assertThrows(InvalidBarException.class, () -> BarCsvImporter.parse("yesterday,1,1,1,1,1", MARKET, Interval.ONE_MINUTE));
        assertThrows(InvalidBarException.class, () -> BarCsvImporter.parse("1704067200,1,x,1,1,1", MARKET, Interval.ONE_MINUTE));
    }

    @Test
    void testImportCountsEveryOutcome() throws Exception {
        store.ingestBar(OhlcvBar.of(MARKET, Interval.ONE_MINUTE, T0.plusSeconds(120), "9", "9", "9", "9", "9"));
        String csv = String.join("\n",
            "timestamp,open,high,low,close,volume",
            "1704067200,100,101,99,100,1",
            "",
            "1704067200,100,101,99,100,1",
            "1704067260,100,99,101,100,1",
            "1704067320,100,101,99,100,1",
            "garbage");

        BarCsvImporter.ImportReport report = importer.importFrom(new StringReader(csv), MARKET, Interval.ONE_MINUTE);

        assertEquals(new BarCsvImporter.ImportReport(1, 1, 1, 2), report);
        assertEquals(5, report.total());
    }

    @Test
    void testImportFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bars.csv");
        Files.write(file, List.of(
            "2024-01-01T00:00:00Z,100,101,99,100,1",
            "2024-01-01T00:01:00Z,100,102,98,101,2"), StandardCharsets.UTF_8);

        BarCsvImporter.ImportReport report = importer.importFile(file, MARKET, Interval.ONE_MINUTE);

        assertEquals(2, report.inserted());
        assertEquals(2, store.queryRange(MARKET, Interval.ONE_MINUTE, T0, T0.plusSeconds(60)).toList().size());
    }
}
