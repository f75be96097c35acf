package io.autotrade.repository;

import io.autotrade.domain.common.NotFoundException;
import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PartitionKey;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.domain.market.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPriceSeriesRepositoryTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final PartitionKey KEY = PartitionKey.of(MARKET, Interval.ONE_MINUTE);
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryPriceSeriesRepository repo;

    @BeforeEach
    void setUp() {
        repo = new InMemoryPriceSeriesRepository();
        repo.ensurePartition(KEY);
        for (int i = 0; i < 10; i++) {
            repo.insertIfAbsent(bar(i, "100"));
        }
    }

    private static OhlcvBar bar(int minute, String close) {
        return OhlcvBar.of(MARKET, Interval.ONE_MINUTE, T0.plusSeconds(60L * minute), "100", "110", "90", close, "1");
    }

    @Test
    void testInsertIfAbsentReturnsExisting() {
        assertTrue(repo.insertIfAbsent(bar(3, "105")).isPresent(), "Key 3 is taken");
        assertEquals(0, repo.findLatestAtOrBefore(KEY, T0.plusSeconds(180)).orElseThrow().close().compareTo(
            new java.math.BigDecimal("100")), "Existing bar must not be overwritten");
    }

    @Test
    void testInsertIntoUnknownPartitionFails() {
        OhlcvBar other = OhlcvBar.of(MARKET, Interval.FIVE_MINUTES, T0, "1", "1", "1", "1", "1");
        assertThrows(NotFoundException.class, () -> repo.insertIfAbsent(other));
    }

    @Test
    void testRangeIsInclusiveAndPaged() {
        List<OhlcvBar> first = repo.findRange(KEY, T0.plusSeconds(120), T0.plusSeconds(420), null, 3);
        assertEquals(3, first.size());
        assertEquals(T0.plusSeconds(120), first.get(0).periodStart());

        List<OhlcvBar> second = repo.findRange(KEY, T0.plusSeconds(120), T0.plusSeconds(420),
            first.get(2).periodStart(), 3);
        assertEquals(3, second.size());
        assertEquals(T0.plusSeconds(420), second.get(2).periodStart(), "Upper bound is inclusive");

        assertTrue(repo.findRange(KEY, T0.plusSeconds(120), T0.plusSeconds(420), T0.plusSeconds(420), 3).isEmpty());
    }

    @Test
    void testLatestAtOrBeforeSkipsGaps() {
        assertEquals(T0.plusSeconds(540), repo.findLatestAtOrBefore(KEY, T0.plusSeconds(3600)).orElseThrow().periodStart());
        assertTrue(repo.findLatestAtOrBefore(KEY, T0.minusSeconds(1)).isEmpty());
    }

    @Test
    void testTicksKeepDuplicatesAndOrder() {
        repo.ensureTickPartition(MARKET);
        PriceTick late = PriceTick.of(MARKET, T0.plusSeconds(30), "101", "1");
        PriceTick early = PriceTick.of(MARKET, T0.plusSeconds(10), "100", "1");
        repo.appendTick(late);
        repo.appendTick(early);
        repo.appendTick(early);

        List<PriceTick> ticks = repo.findTicks(MARKET, T0, T0.plusSeconds(60));
        assertEquals(List.of(early, early, late), ticks);
        assertTrue(repo.findTicks(MARKET, T0, T0.plusSeconds(10)).isEmpty(), "Upper bound is exclusive");
    }

    @Test
    void testDeleteTicksOlderThan() {
        repo.ensureTickPartition(MARKET);
        repo.appendTick(PriceTick.of(MARKET, T0, "100", "1"));
        repo.appendTick(PriceTick.of(MARKET, T0.plusSeconds(3600), "100", "1"));

        assertEquals(1, repo.deleteTicksOlderThan(MARKET, T0.plusSeconds(60)));
        assertEquals(1, repo.findTicks(MARKET, T0, T0.plusSeconds(7200)).size());
        assertEquals(0, repo.deleteTicksOlderThan(Market.of("EUR", "BTC", "Kraken"), T0));
    }
}
