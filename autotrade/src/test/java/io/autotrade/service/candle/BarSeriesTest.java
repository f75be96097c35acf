package io.autotrade.service.candle;

import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.market.Market;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class BarSeriesTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final List<OhlcvBar> rows = new ArrayList<>();
    private final List<Instant> cursors = new ArrayList<>();

    private BarSeries series(int pageSize) {
        return new BarSeries((after, limit) -> {
            cursors.add(after);
            return rows.stream()
                .filter(b -> after == null || b.periodStart().isAfter(after))
                .limit(limit)
                .toList();
        }, pageSize);
    }

    private void addBars(int count) {
        for (int i = 0; i < count; i++) {
            rows.add(OhlcvBar.of(MARKET, Interval.ONE_MINUTE, T0.plusSeconds(60L * i), "1", "1", "1", "1", "1"));
        }
    }

    @Test
    void testPagesUseKeysetCursor() {
        addBars(5);

        List<OhlcvBar> all = series(2).toList();

        assertEquals(rows, all);
        assertEquals(3, cursors.size(), "5 rows at page size 2 need 3 fetches");
        assertNull(cursors.get(0));
        assertEquals(T0.plusSeconds(60), cursors.get(1));
        assertEquals(T0.plusSeconds(180), cursors.get(2));
    }

    @Test
    void testExactMultipleNeedsOneEmptyFetch() {
        addBars(4);
        assertEquals(4, series(2).toList().size());
        assertEquals(3, cursors.size());
    }

    @Test
    void testNothingIsFetchedUntilIterated() {
        addBars(3);
        BarSeries series = series(10);
        assertTrue(cursors.isEmpty());

        Iterator<OhlcvBar> it = series.iterator();
        assertTrue(it.hasNext());
        assertEquals(1, cursors.size());
    }

    @Test
    void testEmptySeries() {
        Iterator<OhlcvBar> it = BarSeries.empty().iterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void testRejectsNonPositivePageSize() {
        assertThrows(IllegalArgumentException.class, () -> new BarSeries((a, l) -> List.of(), 0));
    }
}
