package io.autotrade.service.signal;

import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceField;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.signal.RollingAverage;
import io.autotrade.repository.InMemoryPriceSeriesRepository;
import io.autotrade.service.candle.PriceSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RollingAverageCalculatorTest {

    private static final Market MARKET = Market.of("USD", "BTC", "Bitfinex");
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private PriceSeriesStore store;
    private RollingAverageCalculator calculator;

    @BeforeEach
    void setUp() {
        store = new PriceSeriesStore(new InMemoryPriceSeriesRepository(),
            Clock.fixed(Instant.parse("2024-01-02T00:00:00Z"), ZoneOffset.UTC));
        calculator = new RollingAverageCalculator(store);
    }

    private void bar(int minute, String close) {
        store.ingestBar(OhlcvBar.of(MARKET, Interval.ONE_MINUTE, T0.plusSeconds(60L * minute),
            close, close, close, close, "1"));
    }

    private static Instant minute(int m) {
        return T0.plusSeconds(60L * m);
    }

    @Test
    void testInsufficientBelowFivePeriods() {
        for (int m = 0; m < 4; m++) {
            bar(m, "100");
        }

        RollingAverage result = calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(3), PriceField.CLOSE, 50);

        assertFalse(result.sufficient());
        assertNull(result.average());
        assertEquals(4, result.periodsWithData());
        assertFalse(result.isAboveCurrent());
        assertFalse(result.isBelowCurrent());
    }

    @Test
    void testThresholdAppliesWhateverTheWindow() {
        for (int m = 0; m < 10; m++) {
            bar(m, "100");
        }

        assertFalse(calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(9), PriceField.CLOSE, 3).sufficient(),
            "A window of 3 can never reach 5 periods");
        assertTrue(calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(9), PriceField.CLOSE, 5).sufficient());
    }

    @Test
    void testGapsAreSkippedNotZeroed() {
        bar(0, "10");
        bar(2, "20");
        bar(4, "30");
        bar(6, "40");
        bar(8, "50");

        RollingAverage result = calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(8), PriceField.CLOSE, 10);

        assertTrue(result.sufficient());
        assertEquals(5, result.periodsWithData());
        assertEquals(0, new BigDecimal("30").compareTo(result.average()));
        assertEquals(0, new BigDecimal("50").compareTo(result.currentPrice()));
        assertFalse(result.isAboveCurrent());
        assertTrue(result.isBelowCurrent());
    }

    @Test
    void testMissingCurrentBarLeavesFlagsFalse() {
        bar(0, "10");
        bar(2, "20");
        bar(4, "30");
        bar(6, "40");
        bar(8, "50");

        RollingAverage result = calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(9), PriceField.CLOSE, 10);

        assertTrue(result.sufficient());
        assertFalse(result.hasCurrentPrice());
        assertFalse(result.isAboveCurrent());
        assertFalse(result.isBelowCurrent());
    }

    @Test
    void testReferenceIsFlooredAndWindowBounded() {
        for (int m = 0; m < 10; m++) {
            bar(m, String.valueOf(100 - m));
        }

        RollingAverage result = calculator.rollingAverage(MARKET, Interval.ONE_MINUTE,
            minute(9).plusSeconds(30), PriceField.CLOSE, 5);

        assertEquals(minute(9), result.referenceTs());
        assertEquals(5, result.periodsWithData(), "Only minutes 5..9 are in the window");
        assertEquals(0, new BigDecimal("93").compareTo(result.average()));
        assertTrue(result.isAboveCurrent());
    }

    @Test
    void testAverageIsRoundedToEightDecimals() {
        bar(0, "1");
        bar(1, "1");
        bar(2, "1");
        bar(3, "1");
        bar(4, "1");
        bar(5, "2");

        RollingAverage result = calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, minute(5), PriceField.CLOSE, 6);

        assertEquals(new BigDecimal("1.16666667"), result.average());
    }

    @Test
    void testRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RollingAverageCalculator(store, 0));
        assertThrows(IllegalArgumentException.class,
            () -> calculator.rollingAverage(MARKET, Interval.ONE_MINUTE, T0, PriceField.CLOSE, 0));
    }
}
