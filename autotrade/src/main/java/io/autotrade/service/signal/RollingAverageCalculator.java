package io.autotrade.service.signal;

import io.autotrade.domain.data.Interval;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceField;
import io.autotrade.domain.market.Market;
import io.autotrade.domain.signal.RollingAverage;
import io.autotrade.service.candle.PriceSeriesStore;
import io.autotrade.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Rolling Average Calculator - simple moving average over the most recent
 * N periods ending at a reference timestamp.
 *
 * Window: the {@code windowSize} interval buckets ending at (and including)
 * the bucket of {@code referenceTs}. Missing periods are skipped, not
 * counted as zero, so the average runs over at most N periods with data.
 *
 * Threshold: with fewer than {@code minPeriods} bars in the window the
 * result is the Insufficient sentinel, whatever the window size.
 */
public final class RollingAverageCalculator {
    private static final Logger log = LoggerFactory.getLogger(RollingAverageCalculator.class);

    public static final int DEFAULT_MIN_PERIODS = 5;

    private final PriceSeriesStore store;
    private final int minPeriods;

    public RollingAverageCalculator(PriceSeriesStore store, int minPeriods) {
        if (minPeriods <= 0) {
            throw new IllegalArgumentException("minPeriods must be positive: " + minPeriods);
        }
        this.store = store;
        this.minPeriods = minPeriods;
    }

    public RollingAverageCalculator(PriceSeriesStore store) {
        this(store, DEFAULT_MIN_PERIODS);
    }

    public int getMinPeriods() {
        return minPeriods;
    }

    /**
     * @param market      Market to read
     * @param interval    Bar interval
     * @param referenceTs End of the window (its bucket is the "current" period)
     * @param field       Bar field to average
     * @param windowSize  Number of periods to look back, including the current one
     * @return computed average or the Insufficient sentinel
     */
    public RollingAverage rollingAverage(Market market, Interval interval, Instant referenceTs,
                                         PriceField field, int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }

        Instant current = interval.floor(referenceTs);
        Instant windowStart = current.minusSeconds(interval.seconds() * (windowSize - 1L));

        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal currentPrice = null;
        int count = 0;

        for (OhlcvBar bar : store.queryRange(market, interval, windowStart, current)) {
            BigDecimal value = field.of(bar);
            sum = sum.add(value);
            count++;
            if (bar.periodStart().equals(current)) {
                currentPrice = value;
            }
        }

        if (count < minPeriods) {
            log.debug("Insufficient history for {} {} @ {}: {} of {} required periods",
                market, interval, current, count, minPeriods);
            return RollingAverage.insufficient(current, field, windowSize, count);
        }

        BigDecimal average = sum.divide(BigDecimal.valueOf(count), Decimals.SCALE, RoundingMode.HALF_UP);
        return RollingAverage.computed(current, field, windowSize, count, average, currentPrice);
    }
}
