package io.autotrade.domain.data;

import io.autotrade.domain.market.Market;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLCV summary of one (market, interval, periodStart) bucket.
 *
 * Numeric fields are normalized to scale 8 on construction so that record
 * equality matches NUMERIC(24, 8) equality. Values with more fractional
 * digits are kept as given and rejected by validation.
 */
public record OhlcvBar(
    Market market,
    Interval interval,
    Instant periodStart,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    public OhlcvBar {
        if (market == null || interval == null || periodStart == null) {
            throw new IllegalArgumentException("market, interval and periodStart cannot be null");
        }
        open = Decimals.normalize(open);
        high = Decimals.normalize(high);
        low = Decimals.normalize(low);
        close = Decimals.normalize(close);
        volume = Decimals.normalize(volume);
    }

    public static OhlcvBar of(Market market, Interval interval, Instant periodStart,
                              String open, String high, String low, String close, String volume) {
        return new OhlcvBar(market, interval, periodStart,
            new BigDecimal(open), new BigDecimal(high), new BigDecimal(low),
            new BigDecimal(close), new BigDecimal(volume));
    }

    public PartitionKey partition() {
        return new PartitionKey(market, interval);
    }

    /**
     * Exclusive end of the bucket.
     */
    public Instant periodEnd() {
        return periodStart.plusSeconds(interval.seconds());
    }

    /**
     * Same key and same O/H/L/C/V, compared numerically.
     */
    public boolean samePayload(OhlcvBar other) {
        return other != null
            && market.equals(other.market)
            && interval.equals(other.interval)
            && periodStart.equals(other.periodStart)
            && open.compareTo(other.open) == 0
            && high.compareTo(other.high) == 0
            && low.compareTo(other.low) == 0
            && close.compareTo(other.close) == 0
            && volume.compareTo(other.volume) == 0;
    }

    public String payloadString() {
        return String.format("O=%s H=%s L=%s C=%s V=%s",
            open.toPlainString(), high.toPlainString(), low.toPlainString(),
            close.toPlainString(), volume.toPlainString());
    }

    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }
}
