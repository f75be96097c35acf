package io.autotrade.service.candle;

import io.autotrade.domain.common.InvalidBarException;
import io.autotrade.domain.data.OhlcvBar;
import io.autotrade.domain.data.PriceTick;
import io.autotrade.util.Decimals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Schema checks for bars and ticks, applied before anything touches storage.
 *
 * Bars: all fields present and NUMERIC(24, 8)-representable, positive prices,
 * {@code low <= open, close <= high}, {@code volume > 0}, periodStart aligned
 * to the interval and not in the future. Ticks: positive price and volume,
 * timestamp not in the future.
 */
public final class BarValidator {

    public void validateBar(OhlcvBar bar, Instant now) {
        String where = bar.partition().tableName() + " @ " + bar.periodStart();

        requireFixedPoint("open", bar.open(), where);
        requireFixedPoint("high", bar.high(), where);
        requireFixedPoint("low", bar.low(), where);
        requireFixedPoint("close", bar.close(), where);
        requireFixedPoint("volume", bar.volume(), where);

        if (bar.low().signum() <= 0) {
            throw new InvalidBarException("Non-positive low price " + bar.low().toPlainString() + " at " + where);
        }
        if (bar.low().compareTo(bar.high()) > 0) {
            throw new InvalidBarException("low > high at " + where + ": " + bar.payloadString());
        }
        if (outside(bar.open(), bar.low(), bar.high())) {
            throw new InvalidBarException("open outside [low, high] at " + where + ": " + bar.payloadString());
        }
        if (outside(bar.close(), bar.low(), bar.high())) {
            throw new InvalidBarException("close outside [low, high] at " + where + ": " + bar.payloadString());
        }
        if (bar.volume().signum() <= 0) {
            throw new InvalidBarException("Bars need volume > 0 at " + where);
        }
        if (!bar.interval().isAligned(bar.periodStart())) {
            throw new InvalidBarException("periodStart " + bar.periodStart()
                + " is not aligned to " + bar.interval().label());
        }
        if (bar.periodStart().isAfter(now)) {
            throw new InvalidBarException("periodStart " + bar.periodStart() + " is in the future (now " + now + ")");
        }
    }

    public void validateTick(PriceTick tick, Instant now) {
        String where = tick.market().key() + " @ " + tick.timestamp();

        requireFixedPoint("price", tick.price(), where);
        requireFixedPoint("volume", tick.volume(), where);

        if (tick.price().signum() <= 0) {
            throw new InvalidBarException("Ticks need price > 0 at " + where);
        }
        if (tick.volume().signum() <= 0) {
            throw new InvalidBarException("Ticks need volume > 0 at " + where);
        }
        if (tick.timestamp().isAfter(now)) {
            throw new InvalidBarException("Tick timestamp " + tick.timestamp() + " is in the future (now " + now + ")");
        }
    }

    private static void requireFixedPoint(String field, BigDecimal value, String where) {
        if (value == null) {
            throw new InvalidBarException("Missing " + field + " at " + where);
        }
        if (!Decimals.fitsFixedPoint(value)) {
            throw new InvalidBarException(field + " " + value.toPlainString()
                + " does not fit NUMERIC(" + Decimals.PRECISION + ", " + Decimals.SCALE + ") at " + where);
        }
    }

    private static boolean outside(BigDecimal value, BigDecimal low, BigDecimal high) {
        return value.compareTo(low) < 0 || value.compareTo(high) > 0;
    }
}
