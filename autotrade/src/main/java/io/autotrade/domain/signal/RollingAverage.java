package io.autotrade.domain.signal;

import io.autotrade.domain.data.PriceField;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Result of a rolling-average lookup.
 *
 * When {@code sufficient} is false there was not enough history in the
 * window and {@code average} is null. {@code currentPrice} is null when the
 * bar at the reference timestamp is missing; both comparison flags are then
 * false.
 */
public record RollingAverage(
    boolean sufficient,
    Instant referenceTs,
    PriceField field,
    int windowSize,
    int periodsWithData,
    BigDecimal average,
    BigDecimal currentPrice,
    boolean isAboveCurrent,
    boolean isBelowCurrent
) {
    /**
     * Create a computed result. Comparison flags are derived from the current price.
     */
    public static RollingAverage computed(Instant referenceTs, PriceField field, int windowSize,
                                          int periodsWithData, BigDecimal average, BigDecimal currentPrice) {
        boolean above = currentPrice != null && average.compareTo(currentPrice) > 0;
        boolean below = currentPrice != null && average.compareTo(currentPrice) < 0;
        return new RollingAverage(true, referenceTs, field, windowSize, periodsWithData,
            average, currentPrice, above, below);
    }

    /**
     * Create the Insufficient sentinel.
     */
    public static RollingAverage insufficient(Instant referenceTs, PriceField field, int windowSize, int periodsWithData) {
        return new RollingAverage(false, referenceTs, field, windowSize, periodsWithData, null, null, false, false);
    }

    public boolean hasCurrentPrice() {
        return currentPrice != null;
    }
}
