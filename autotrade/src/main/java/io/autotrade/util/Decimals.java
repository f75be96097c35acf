package io.autotrade.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for NUMERIC(24, 8) price arithmetic.
 */
public final class Decimals {

    public static final int PRECISION = 24;
    public static final int SCALE = 8;
    public static final int MAX_INTEGER_DIGITS = PRECISION - SCALE;

    /**
     * Bring a value to scale 8 when that is exact, otherwise leave it untouched
     * so that {@link #fitsFixedPoint(BigDecimal)} can reject it.
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) return null;
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > SCALE) return value;
        return stripped.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    /**
     * Round an arithmetic result back to scale 8.
     */
    public static BigDecimal fixed(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * True if the value is representable as NUMERIC(24, 8) without rounding.
     */
    public static boolean fitsFixedPoint(BigDecimal value) {
        if (value == null) return false;
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > SCALE) return false;
        int integerDigits = stripped.precision() - stripped.scale();
        return integerDigits <= MAX_INTEGER_DIGITS;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private Decimals() {}
}
