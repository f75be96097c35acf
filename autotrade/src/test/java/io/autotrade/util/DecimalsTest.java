package io.autotrade.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DecimalsTest {

    @Test
    void testFitsFixedPoint() {
        assertTrue(Decimals.fitsFixedPoint(new BigDecimal("0.00000001")));
        assertTrue(Decimals.fitsFixedPoint(new BigDecimal("9999999999999999.99999999")), "16 integer digits fit");
        assertTrue(Decimals.fitsFixedPoint(new BigDecimal("1.100000000000")), "Trailing zeros do not count");
        assertFalse(Decimals.fitsFixedPoint(new BigDecimal("0.000000001")), "9 fraction digits do not fit");
        assertFalse(Decimals.fitsFixedPoint(new BigDecimal("10000000000000000")), "17 integer digits do not fit");
        assertFalse(Decimals.fitsFixedPoint(null));
    }

    @Test
    void testNormalizeAndFixed() {
        assertEquals(new BigDecimal("1.50000000"), Decimals.normalize(new BigDecimal("1.5")));
        assertEquals(new BigDecimal("1E+3").setScale(8), Decimals.normalize(new BigDecimal("1E+3")));
        assertEquals(new BigDecimal("0.33333333"), Decimals.fixed(new BigDecimal("0.333333333")));
        assertEquals(new BigDecimal("0.66666667"), Decimals.fixed(new BigDecimal("0.666666666")));
        assertNull(Decimals.normalize(null));
    }
}
