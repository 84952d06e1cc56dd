package ru.perminov.ledger.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FixedPointTest {

    @Test
    void testScaleRoundsHalfAwayFromZero() {
        assertEquals(12544L, FixedPoint.scale(new BigDecimal("1.25435")));
        assertEquals(1234568L, FixedPoint.scale(new BigDecimal("123.45678")));
        assertEquals(0L, FixedPoint.scale(BigDecimal.ZERO));
        assertEquals(-502500L, FixedPoint.scale(new BigDecimal("-50.25")));
        assertEquals(-12544L, FixedPoint.scale(new BigDecimal("-1.25435")));
    }

    @Test
    void testScaleFromDouble() {
        assertEquals(12544L, FixedPoint.scale(1.25435));
        assertEquals(-502500L, FixedPoint.scale(-50.25));
        assertThrows(IllegalArgumentException.class, () -> FixedPoint.scale(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> FixedPoint.scale(Double.POSITIVE_INFINITY));
    }

    @Test
    void testUnscaleIsExactForFourDecimals() {
        for (String value : new String[]{"0", "1", "0.0001", "5.2667", "-50.25", "49894.5", "922337203685477.5807"}) {
            BigDecimal decimal = new BigDecimal(value);
            assertEquals(0, decimal.compareTo(FixedPoint.unscale(FixedPoint.scale(decimal))), value);
        }
    }

    @Test
    void testScaleRejectsNullAndOverflow() {
        assertThrows(IllegalArgumentException.class, () -> FixedPoint.scale((BigDecimal) null));
        assertThrows(IllegalArgumentException.class, () -> FixedPoint.scale(new BigDecimal("1e20")));
    }

    @Test
    void testRoundToPence() {
        assertEquals(new BigDecimal("10.01"), FixedPoint.roundToPence(new BigDecimal("10.005")));
        assertEquals(new BigDecimal("-10.01"), FixedPoint.roundToPence(new BigDecimal("-10.005")));
        assertEquals(new BigDecimal("632.04"), FixedPoint.roundToPence(new BigDecimal("632.04")));
    }
}
