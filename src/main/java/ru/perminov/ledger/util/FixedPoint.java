package ru.perminov.ledger.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between decimal domain values and the scaled integers they are stored as.
 * <p>
 * Every price, rate, quantity, cost and cash amount is persisted as {@code round(value * 10000)}.
 * Rounding is half away from zero and keeps the sign, so {@code -50.25} becomes {@code -502500}.
 * Values with more than four decimals lose precision on the way in; {@link #unscale(long)} never rounds.
 */
public final class FixedPoint {

    public static final int SCALE = 4;
    public static final long FACTOR = 10_000L;

    private static final int PENCE_SCALE = 2;

    private FixedPoint() {
    }

    public static long scale(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot scale a null value");
        }
        try {
            return value.setScale(SCALE, RoundingMode.HALF_UP).unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Value out of range: " + value.toPlainString(), e);
        }
    }

    public static long scale(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot scale " + value);
        }
        // valueOf uses the shortest decimal representation, so 1.25435 stays 1.25435
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal unscale(long scaled) {
        return BigDecimal.valueOf(scaled, SCALE);
    }

    public static BigDecimal roundToPence(BigDecimal value) {
        return value.setScale(PENCE_SCALE, RoundingMode.HALF_UP);
    }
}
