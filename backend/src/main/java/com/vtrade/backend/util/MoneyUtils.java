package com.vtrade.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-scale money arithmetic. Every amount persisted by the ledger passes through {@link #scale(BigDecimal)}
 * so that stored values and in-memory comparisons agree to four decimals.
 */
public final class MoneyUtils {

    public static final int SCALE = 4;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, ROUNDING);

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return scale(scale(left).add(scale(right)));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return scale(scale(left).subtract(scale(right)));
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(nz(left).multiply(nz(right)));
    }

    public static BigDecimal multiply(BigDecimal left, long right) {
        return scale(nz(left).multiply(BigDecimal.valueOf(right)));
    }

    public static BigDecimal max(BigDecimal left, BigDecimal right) {
        return scale(left).max(scale(right));
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
