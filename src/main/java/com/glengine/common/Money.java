package com.glengine.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Monetary arithmetic shared by every posting path.
 * Uses BigDecimal for precise decimal arithmetic required in financial systems.
 *
 * All ledger amounts are kept at two decimal places and compared with a
 * one-cent tolerance.
 */
public final class Money {

    public static final int SCALE = 2;

    public static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private Money() {
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Sum the values unrounded and round only the final total.
     */
    public static BigDecimal sum(Collection<BigDecimal> values) {
        BigDecimal total = values.stream()
            .map(Money::orZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return round(total);
    }

    public static boolean withinTolerance(BigDecimal left, BigDecimal right) {
        return left.subtract(right).abs().compareTo(TOLERANCE) <= 0;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
