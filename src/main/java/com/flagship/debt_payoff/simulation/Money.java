package com.flagship.debt_payoff.simulation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Fixed-point money helpers.
 *
 * Every amount the engine stores or compares is on the 2-decimal lattice,
 * rounded half-up (away from zero at the midpoint), never banker's rounding.
 */
public final class Money {

    public static final BigDecimal ZERO = new BigDecimal("0.00");

    private static final int SCALE = 2;

    private Money() {
        // Utility class
    }

    /**
     * Rounds an amount to cents using half-up rounding.
     */
    public static BigDecimal quantize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String amount) {
        return quantize(new BigDecimal(amount));
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal sum(BigDecimal a, BigDecimal b) {
        return quantize(a.add(b));
    }

    public static BigDecimal total(Collection<BigDecimal> amounts) {
        return quantize(amounts.stream().reduce(ZERO, BigDecimal::add));
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount.signum() > 0;
    }

    /**
     * Plain 2-decimal rendering used at the JSON boundary, e.g. {@code "102.51"}.
     */
    public static String format(BigDecimal amount) {
        return quantize(amount).toPlainString();
    }

    /**
     * Currency rendering used in warning messages, e.g. {@code "$12.50"}.
     */
    public static String display(BigDecimal amount) {
        return "$" + format(amount);
    }
}
