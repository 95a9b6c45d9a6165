package com.flagship.debt_payoff.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Midpoints round half-up, away from zero")
    void roundsHalfUp() {
        assertEquals("0.01", Money.quantize(new BigDecimal("0.005")).toPlainString());
        assertEquals("2.13", Money.quantize(new BigDecimal("2.125")).toPlainString());
        assertEquals("-0.01", Money.quantize(new BigDecimal("-0.005")).toPlainString());
        assertEquals("0.00", Money.quantize(new BigDecimal("0.004999")).toPlainString());
    }

    @Test
    @DisplayName("Null quantizes to zero")
    void nullIsZero() {
        assertEquals(Money.ZERO, Money.quantize(null));
    }

    @Test
    @DisplayName("Totals and formatting stay on two decimals")
    void totalsAndFormatting() {
        BigDecimal total = Money.total(List.of(Money.of("0.10"), Money.of("0.20"), Money.of("99.7")));

        assertEquals("100.00", Money.format(total));
        assertEquals("$12.50", Money.display(new BigDecimal("12.5")));
        assertEquals("5", Money.min(new BigDecimal("5"), new BigDecimal("7")).toPlainString());
        assertFalse(Money.isPositive(Money.ZERO));
    }
}
