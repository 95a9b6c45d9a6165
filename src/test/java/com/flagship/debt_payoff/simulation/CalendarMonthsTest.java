package com.flagship.debt_payoff.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CalendarMonthsTest {

    @Test
    @DisplayName("Adding months clamps the day to the target month's length")
    void clampsDayOfMonth() {
        assertEquals(LocalDate.of(2024, 2, 29), CalendarMonths.addMonths(LocalDate.of(2024, 1, 31), 1));
        assertEquals(LocalDate.of(2023, 2, 28), CalendarMonths.addMonths(LocalDate.of(2023, 1, 31), 1));
        assertEquals(LocalDate.of(2025, 1, 15), CalendarMonths.addMonths(LocalDate.of(2024, 12, 15), 1));
    }

    @Test
    @DisplayName("Month dates are always computed from the base date")
    void monthDateDoesNotDrift() {
        LocalDate base = LocalDate.of(2024, 1, 31);

        assertEquals(base, CalendarMonths.monthDate(base, 1));
        assertEquals(LocalDate.of(2024, 2, 29), CalendarMonths.monthDate(base, 2));
        assertEquals(LocalDate.of(2024, 3, 31), CalendarMonths.monthDate(base, 3));
    }

    @Test
    @DisplayName("Labels use the English short month name")
    void label() {
        assertEquals("Jan 2024", CalendarMonths.label(LocalDate.of(2024, 1, 1)));
        assertEquals("Sep 2030", CalendarMonths.label(LocalDate.of(2030, 9, 30)));
    }
}
