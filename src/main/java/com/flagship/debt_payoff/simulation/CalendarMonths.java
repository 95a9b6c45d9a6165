package com.flagship.debt_payoff.simulation;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Calendar month arithmetic for the payoff schedule.
 */
public final class CalendarMonths {

    private static final DateTimeFormatter LABEL_FORMAT =
            DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    private CalendarMonths() {
        // Utility class
    }

    /**
     * Returns the date {@code months} calendar months after {@code start}.
     * The day of month is clamped to the length of the target month,
     * so Jan 31 + 1 month is Feb 28 (or Feb 29 in a leap year).
     */
    public static LocalDate addMonths(LocalDate start, int months) {
        return start.plusMonths(months);
    }

    /**
     * Human readable month label, e.g. {@code "Jan 2024"}.
     */
    public static String label(LocalDate date) {
        return date.format(LABEL_FORMAT);
    }

    /**
     * Date of the given 1-based simulated month, always derived from the base date.
     */
    public static LocalDate monthDate(LocalDate balanceDate, int monthIndex) {
        return addMonths(balanceDate, monthIndex - 1);
    }
}
