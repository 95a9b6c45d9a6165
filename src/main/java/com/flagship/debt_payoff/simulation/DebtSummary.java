package com.flagship.debt_payoff.simulation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Per-debt outcome of a simulation.
 */
@Value
@Builder
public class DebtSummary {
    long id;
    String creditor;
    BigDecimal initialBalance;
    BigDecimal interestPaid;
    int monthsToPayoff;
    /** Null when the debt never closed within the run. */
    LocalDate payoffDate;
    String payoffMonthLabel;
}
