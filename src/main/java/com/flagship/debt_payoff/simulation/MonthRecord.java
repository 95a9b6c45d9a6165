package com.flagship.debt_payoff.simulation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One row of the payoff ledger.
 *
 * Per-debt maps are keyed by debt id and iterate in input debt order.
 * {@code snowballAmount} is the discretionary pool for the month, schedule
 * override included.
 */
@Value
@Builder
public class MonthRecord {
    int monthIndex;
    LocalDate date;
    String monthLabel;
    BigDecimal interestAccrued;
    BigDecimal snowballAmount;
    BigDecimal additionalAmount;
    Map<Long, BigDecimal> defaultPayments;
    Map<Long, BigDecimal> payments;
    Map<Long, BigDecimal> remainingBalances;
    List<String> warnings;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
