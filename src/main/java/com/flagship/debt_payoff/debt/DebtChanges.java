package com.flagship.debt_payoff.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Partial update for a debt. Null fields mean "unchanged".
 * {@code customPrioritySet} distinguishes clearing the priority from leaving it as is.
 */
@Value
@Builder
public class DebtChanges {
    String creditor;
    BigDecimal balance;
    Double apr;
    BigDecimal minimumPayment;
    Integer customPriority;
    boolean customPrioritySet;
}
