package com.flagship.debt_payoff.debt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Debt domain object, as entered by the user.
 *
 * Immutable: the payoff engine derives its own running state from it.
 * A {@code null} custom priority sorts after every prioritised debt.
 */
@Value
@Builder(toBuilder = true)
public class Debt {
    Long id;
    String creditor;
    BigDecimal balance;
    /** Annual percentage rate in percent units, e.g. 18.5. */
    BigDecimal apr;
    BigDecimal minimumPayment;
    Integer customPriority;
    int position;
}
