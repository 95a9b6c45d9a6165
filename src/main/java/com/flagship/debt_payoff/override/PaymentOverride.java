package com.flagship.debt_payoff.override;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Fixed payment for one debt in one month, replacing the computed allocation.
 * The note is carried for display only.
 */
@Value
public class PaymentOverride {
    Long id;
    int monthIndex;
    long debtId;
    BigDecimal amount;
    String note;

    public static PaymentOverride of(int monthIndex, long debtId, BigDecimal amount) {
        return new PaymentOverride(null, monthIndex, debtId, amount, null);
    }
}
