package com.flagship.debt_payoff.simulation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Aggregate totals of a simulation.
 */
@Value
public class SimulationTotals {

    public static final SimulationTotals EMPTY =
            new SimulationTotals(Money.ZERO, 0, Money.ZERO, Money.ZERO);

    BigDecimal totalInterest;
    int totalMonths;
    BigDecimal minPaymentsSum;
    /** Budget left after minimum payments in month 1, before freed minimums. */
    BigDecimal initialSnowball;

    public BigDecimal getMinimumMonthlyPayment() {
        return minPaymentsSum;
    }
}
