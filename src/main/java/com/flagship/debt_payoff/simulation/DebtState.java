package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.Debt;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Running state of one debt during a single simulation.
 *
 * Created fresh from a {@link Debt} at the start of every run and owned by
 * that run only. Never shared between runs.
 */
@Getter
final class DebtState {

    static final MathContext RATE_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);
    private static final BigDecimal PERCENT_MONTHS = BigDecimal.valueOf(1200);

    private final long id;
    private final String creditor;
    private final BigDecimal initialBalance;
    private final BigDecimal apr;
    private final BigDecimal monthlyRate;
    private final BigDecimal minimumPayment;
    private final Integer customPriority;
    private final int position;

    private BigDecimal balance;
    private BigDecimal interestPaid = Money.ZERO;
    private Integer payoffMonthIndex;

    private DebtState(Debt debt) {
        this.id = debt.getId();
        this.creditor = debt.getCreditor();
        this.initialBalance = Money.quantize(debt.getBalance());
        this.apr = debt.getApr() != null ? debt.getApr() : BigDecimal.ZERO;
        this.monthlyRate = this.apr.divide(PERCENT_MONTHS, RATE_CONTEXT);
        this.minimumPayment = Money.quantize(debt.getMinimumPayment());
        this.customPriority = debt.getCustomPriority();
        this.position = debt.getPosition();
        this.balance = this.initialBalance;
    }

    static DebtState from(Debt debt) {
        return new DebtState(debt);
    }

    boolean isOpen() {
        return Money.isPositive(balance);
    }

    boolean isClosed() {
        return payoffMonthIndex != null;
    }

    /**
     * Adds one month of interest to the balance.
     *
     * @return the interest charged, in cents
     */
    BigDecimal accrueInterest() {
        BigDecimal interest = Money.quantize(balance.multiply(monthlyRate, RATE_CONTEXT));
        if (interest.signum() != 0) {
            balance = Money.quantize(balance.add(interest));
            interestPaid = Money.quantize(interestPaid.add(interest));
        }
        return interest;
    }

    /**
     * Applies a payment against the current balance, never going below zero.
     */
    void pay(BigDecimal payment) {
        balance = Money.max(Money.quantize(balance.subtract(payment)), Money.ZERO);
    }

    /**
     * Replaces the provisional balance with the month's ceiling minus the final payment.
     */
    void settle(BigDecimal ceiling, BigDecimal finalPayment) {
        balance = ceiling;
        pay(finalPayment);
    }

    void close(int monthIndex) {
        if (payoffMonthIndex != null) {
            throw new IllegalStateException("Debt " + id + " already closed in month " + payoffMonthIndex);
        }
        payoffMonthIndex = monthIndex;
    }
}
