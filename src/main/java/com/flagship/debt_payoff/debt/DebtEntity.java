package com.flagship.debt_payoff.debt;

import com.flagship.debt_payoff.simulation.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA entity for a debt.
 *
 * No setters: changes go through {@link #updateFrom(DebtChanges)} and
 * {@link #moveTo(int)} so amounts are always stored in cents.
 * APR is stored as a double and converted to {@link BigDecimal} for the domain.
 */
@Entity
@Table(name = "debts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DebtEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String creditor;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal balance;

    @Column(nullable = false)
    private double apr;

    @Column(name = "minimum_payment", nullable = false, precision = 12, scale = 2)
    private BigDecimal minimumPayment;

    @Column(name = "custom_priority")
    private Integer customPriority;

    @Column(nullable = false)
    private int position;

    static DebtEntity create(String creditor, BigDecimal balance, double apr,
                             BigDecimal minimumPayment, Integer customPriority, int position) {
        return new DebtEntity(null, creditor, Money.quantize(balance), apr,
            Money.quantize(minimumPayment), customPriority, position);
    }

    public Debt toDomain() {
        return Debt.builder()
            .id(id)
            .creditor(creditor)
            .balance(balance)
            .apr(BigDecimal.valueOf(apr))
            .minimumPayment(minimumPayment)
            .customPriority(customPriority)
            .position(position)
            .build();
    }

    /**
     * Applies a partial update. Fields absent from the change set are left alone;
     * the custom priority can be cleared explicitly.
     */
    void updateFrom(DebtChanges changes) {
        if (changes.getCreditor() != null) {
            this.creditor = changes.getCreditor();
        }
        if (changes.getBalance() != null) {
            this.balance = Money.quantize(changes.getBalance());
        }
        if (changes.getApr() != null) {
            this.apr = changes.getApr();
        }
        if (changes.getMinimumPayment() != null) {
            this.minimumPayment = Money.quantize(changes.getMinimumPayment());
        }
        if (changes.isCustomPrioritySet()) {
            this.customPriority = changes.getCustomPriority();
        }
    }

    void moveTo(int position) {
        this.position = position;
    }
}
