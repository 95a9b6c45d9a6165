package com.flagship.debt_payoff.override;

import com.flagship.debt_payoff.simulation.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA entity for a payment override, unique per (month, debt).
 *
 * The debt reference is a plain id column; the foreign key in the schema
 * deletes overrides together with their debt.
 */
@Entity
@Table(
    name = "payment_overrides",
    uniqueConstraints = @UniqueConstraint(
        name = "uix_payment_override_month_debt",
        columnNames = {"month_index", "debt_id"}
    )
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentOverrideEntity {

    static final int MAX_NOTE_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "month_index", nullable = false, updatable = false)
    private int monthIndex;

    @Column(name = "debt_id", nullable = false, updatable = false)
    private long debtId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(length = MAX_NOTE_LENGTH)
    private String note;

    static PaymentOverrideEntity create(int monthIndex, long debtId, BigDecimal amount, String note) {
        return new PaymentOverrideEntity(null, monthIndex, debtId, Money.quantize(amount), truncate(note));
    }

    public PaymentOverride toDomain() {
        return new PaymentOverride(id, monthIndex, debtId, amount, note);
    }

    void change(BigDecimal amount, String note) {
        this.amount = Money.quantize(amount);
        this.note = truncate(note);
    }

    private static String truncate(String note) {
        if (note == null || note.length() <= MAX_NOTE_LENGTH) {
            return note;
        }
        return note.substring(0, MAX_NOTE_LENGTH);
    }
}
