package com.flagship.debt_payoff.override;

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
 * JPA entity for a schedule override. At most one per month.
 */
@Entity
@Table(name = "schedule_overrides")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduleOverrideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "month_index", nullable = false, unique = true, updatable = false)
    private int monthIndex;

    @Column(name = "additional_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal additionalAmount;

    static ScheduleOverrideEntity create(int monthIndex, BigDecimal additionalAmount) {
        return new ScheduleOverrideEntity(null, monthIndex, Money.quantize(additionalAmount));
    }

    public ScheduleOverride toDomain() {
        return new ScheduleOverride(monthIndex, additionalAmount);
    }

    void changeAmount(BigDecimal additionalAmount) {
        this.additionalAmount = Money.quantize(additionalAmount);
    }
}
