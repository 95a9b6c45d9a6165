package com.flagship.debt_payoff.settings;

import com.flagship.debt_payoff.simulation.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * JPA entity for the planner settings. There is exactly one row, with id {@value #SINGLETON_ID}.
 */
@Entity
@Table(name = "settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettingsEntity {

    static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Column(name = "balance_date", nullable = false)
    private LocalDate balanceDate;

    @Column(name = "monthly_budget", nullable = false, precision = 12, scale = 2)
    private BigDecimal monthlyBudget;

    @Column(nullable = false, length = 20)
    private String strategy;

    static SettingsEntity defaults(LocalDate balanceDate, BigDecimal monthlyBudget, String strategy) {
        return new SettingsEntity(SINGLETON_ID, balanceDate, Money.quantize(monthlyBudget), strategy);
    }

    public PlannerSettings toDomain() {
        return new PlannerSettings(balanceDate, monthlyBudget, strategy);
    }

    void changeBalanceDate(LocalDate balanceDate) {
        this.balanceDate = balanceDate;
    }

    void changeMonthlyBudget(BigDecimal monthlyBudget) {
        this.monthlyBudget = Money.quantize(monthlyBudget);
    }

    void changeStrategy(String strategy) {
        this.strategy = strategy;
    }
}
