package com.flagship.debt_payoff.settings;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Planner settings domain object.
 *
 * The strategy is kept as its external name; the engine resolves it
 * when ordering is first requested.
 */
@Value
public class PlannerSettings {
    LocalDate balanceDate;
    BigDecimal monthlyBudget;
    String strategy;
}
