package com.flagship.debt_payoff.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.settings.PlannerSettings;
import com.flagship.debt_payoff.simulation.Money;
import lombok.Value;

/**
 * Response DTO for the planner settings.
 */
@Value
public class SettingsResponse {

    @JsonProperty("balanceDate")
    String balanceDate;

    @JsonProperty("monthlyBudget")
    String monthlyBudget;

    @JsonProperty("strategy")
    String strategy;

    public static SettingsResponse from(PlannerSettings settings) {
        return new SettingsResponse(
            settings.getBalanceDate().toString(),
            Money.format(settings.getMonthlyBudget()),
            settings.getStrategy()
        );
    }
}
