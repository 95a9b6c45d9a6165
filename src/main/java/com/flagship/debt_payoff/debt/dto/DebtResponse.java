package com.flagship.debt_payoff.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.debt.Debt;
import com.flagship.debt_payoff.simulation.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for a debt. Money is rendered as 2-decimal strings.
 */
@Value
@Builder
public class DebtResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("creditor")
    String creditor;

    @JsonProperty("balance")
    String balance;

    @JsonProperty("apr")
    double apr;

    @JsonProperty("minimumPayment")
    String minimumPayment;

    @JsonProperty("customPriority")
    Integer customPriority;

    @JsonProperty("position")
    int position;

    public static DebtResponse from(Debt debt) {
        return DebtResponse.builder()
            .id(debt.getId())
            .creditor(debt.getCreditor())
            .balance(Money.format(debt.getBalance()))
            .apr(debt.getApr().doubleValue())
            .minimumPayment(Money.format(debt.getMinimumPayment()))
            .customPriority(debt.getCustomPriority())
            .position(debt.getPosition())
            .build();
    }
}
