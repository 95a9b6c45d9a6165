package com.flagship.debt_payoff.override.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.override.PaymentOverride;
import com.flagship.debt_payoff.simulation.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for a payment override.
 */
@Value
@Builder
public class PaymentOverrideResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("monthIndex")
    int monthIndex;

    @JsonProperty("debtId")
    long debtId;

    @JsonProperty("amount")
    String amount;

    @JsonProperty("note")
    String note;

    public static PaymentOverrideResponse from(PaymentOverride override) {
        return PaymentOverrideResponse.builder()
            .id(override.getId())
            .monthIndex(override.getMonthIndex())
            .debtId(override.getDebtId())
            .amount(Money.format(override.getAmount()))
            .note(override.getNote())
            .build();
    }
}
