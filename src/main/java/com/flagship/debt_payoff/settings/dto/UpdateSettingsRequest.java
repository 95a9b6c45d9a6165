package com.flagship.debt_payoff.settings.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for a partial settings update. Absent fields are left unchanged.
 */
@Value
public class UpdateSettingsRequest {

    @JsonProperty("balanceDate")
    LocalDate balanceDate;

    @DecimalMin(value = "0.00", message = "Monthly budget must be >= 0")
    @JsonProperty("monthlyBudget")
    BigDecimal monthlyBudget;

    @JsonProperty("strategy")
    String strategy;
}
