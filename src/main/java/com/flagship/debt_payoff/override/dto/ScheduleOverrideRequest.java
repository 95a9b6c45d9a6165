package com.flagship.debt_payoff.override.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for setting a month's extra amount. A missing amount counts as zero.
 */
@Value
public class ScheduleOverrideRequest {

    @DecimalMin(value = "0.00", message = "additionalAmount must be >= 0")
    @JsonProperty("additionalAmount")
    BigDecimal additionalAmount;

    public BigDecimal additionalAmountOrZero() {
        return additionalAmount != null ? additionalAmount : BigDecimal.ZERO;
    }
}
