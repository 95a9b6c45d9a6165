package com.flagship.debt_payoff.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for creating a debt.
 */
@Value
public class CreateDebtRequest {

    @NotBlank(message = "Creditor is required")
    @Size(max = 100, message = "Creditor must be at most 100 characters")
    @JsonProperty("creditor")
    String creditor;

    @NotNull(message = "Balance is required")
    @DecimalMin(value = "0.00", message = "Balance must be >= 0")
    @JsonProperty("balance")
    BigDecimal balance;

    @NotNull(message = "APR is required")
    @DecimalMin(value = "0", message = "APR must be >= 0")
    @JsonProperty("apr")
    BigDecimal apr;

    @NotNull(message = "Minimum payment is required")
    @DecimalMin(value = "0.00", message = "Minimum payment must be >= 0")
    @JsonProperty("minimumPayment")
    BigDecimal minimumPayment;

    @JsonProperty("customPriority")
    Integer customPriority;
}
