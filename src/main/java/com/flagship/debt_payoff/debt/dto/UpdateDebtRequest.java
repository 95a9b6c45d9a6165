package com.flagship.debt_payoff.debt.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.debt.DebtChanges;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Request DTO for a partial debt update.
 *
 * Mutable so Jackson can tell an explicit {@code "customPriority": null}
 * (clear the priority) from an absent field (keep it).
 */
@Getter
@Setter
@NoArgsConstructor
public class UpdateDebtRequest {

    @Size(max = 100, message = "Creditor must be at most 100 characters")
    @JsonProperty("creditor")
    private String creditor;

    @DecimalMin(value = "0.00", message = "Balance must be >= 0")
    @JsonProperty("balance")
    private BigDecimal balance;

    @DecimalMin(value = "0", message = "APR must be >= 0")
    @JsonProperty("apr")
    private BigDecimal apr;

    @DecimalMin(value = "0.00", message = "Minimum payment must be >= 0")
    @JsonProperty("minimumPayment")
    private BigDecimal minimumPayment;

    @Setter(lombok.AccessLevel.NONE)
    private Integer customPriority;

    @JsonIgnore
    @Setter(lombok.AccessLevel.NONE)
    private boolean customPriorityPresent;

    @JsonProperty("customPriority")
    public void setCustomPriority(Integer customPriority) {
        this.customPriority = customPriority;
        this.customPriorityPresent = true;
    }

    public DebtChanges toChanges() {
        return DebtChanges.builder()
            .creditor(creditor)
            .balance(balance)
            .apr(apr != null ? apr.doubleValue() : null)
            .minimumPayment(minimumPayment)
            .customPriority(customPriority)
            .customPrioritySet(customPriorityPresent)
            .build();
    }
}
