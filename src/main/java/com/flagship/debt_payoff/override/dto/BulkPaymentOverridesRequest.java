package com.flagship.debt_payoff.override.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.override.PaymentOverride;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO replacing all payment overrides of one month.
 */
@Value
public class BulkPaymentOverridesRequest {

    @NotNull(message = "monthIndex is required")
    @Min(value = 1, message = "monthIndex must be >= 1")
    @JsonProperty("monthIndex")
    Integer monthIndex;

    @JsonProperty("overrides")
    List<@Valid @NotNull Entry> overrides;

    public List<PaymentOverride> toDomain() {
        if (overrides == null) {
            return List.of();
        }
        return overrides.stream()
            .map(entry -> new PaymentOverride(null, monthIndex, entry.getDebtId(), entry.getAmount(), entry.getNote()))
            .toList();
    }

    /**
     * A single fixed payment for one debt.
     */
    @Value
    public static class Entry {

        @NotNull(message = "Each override requires debtId and amount")
        @Positive(message = "debtId must be > 0")
        @JsonProperty("debtId")
        Long debtId;

        @NotNull(message = "Each override requires debtId and amount")
        @DecimalMin(value = "0.00", message = "amount must be >= 0")
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("note")
        String note;
    }
}
