package com.flagship.debt_payoff.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

/**
 * Request DTO for reordering debts: ids listed in the desired entry order.
 */
@Value
public class ReorderDebtsRequest {

    @NotNull(message = "idsInOrder must be a list")
    @JsonProperty("idsInOrder")
    List<Long> idsInOrder;
}
