package com.flagship.debt_payoff.override.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.debt_payoff.override.ScheduleOverride;
import com.flagship.debt_payoff.simulation.Money;
import lombok.Value;

/**
 * Response DTO for a schedule override.
 */
@Value
public class ScheduleOverrideResponse {

    @JsonProperty("monthIndex")
    int monthIndex;

    @JsonProperty("additionalAmount")
    String additionalAmount;

    public static ScheduleOverrideResponse from(ScheduleOverride override) {
        return new ScheduleOverrideResponse(override.getMonthIndex(), Money.format(override.getAdditionalAmount()));
    }
}
