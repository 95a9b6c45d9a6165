package com.flagship.debt_payoff.override;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One-time extra amount added to the shared payment pool of a single month.
 */
@Value
public class ScheduleOverride {
    /** 1-based simulated month. */
    int monthIndex;
    BigDecimal additionalAmount;
}
