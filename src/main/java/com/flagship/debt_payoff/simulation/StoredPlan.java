package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.Debt;
import com.flagship.debt_payoff.override.PaymentOverride;
import com.flagship.debt_payoff.override.ScheduleOverride;
import com.flagship.debt_payoff.settings.PlannerSettings;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of everything the engine needs, read in one transaction.
 */
@Value
public class StoredPlan {
    PlannerSettings settings;
    List<Debt> debts;
    List<ScheduleOverride> scheduleOverrides;
    List<PaymentOverride> paymentOverrides;
}
