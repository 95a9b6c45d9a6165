package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.DebtService;
import com.flagship.debt_payoff.override.PaymentOverrideService;
import com.flagship.debt_payoff.override.ScheduleOverrideService;
import com.flagship.debt_payoff.settings.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads the stored plan as one consistent snapshot.
 *
 * Not read-only: the first read of the settings may insert the default row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoredPlanLoader {

    private final SettingsService settingsService;
    private final DebtService debtService;
    private final ScheduleOverrideService scheduleOverrideService;
    private final PaymentOverrideService paymentOverrideService;

    @Transactional
    public StoredPlan load() {
        StoredPlan plan = new StoredPlan(
            settingsService.getSettings(),
            debtService.listDebts(),
            scheduleOverrideService.listOverrides(),
            paymentOverrideService.listOverrides()
        );
        log.debug("Loaded stored plan: debts={}, scheduleOverrides={}, paymentOverrides={}",
            plan.getDebts().size(), plan.getScheduleOverrides().size(), plan.getPaymentOverrides().size());
        return plan;
    }
}
