package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.Debt;
import com.flagship.debt_payoff.observability.SimulationMetrics;
import com.flagship.debt_payoff.override.PaymentOverride;
import com.flagship.debt_payoff.override.ScheduleOverride;
import com.flagship.debt_payoff.settings.PlannerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads the stored plan and runs the payoff engine on it.
 *
 * Storage reads happen in one transaction that ends before the engine runs,
 * so a long simulation never holds a database connection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationService {

    private final StoredPlanLoader storedPlanLoader;
    private final PayoffSimulator payoffSimulator;
    private final SimulationMetrics simulationMetrics;

    public SimulationResult simulateStoredPlan() {
        StoredPlan plan = storedPlanLoader.load();
        return simulate(plan.getSettings(), plan.getDebts(), plan.getScheduleOverrides(), plan.getPaymentOverrides());
    }

    /**
     * Runs the engine and records metrics for the outcome.
     *
     * @throws SimulationException when the inputs cannot produce a schedule
     */
    public SimulationResult simulate(PlannerSettings settings,
                                     List<Debt> debts,
                                     List<ScheduleOverride> scheduleOverrides,
                                     List<PaymentOverride> paymentOverrides) {
        String strategy = settings.getStrategy();
        log.info("Running simulation: strategy={}, debts={}, scheduleOverrides={}, paymentOverrides={}",
            strategy, debts.size(), scheduleOverrides.size(), paymentOverrides.size());

        try {
            SimulationResult result = simulationMetrics.timeSimulation(() ->
                payoffSimulator.simulate(settings, debts, scheduleOverrides, paymentOverrides));

            simulationMetrics.recordRun(strategy, "success");
            simulationMetrics.recordMonthsSimulated(result.getTotals().getTotalMonths());
            simulationMetrics.recordOverrideWarnings(result.getMonths().stream().filter(MonthRecord::hasWarnings).count());

            log.info("Simulation completed: months={}, totalInterest={}",
                result.getTotals().getTotalMonths(), result.getTotals().getTotalInterest());
            return result;
        } catch (SimulationException e) {
            simulationMetrics.recordRun(strategy, e.getCode().name());
            log.warn("Simulation rejected: code={}, message={}", e.getCode(), e.getMessage());
            throw e;
        }
    }
}
