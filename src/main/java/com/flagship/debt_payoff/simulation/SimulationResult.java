package com.flagship.debt_payoff.simulation;

import lombok.Value;

import java.util.List;

/**
 * Full result of a payoff simulation: the monthly ledger, per-debt summaries
 * in initial strategy order, and aggregate totals.
 */
@Value
public class SimulationResult {
    List<MonthRecord> months;
    List<DebtSummary> debts;
    SimulationTotals totals;

    public static SimulationResult empty() {
        return new SimulationResult(List.of(), List.of(), SimulationTotals.EMPTY);
    }
}
