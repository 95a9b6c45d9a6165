package com.flagship.debt_payoff.simulation;

import lombok.Getter;

/**
 * Validation failure raised by the payoff engine.
 * No partial result is ever returned alongside it.
 */
@Getter
public class SimulationException extends RuntimeException {

    private final SimulationErrorCode code;

    public SimulationException(SimulationErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static SimulationException unknownStrategy(String strategy) {
        return new SimulationException(SimulationErrorCode.UNKNOWN_STRATEGY,
                String.format("Unknown strategy '%s'", strategy));
    }

    public static SimulationException insufficientBudget() {
        return new SimulationException(SimulationErrorCode.INSUFFICIENT_BUDGET,
                "Monthly budget is less than sum of minimum payments. Increase the budget.");
    }

    public static SimulationException exceededMaxDuration(int maxMonths) {
        return new SimulationException(SimulationErrorCode.EXCEEDED_MAX_DURATION,
                String.format("Simulation exceeded %d months. Check inputs.", maxMonths));
    }
}
