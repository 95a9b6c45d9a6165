package com.flagship.debt_payoff.simulation;

/**
 * Reasons a payoff simulation can be rejected.
 *
 * None of these are retryable: the engine is deterministic, so the caller
 * has to change the inputs.
 */
public enum SimulationErrorCode {
    /**
     * Strategy value is not one of avalanche, snowball, entered or custom.
     */
    UNKNOWN_STRATEGY,

    /**
     * Monthly budget does not cover the sum of minimum payments.
     * Raised before any month is simulated.
     */
    INSUFFICIENT_BUDGET,

    /**
     * Debts were still open after the maximum number of simulated months.
     */
    EXCEEDED_MAX_DURATION
}
