package com.flagship.debt_payoff.simulation;

import java.util.Locale;

/**
 * Payoff strategies understood by the engine.
 *
 * Strategies are persisted and transported by their lower-case name.
 */
public enum PayoffStrategy {
    /** Highest APR first. */
    AVALANCHE,
    /** Smallest balance first. */
    SNOWBALL,
    /** Order in which the debts were entered. */
    ENTERED,
    /** User supplied priority, lowest number first. */
    CUSTOM;

    public String externalName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static boolean isKnown(String name) {
        for (PayoffStrategy strategy : values()) {
            if (strategy.externalName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a strategy by its external name.
     *
     * @throws SimulationException with {@link SimulationErrorCode#UNKNOWN_STRATEGY} for any other value
     */
    public static PayoffStrategy fromName(String name) {
        for (PayoffStrategy strategy : values()) {
            if (strategy.externalName().equals(name)) {
                return strategy;
            }
        }
        throw SimulationException.unknownStrategy(name);
    }
}
