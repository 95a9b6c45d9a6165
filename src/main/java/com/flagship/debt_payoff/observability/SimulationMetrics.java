package com.flagship.debt_payoff.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Metrics for payoff simulations.
 *
 * Metrics exposed:
 * - simulation.runs: Counter of runs, tagged by strategy and outcome
 * - simulation.duration: Timer for engine runs
 * - simulation.months: Distribution of simulated months per successful run
 * - simulation.override.warnings: Counter of months carrying override warnings
 */
@Component
public class SimulationMetrics {

    private final MeterRegistry registry;

    private final Timer simulationTimer;
    private final DistributionSummary monthsSimulated;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.simulationTimer = Timer.builder("simulation.duration")
                .description("Time taken to run a payoff simulation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.monthsSimulated = DistributionSummary.builder("simulation.months")
                .description("Number of months simulated until payoff")
                .register(registry);
    }

    /**
     * Records a simulation run with strategy and outcome tags.
     * Outcome is "success" or the lower-cased error code.
     */
    public void recordRun(String strategy, String outcome) {
        registry.counter("simulation.runs",
                "strategy", sanitizeTag(strategy),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordMonthsSimulated(int months) {
        monthsSimulated.record(months);
    }

    public void recordOverrideWarnings(long monthsWithWarnings) {
        if (monthsWithWarnings > 0) {
            registry.counter("simulation.override.warnings").increment(monthsWithWarnings);
        }
    }

    /**
     * Times a simulation run.
     */
    public <T> T timeSimulation(Supplier<T> operation) {
        return simulationTimer.record(operation);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
