package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.simulation.dto.SimulationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller running the payoff simulation over the stored plan.
 *
 * Engine failures surface as 400 responses through the global exception handler.
 */
@RestController
@RequestMapping("/api/simulation")
@RequiredArgsConstructor
public class SimulationController {

    private final SimulationService simulationService;

    @GetMapping
    public SimulationResponse simulate() {
        return SimulationResponse.from(simulationService.simulateStoredPlan());
    }
}
