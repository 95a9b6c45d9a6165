package com.flagship.debt_payoff.simulation;

import com.flagship.debt_payoff.debt.Debt;
import com.flagship.debt_payoff.observability.CorrelationContext;
import com.flagship.debt_payoff.override.PaymentOverride;
import com.flagship.debt_payoff.settings.PlannerSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for the simulation endpoint.
 *
 * These tests verify:
 * - Money is serialized as 2-decimal strings keyed by debt id
 * - Override warnings are only present on months that have them
 * - Engine failures map to 400 with the error code
 */
@WebMvcTest(SimulationController.class)
class SimulationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SimulationService simulationService;

    private final PayoffSimulator simulator = new PayoffSimulator();

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static PlannerSettings settings(String strategy, String budget) {
        return new PlannerSettings(LocalDate.of(2024, 1, 1), new BigDecimal(budget), strategy);
    }

    private static List<Debt> twoLoans() {
        return List.of(
            Debt.builder().id(1L).creditor("Loan A").balance(new BigDecimal("100.00"))
                .apr(new BigDecimal("12")).minimumPayment(new BigDecimal("50.00")).position(1).build(),
            Debt.builder().id(2L).creditor("Loan B").balance(new BigDecimal("200.00"))
                .apr(new BigDecimal("6")).minimumPayment(new BigDecimal("25.00")).position(2).build()
        );
    }

    @Test
    @DisplayName("GET /api/simulation renders the ledger with string money")
    void rendersLedger() throws Exception {
        printTestHeader("Render simulation ledger");
        when(simulationService.simulateStoredPlan())
            .thenReturn(simulator.simulate(settings("avalanche", "200.00"), twoLoans(), List.of()));

        MvcResult result = mockMvc.perform(get("/api/simulation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totals.totalInterest").value("2.51"))
            .andExpect(jsonPath("$.totals.totalMonths").value(2))
            .andExpect(jsonPath("$.totals.minPaymentsSum").value("75.00"))
            .andExpect(jsonPath("$.totals.minimumMonthlyPayment").value("75.00"))
            .andExpect(jsonPath("$.totals.initialSnowball").value("125.00"))
            .andExpect(jsonPath("$.months[0].monthLabel").value("Jan 2024"))
            .andExpect(jsonPath("$.months[0].dateISO").value("2024-01-01"))
            .andExpect(jsonPath("$.months[0].payments['1']").value("101.00"))
            .andExpect(jsonPath("$.months[0].payments['2']").value("99.00"))
            .andExpect(jsonPath("$.months[0].remainingBalances['2']").value("102.00"))
            .andExpect(jsonPath("$.months[1].payments['2']").value("102.51"))
            .andExpect(jsonPath("$.months[0].paymentOverrideWarnings").doesNotExist())
            .andExpect(jsonPath("$.debts[0].creditor").value("Loan A"))
            .andExpect(jsonPath("$.debts[0].payoffMonthLabel").value("Jan 2024"))
            .andExpect(jsonPath("$.debts[0].payoffDateISO").value("2024-01-01"))
            .andExpect(jsonPath("$.debts[1].payoffDateISO").value("2024-02-01"))
            .andExpect(jsonPath("$.debts[1].interestPaid").value("1.51"))
            .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Months with override warnings carry them in paymentOverrideWarnings")
    void rendersOverrideWarnings() throws Exception {
        when(simulationService.simulateStoredPlan())
            .thenReturn(simulator.simulate(settings("avalanche", "200.00"), twoLoans(), List.of(),
                List.of(PaymentOverride.of(1, 1L, new BigDecimal("150.00")))));

        mockMvc.perform(get("/api/simulation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.months[0].paymentOverrideWarnings[0]")
                .value("Override for debt 1 capped at remaining balance."))
            .andExpect(jsonPath("$.months[0].defaultPayments['1']").value("101.00"))
            .andExpect(jsonPath("$.months[1].paymentOverrideWarnings").doesNotExist());
    }

    @Test
    @DisplayName("An empty plan renders zero totals")
    void rendersEmptyPlan() throws Exception {
        when(simulationService.simulateStoredPlan()).thenReturn(SimulationResult.empty());

        mockMvc.perform(get("/api/simulation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.months").isEmpty())
            .andExpect(jsonPath("$.debts").isEmpty())
            .andExpect(jsonPath("$.totals.totalMonths").value(0))
            .andExpect(jsonPath("$.totals.totalInterest").value("0.00"));
    }

    @Test
    @DisplayName("Insufficient budget maps to 400 with the error code")
    void insufficientBudgetIsBadRequest() throws Exception {
        when(simulationService.simulateStoredPlan()).thenThrow(SimulationException.insufficientBudget());

        mockMvc.perform(get("/api/simulation").header(CorrelationContext.CORRELATION_ID_HEADER, "req-7"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_BUDGET"))
            .andExpect(jsonPath("$.correlationId").value("req-7"))
            .andExpect(jsonPath("$.message")
                .value("Monthly budget is less than sum of minimum payments. Increase the budget."));
    }

    @Test
    @DisplayName("Exceeded duration maps to 400 with the error code")
    void exceededDurationIsBadRequest() throws Exception {
        when(simulationService.simulateStoredPlan())
            .thenThrow(SimulationException.exceededMaxDuration(PayoffSimulator.MAX_MONTHS));

        mockMvc.perform(get("/api/simulation"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("EXCEEDED_MAX_DURATION"))
            .andExpect(jsonPath("$.message").value("Simulation exceeded 600 months. Check inputs."));
    }

    @Test
    @DisplayName("The correlation ID of the request is echoed on the response")
    void echoesCorrelationId() throws Exception {
        when(simulationService.simulateStoredPlan()).thenReturn(SimulationResult.empty());

        MvcResult result = mockMvc.perform(get("/api/simulation")
                .header(CorrelationContext.CORRELATION_ID_HEADER, "plan-42"))
            .andExpect(status().isOk())
            .andReturn();

        assertEquals("plan-42", result.getResponse().getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    @DisplayName("A correlation ID is generated when the request has none")
    void generatesCorrelationId() throws Exception {
        when(simulationService.simulateStoredPlan()).thenReturn(SimulationResult.empty());

        MvcResult result = mockMvc.perform(get("/api/simulation"))
            .andExpect(status().isOk())
            .andReturn();

        String generated = result.getResponse().getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }
}
