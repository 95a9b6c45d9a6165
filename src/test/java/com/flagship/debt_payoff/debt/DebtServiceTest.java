package com.flagship.debt_payoff.debt;

import com.flagship.debt_payoff.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Debt storage tests against a real PostgreSQL schema.
 *
 * These tests verify:
 * - New debts are appended to the entry order
 * - Partial updates only touch the supplied fields
 * - Reordering skips unknown ids
 * - Missing debts are reported as not found
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class DebtServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("debt_payoff_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private DebtService debtService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM payment_overrides");
        jdbcTemplate.update("DELETE FROM debts");
    }

    private Debt create(String creditor, String balance) {
        return debtService.createDebt(creditor, new BigDecimal(balance), 12.5, new BigDecimal("25"), null);
    }

    @Test
    @DisplayName("Created debts are stored with cent amounts and appended in entry order")
    void createAppendsToEntryOrder() {
        printTestHeader("Create debts");

        Debt first = create("Visa", "1500.5");
        Debt second = create("Car Loan", "8000");

        printOutput("First", first);
        printOutput("Second", second);

        assertNotNull(first.getId());
        assertEquals("1500.50", first.getBalance().toPlainString());
        assertEquals("25.00", first.getMinimumPayment().toPlainString());
        assertEquals(0, new BigDecimal("12.5").compareTo(first.getApr()));
        assertTrue(second.getPosition() > first.getPosition());

        List<Debt> debts = debtService.listDebts();
        assertEquals(List.of("Visa", "Car Loan"), debts.stream().map(Debt::getCreditor).toList());
        assertEquals(2, debtService.listDebtIds().size());
        printSuccess("Debts listed in entry order");
    }

    @Test
    @DisplayName("Partial update keeps absent fields and can clear the custom priority")
    void partialUpdate() {
        Debt debt = debtService.createDebt("Store Card", new BigDecimal("300.00"), 24.0,
            new BigDecimal("15.00"), 2);

        Debt renamed = debtService.updateDebt(debt.getId(), DebtChanges.builder()
            .creditor("Store Card (closed)")
            .build());

        assertEquals("Store Card (closed)", renamed.getCreditor());
        assertEquals("300.00", renamed.getBalance().toPlainString());
        assertEquals(Integer.valueOf(2), renamed.getCustomPriority());

        Debt cleared = debtService.updateDebt(debt.getId(), DebtChanges.builder()
            .balance(new BigDecimal("250.555"))
            .customPriority(null)
            .customPrioritySet(true)
            .build());

        assertEquals("250.56", cleared.getBalance().toPlainString());
        assertNull(cleared.getCustomPriority());
    }

    @Test
    @DisplayName("Reorder assigns positions in the given order and ignores unknown ids")
    void reorderIgnoresUnknownIds() {
        Debt a = create("A", "100");
        Debt b = create("B", "200");
        Debt c = create("C", "300");

        debtService.reorder(Arrays.asList(c.getId(), 999_999L, a.getId(), null, b.getId()));

        List<Debt> debts = debtService.listDebts();
        assertEquals(List.of("C", "A", "B"), debts.stream().map(Debt::getCreditor).toList());
        assertEquals(List.of(0, 2, 4), debts.stream().map(Debt::getPosition).toList());
    }

    @Test
    @DisplayName("Updating or deleting a missing debt fails with not found")
    void missingDebt() {
        ResourceNotFoundException update = assertThrows(ResourceNotFoundException.class,
            () -> debtService.updateDebt(424242L, DebtChanges.builder().creditor("x").build()));
        assertEquals("Debt not found: 424242", update.getMessage());

        assertThrows(ResourceNotFoundException.class, () -> debtService.deleteDebt(424242L));
    }

    @Test
    @DisplayName("Deleting a debt removes it from the list")
    void deleteDebt() {
        Debt debt = create("Medical", "450");

        debtService.deleteDebt(debt.getId());

        assertTrue(debtService.listDebts().isEmpty());
    }
}
