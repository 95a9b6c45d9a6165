package com.flagship.debt_payoff.settings;

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
import java.time.Clock;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Planner settings tests.
 *
 * These tests verify:
 * - Defaults are created on first read from configuration
 * - Updates are partial and strategies are validated
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SettingsServiceTest {

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
        registry.add("planner.defaults.strategy", () -> "snowball");
    }

    @Autowired
    private SettingsService settingsService;

    @Autowired
    private Clock clock;

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

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM settings");
    }

    @Test
    @DisplayName("First read creates the settings row from configured defaults")
    void defaultsOnFirstRead() {
        printTestHeader("Default settings");

        PlannerSettings settings = settingsService.getSettings();

        printOutput("Settings", settings);
        assertEquals(LocalDate.now(clock), settings.getBalanceDate());
        assertEquals("0.00", settings.getMonthlyBudget().toPlainString());
        assertEquals("snowball", settings.getStrategy());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM settings", Integer.class));

        settingsService.getSettings();
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM settings", Integer.class));
    }

    @Test
    @DisplayName("Update changes only the supplied fields and rounds the budget to cents")
    void partialUpdate() {
        settingsService.updateSettings(LocalDate.of(2024, 1, 31), null, null);
        PlannerSettings updated = settingsService.updateSettings(null, new BigDecimal("1250.125"), "custom");

        assertEquals(LocalDate.of(2024, 1, 31), updated.getBalanceDate());
        assertEquals("1250.13", updated.getMonthlyBudget().toPlainString());
        assertEquals("custom", updated.getStrategy());
        assertEquals(updated, settingsService.getSettings());
    }

    @Test
    @DisplayName("Unknown strategy names are rejected without changing the settings")
    void invalidStrategy() {
        settingsService.updateSettings(null, null, "entered");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> settingsService.updateSettings(null, new BigDecimal("10"), "Avalanche"));

        assertEquals("Invalid strategy", e.getMessage());
        assertEquals("entered", settingsService.getSettings().getStrategy());
        assertEquals("0.00", settingsService.getSettings().getMonthlyBudget().toPlainString());
    }
}
