package com.flagship.debt_payoff.override;

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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ScheduleOverrideServiceTest {

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
    private ScheduleOverrideService scheduleOverrideService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM schedule_overrides");
    }

    @Test
    @DisplayName("Setting a month twice keeps one override with the latest amount")
    void setOverrideUpserts() {
        scheduleOverrideService.setOverride(4, new BigDecimal("100"));
        scheduleOverrideService.setOverride(2, new BigDecimal("20.005"));
        scheduleOverrideService.setOverride(4, new BigDecimal("250.00"));

        List<ScheduleOverride> overrides = scheduleOverrideService.listOverrides();
        assertEquals(List.of(2, 4), overrides.stream().map(ScheduleOverride::getMonthIndex).toList());
        assertEquals("20.01", overrides.get(0).getAdditionalAmount().toPlainString());
        assertEquals("250.00", overrides.get(1).getAdditionalAmount().toPlainString());
    }

    @Test
    @DisplayName("A zero amount removes the month's override")
    void zeroRemovesOverride() {
        scheduleOverrideService.setOverride(1, new BigDecimal("50"));

        scheduleOverrideService.setOverride(1, BigDecimal.ZERO);
        scheduleOverrideService.setOverride(7, BigDecimal.ZERO);

        assertTrue(scheduleOverrideService.listOverrides().isEmpty());
    }

    @Test
    @DisplayName("Month below 1 and negative amounts are rejected")
    void invalidInputRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduleOverrideService.setOverride(0, new BigDecimal("10")));
        assertThrows(IllegalArgumentException.class,
            () -> scheduleOverrideService.setOverride(3, new BigDecimal("-0.01")));
    }
}
