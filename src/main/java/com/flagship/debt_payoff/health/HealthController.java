package com.flagship.debt_payoff.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint for the planner.
 *
 * Reports DOWN (503) when the planner tables cannot be queried, which also
 * catches a database that is reachable but not migrated.
 */
@RestController
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());

        try {
            Long debtCount = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM debts", Long.class);
            response.put("status", "UP");
            response.put("database", "UP");
            response.put("debts", debtCount != null ? debtCount : 0L);
            return ResponseEntity.ok(response);
        } catch (DataAccessException e) {
            log.warn("Planner store unavailable: {}", e.getMostSpecificCause().getMessage());
            response.put("status", "DOWN");
            response.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
