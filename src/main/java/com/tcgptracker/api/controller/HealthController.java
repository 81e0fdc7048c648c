package com.tcgptracker.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check for load balancer probes.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health", description = "Load balancer health check")
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    @GetMapping({"/health", "/health/"})
    @Operation(summary = "Check application and database health")
    public ResponseEntity<Map<String, String>> health() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return ResponseEntity.ok(Map.of("status", "healthy", "database", "connected"));
        } catch (DataAccessException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("status", "unhealthy", "database", "disconnected"));
        }
    }
}
