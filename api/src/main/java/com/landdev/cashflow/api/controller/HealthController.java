package com.landdev.cashflow.api.controller;

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public HealthController(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @GetMapping("/liveness")
    public ResponseEntity<Map<String, String>> liveness() {
        Map<String, String> response = new HashMap<>();
        response.put("status", "UP");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/readiness")
    public ResponseEntity<Map<String, Object>> readiness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");

        Map<String, String> circuitBreakers = new HashMap<>();
        circuitBreakerRegistry.getAllCircuitBreakers()
                .forEach(cb -> circuitBreakers.put(cb.getName(), cb.getState().name()));
        response.put("circuitBreakers", circuitBreakers);

        // Open breaker means the project data providers are failing
        if (circuitBreakers.containsValue("OPEN")) {
            response.put("status", "DEGRADED");
            response.put("message", "Project data providers unavailable");
        }

        return ResponseEntity.ok(response);
    }
}
