package com.haven.gateway.controller;

import com.haven.common.resilience.CircuitBreakerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Orchestrator probes. Readiness reports {@code degraded} while any dashboard circuit is open,
 * but stays 200 since the dashboard still answers from fallbacks.
 */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final CircuitBreakerService circuitBreakerService;

    @GetMapping
    public Map<String, Object> liveness() {
        return Map.of("status", "ok", "service", "gateway", "timestamp", Instant.now().toString());
    }

    @GetMapping("/ready")
    public Map<String, Object> readiness() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", circuitBreakerService.anyOpen() ? "degraded" : "ok");
        body.put("circuits", circuitBreakerService.snapshots());
        return body;
    }

    @GetMapping("/startup")
    public Map<String, Object> startup() {
        return Map.of("status", "ok");
    }
}
