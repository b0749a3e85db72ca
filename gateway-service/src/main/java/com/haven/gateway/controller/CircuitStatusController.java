package com.haven.gateway.controller;

import com.haven.common.resilience.CircuitBreakerService;
import com.haven.common.resilience.CircuitSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class CircuitStatusController {

    private final CircuitBreakerService circuitBreakerService;

    @GetMapping("/circuits/status")
    public Map<String, CircuitSnapshot> status() {
        return circuitBreakerService.snapshots();
    }
}
