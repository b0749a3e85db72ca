package com.haven.common.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    static CircuitState of(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
