package com.haven.common.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Default breaker settings ({@code haven.circuit-breaker.*}).
 */
@ConfigurationProperties(prefix = "haven.circuit-breaker")
public record CircuitBreakerProperties(
        @DefaultValue("5s") Duration timeout,
        @DefaultValue("50") int errorThresholdPercentage,
        @DefaultValue("5") int volumeThreshold,
        @DefaultValue("30s") Duration resetTimeout
) {

    public CircuitOptions toOptions() {
        return new CircuitOptions(timeout, errorThresholdPercentage, volumeThreshold, resetTimeout);
    }
}
