package com.haven.common.resilience;

import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes breaker state, failure rate, call counts and time-limiter outcomes to Micrometer
 * ({@code resilience4j_circuitbreaker_*}, {@code resilience4j_timelimiter_*}), tagged by target name.
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(MeterRegistry meterRegistry, CircuitBreakerService circuitBreakerService) {
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerService.getCircuitBreakerRegistry())
                .bindTo(meterRegistry);
        TaggedTimeLimiterMetrics.ofTimeLimiterRegistry(circuitBreakerService.getTimeLimiterRegistry())
                .bindTo(meterRegistry);
    }
}
