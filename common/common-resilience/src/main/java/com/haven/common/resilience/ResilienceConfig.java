package com.haven.common.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CircuitBreakerProperties.class)
public class ResilienceConfig {

    @Bean
    public CircuitBreakerService circuitBreakerService(CircuitBreakerProperties properties) {
        return new CircuitBreakerService(properties.toOptions(), Clock.systemUTC());
    }
}
