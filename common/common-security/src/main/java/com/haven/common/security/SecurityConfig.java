package com.haven.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the token validator for services that authenticate callers themselves
 * (gateway-service for HTTP, chat-service for WebSocket handshakes).
 */
@Configuration
@EnableConfigurationProperties(SecurityProperties.class)
public class SecurityConfig {

    @Bean
    public JwksSource jwksSource(WebClient.Builder webClientBuilder, SecurityProperties properties) {
        return new WebClientJwksSource(webClientBuilder, properties.resolvedJwksUri());
    }

    @Bean
    public PublicKeySet publicKeySet(JwksSource jwksSource, SecurityProperties properties) {
        return new PublicKeySet(jwksSource, properties.jwksTtl(), properties.jwksTimeout(), Clock.systemUTC());
    }

    @Bean
    public TokenValidator tokenValidator(PublicKeySet publicKeySet, SecurityProperties properties,
                                         ObjectMapper objectMapper) {
        return new TokenValidator(publicKeySet, properties, objectMapper, Clock.systemUTC());
    }
}
