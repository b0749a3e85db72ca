package com.haven.gateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.cloud.gateway.filter.ratelimit.RedisRateLimiter;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.GatewayFilterSpec;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Proxy routes to the downstream services.
 *
 * <pre>
 *   /api/profiles/**, /api/account/**  → auth-service
 *   /account/**                         → auth-service, rewritten to /api/account/**
 *   /api/posts/**                       → community-service
 *   /api/chat/**                        → chat-service
 *   /ws/**                              → chat-service (WebSocket upgrade passed through)
 * </pre>
 *
 * HTTP routes carry a Spring Cloud CircuitBreaker filter falling back to {@code /fallback}
 * and the Redis token-bucket rate limiter. {@code /dashboard}, {@code /circuits/status} and
 * {@code /health/**} are served by this service's own controllers.
 */
@Configuration
@RequiredArgsConstructor
public class RouteConfig {

    private final ServiceEndpoints endpoints;
    private final RedisRateLimiter redisRateLimiter;
    private final KeyResolver userKeyResolver;

    @Bean
    public RouteLocator havenRoutes(RouteLocatorBuilder builder) {
        return builder.routes()
                .route("auth-service", r -> r
                        .path("/api/profiles/**", "/api/account/**")
                        .filters(f -> protect(f, "auth-service"))
                        .uri(endpoints.authUri()))
                .route("auth-service-account", r -> r
                        .path("/account", "/account/**")
                        .filters(f -> protect(f.rewritePath("/account(?<segment>/?.*)", "/api/account${segment}"),
                                "auth-service"))
                        .uri(endpoints.authUri()))
                .route("community-service", r -> r
                        .path("/api/posts/**")
                        .filters(f -> protect(f, "community-service"))
                        .uri(endpoints.communityUri()))
                .route("chat-service", r -> r
                        .path("/api/chat/**")
                        .filters(f -> protect(f, "chat-service"))
                        .uri(endpoints.chatUri()))
                .route("chat-service-ws", r -> r
                        .path("/ws/**")
                        .uri(endpoints.chatUri()))
                .build();
    }

    private GatewayFilterSpec protect(GatewayFilterSpec filters, String circuitName) {
        return filters
                .circuitBreaker(c -> c.setName(circuitName).setFallbackUri("forward:/fallback"))
                .requestRateLimiter(c -> c.setRateLimiter(redisRateLimiter).setKeyResolver(userKeyResolver));
    }
}
