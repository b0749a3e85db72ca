package com.haven.gateway.config;

import com.haven.gateway.filter.JwtAuthFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.test.StepVerifier;

import java.net.InetSocketAddress;

class RateLimitConfigTest {

    private final KeyResolver keyResolver = new RateLimitConfig().userKeyResolver();

    @Test
    @DisplayName("Authenticated requests are limited per user id")
    void userKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/posts")
                .header(JwtAuthFilter.USER_ID_HEADER, "user-9")
                .remoteAddress(new InetSocketAddress("10.0.0.7", 5000)));

        StepVerifier.create(keyResolver.resolve(exchange)).expectNext("user-9").verifyComplete();
    }

    @Test
    @DisplayName("Anonymous requests are limited per client IP")
    void ipKey() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/posts")
                .remoteAddress(new InetSocketAddress("10.0.0.7", 5000)));

        StepVerifier.create(keyResolver.resolve(exchange)).expectNext("10.0.0.7").verifyComplete();
    }
}
