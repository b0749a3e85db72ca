package com.haven.gateway.config;

import com.haven.gateway.filter.JwtAuthFilter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.cloud.gateway.filter.ratelimit.RedisRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import reactor.core.publisher.Mono;

/**
 * Redis token-bucket rate limiting for proxied routes.
 *
 * <p>Authenticated requests are limited per user ({@code X-User-Id} set by {@link JwtAuthFilter});
 * anonymous ones per client IP.</p>
 */
@Configuration
public class RateLimitConfig {

    @Bean
    @Primary
    public RedisRateLimiter redisRateLimiter(
            @Value("${haven.rate-limit.replenish-rate:20}") int replenishRate,
            @Value("${haven.rate-limit.burst-capacity:40}") int burstCapacity) {
        return new RedisRateLimiter(replenishRate, burstCapacity);
    }

    @Bean
    public KeyResolver userKeyResolver() {
        return exchange -> {
            String userId = exchange.getRequest().getHeaders().getFirst(JwtAuthFilter.USER_ID_HEADER);
            if (userId != null) {
                return Mono.just(userId);
            }
            String ip = exchange.getRequest().getRemoteAddress() != null
                    ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress()
                    : "anonymous";
            return Mono.just(ip);
        };
    }
}
