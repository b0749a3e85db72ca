package com.haven.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.gateway.config.DashboardProperties;
import com.haven.gateway.dto.PostSummary;
import com.haven.gateway.dto.ProfileSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Last good dashboard sub-results, served when a circuit falls back.
 *
 * <h3>Key layout</h3>
 * <pre>
 * dashboard:profile:{userId}  →  ProfileSummary JSON      (TTL haven.dashboard.cache-ttl)
 * dashboard:posts:{userId}    →  List&lt;PostSummary&gt; JSON
 * </pre>
 *
 * A cache failure never fails the dashboard: reads degrade to empty, writes are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardCache {

    private static final TypeReference<List<PostSummary>> POST_LIST = new TypeReference<>() {
    };

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final DashboardProperties properties;

    public Mono<ProfileSummary> getProfile(String userId) {
        return read(profileKey(userId)).flatMap(json -> decode(json, ProfileSummary.class));
    }

    public Mono<List<PostSummary>> getPosts(String userId) {
        return read(postsKey(userId)).flatMap(json -> decode(json, POST_LIST));
    }

    public Mono<Void> putProfile(String userId, ProfileSummary profile) {
        return write(profileKey(userId), profile);
    }

    public Mono<Void> putPosts(String userId, List<PostSummary> posts) {
        return write(postsKey(userId), posts);
    }

    static String profileKey(String userId) {
        return "dashboard:profile:" + userId;
    }

    static String postsKey(String userId) {
        return "dashboard:posts:" + userId;
    }

    private Mono<String> read(String key) {
        return redisTemplate.opsForValue().get(key)
                .onErrorResume(e -> {
                    log.warn("Dashboard cache read failed: key={}, error={}", key, e.toString());
                    return Mono.empty();
                });
    }

    private Mono<Void> write(String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Dashboard cache value not serializable: key={}", key, e);
            return Mono.empty();
        }
        return redisTemplate.opsForValue().set(key, json, properties.cacheTtl())
                .doOnNext(stored -> log.debug("Dashboard cache updated: key={}", key))
                .onErrorResume(e -> {
                    log.warn("Dashboard cache write failed: key={}, error={}", key, e.toString());
                    return Mono.empty();
                })
                .then();
    }

    private <T> Mono<T> decode(String json, Class<T> type) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, type))
                .onErrorResume(e -> {
                    log.warn("Dashboard cache entry unreadable: type={}", type.getSimpleName());
                    return Mono.empty();
                });
    }

    private <T> Mono<T> decode(String json, TypeReference<T> type) {
        return Mono.fromCallable(() -> objectMapper.readValue(json, type))
                .onErrorResume(e -> {
                    log.warn("Dashboard cache entry unreadable: type={}", type.getType());
                    return Mono.empty();
                });
    }
}
