package com.haven.common.saga;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;

/**
 * Redis-backed processed-event marks.
 *
 * <h3>Key layout</h3>
 * <pre>
 * idempotency:{serviceName}:{handlerKey}  →  processing start time   (TTL haven.saga.idempotency-ttl)
 * </pre>
 *
 * {@link #tryAcquire} is a single {@code SET NX EX}, so two consumers racing on the same
 * redelivered event cannot both win. The mark is removed again when the step fails,
 * so the requeued delivery is actually retried.
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotencyStore {

    static final String KEY_PREFIX = "idempotency:";

    private final StringRedisTemplate redisTemplate;
    private final SagaProperties properties;

    /**
     * @return {@code true} if this caller claimed the key, {@code false} if it was already processed
     */
    public boolean tryAcquire(String handlerKey) {
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(key(handlerKey), Instant.now().toString(), properties.idempotencyTtl());
        return Boolean.TRUE.equals(acquired);
    }

    public void release(String handlerKey) {
        redisTemplate.delete(key(handlerKey));
        log.debug("Idempotency mark removed: key={}", handlerKey);
    }

    public boolean isProcessed(String handlerKey) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(handlerKey)));
    }

    private String key(String handlerKey) {
        return KEY_PREFIX + properties.serviceName() + ":" + handlerKey;
    }
}
