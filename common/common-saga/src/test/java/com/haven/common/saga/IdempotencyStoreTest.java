package com.haven.common.saga;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class IdempotencyStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private final SagaProperties properties = new SagaProperties("community-service", Duration.ofHours(24), Duration.ofSeconds(1));

    @Test
    @DisplayName("Keys are namespaced by service and written with SET NX and the TTL")
    void tryAcquire_namespacedSetIfAbsent() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(eq("idempotency:community-service:user_deleted:e-1"), anyString(),
                eq(Duration.ofHours(24)))).willReturn(true, false);
        IdempotencyStore store = new IdempotencyStore(redisTemplate, properties);

        assertThat(store.tryAcquire("user_deleted:e-1")).isTrue();
        assertThat(store.tryAcquire("user_deleted:e-1")).isFalse();
    }

    @Test
    @DisplayName("A null reply from Redis (pipeline/transaction) is not treated as acquired")
    void tryAcquire_nullReply_false() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), eq(Duration.ofHours(24)))).willReturn(null);

        assertThat(new IdempotencyStore(redisTemplate, properties).tryAcquire("k")).isFalse();
    }

    @Test
    @DisplayName("Release deletes the namespaced key")
    void release_deletesKey() {
        IdempotencyStore store = new IdempotencyStore(redisTemplate, properties);

        store.release("user_deleted:e-1");

        verify(redisTemplate).delete("idempotency:community-service:user_deleted:e-1");
    }
}
