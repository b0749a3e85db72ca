package com.haven.common.saga;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.Message;

import java.util.List;
import java.util.function.Consumer;

/**
 * Saga participant wiring. Each service contributes its {@link SagaEventHandler} beans and
 * binds {@code sagaEvents-in-0} to the topics it listens on.
 */
@Configuration
@EnableConfigurationProperties(SagaProperties.class)
public class SagaConfig {

    @Bean
    public SagaEventCodec sagaEventCodec(ObjectMapper objectMapper) {
        return new SagaEventCodec(objectMapper);
    }

    @Bean
    public IdempotencyStore idempotencyStore(StringRedisTemplate redisTemplate, SagaProperties properties) {
        return new IdempotencyStore(redisTemplate, properties);
    }

    @Bean
    public SagaEventPublisher sagaEventPublisher(StreamBridge streamBridge, SagaEventCodec codec) {
        return new SagaEventPublisher(streamBridge, codec);
    }

    @Bean
    public SagaEventDispatcher sagaEventDispatcher(List<SagaEventHandler<?>> handlers,
                                                   IdempotencyStore idempotencyStore,
                                                   SagaEventPublisher publisher,
                                                   SagaEventCodec codec) {
        return new SagaEventDispatcher(handlers, idempotencyStore, publisher, codec);
    }

    @Bean
    public Consumer<Message<String>> sagaEvents(SagaEventDispatcher dispatcher, SagaProperties properties) {
        return new SagaEventListener(dispatcher, properties);
    }
}
