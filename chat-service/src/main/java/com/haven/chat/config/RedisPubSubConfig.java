package com.haven.chat.config;

import com.haven.chat.backplane.BackplaneSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Subscribes this instance to the chat backplane channel.
 *
 * <p>The container is started by hand after startup so that Redis being down only leaves the
 * instance in single-instance mode instead of failing the context.</p>
 */
@Slf4j
@Configuration
public class RedisPubSubConfig {

    private static final long RECOVERY_INTERVAL_MS = 5000;

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            BackplaneSubscriber subscriber,
            ChatProperties properties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer() {
            @Override
            public boolean isAutoStartup() {
                return false;
            }
        };
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(subscriber, new ChannelTopic(properties.backplaneChannel()));
        container.setRecoveryInterval(RECOVERY_INTERVAL_MS);
        container.setErrorHandler(e -> log.warn("Backplane listener error: {}", e.toString()));
        return container;
    }

    @Bean
    public ApplicationRunner backplaneListenerStarter(RedisMessageListenerContainer container,
                                                      ChatProperties properties) {
        return args -> {
            try {
                container.start();
                log.info("Backplane listener started: channel={}, instanceId={}",
                        properties.backplaneChannel(), properties.instanceId());
            } catch (RuntimeException e) {
                log.warn("Backplane listener could not start, running single-instance: {}", e.toString());
            }
        };
    }
}
