package com.haven.chat.backplane;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haven.chat.config.ChatProperties;
import com.haven.chat.protocol.OutboundFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishing side of the cross-instance room fan-out.
 *
 * <p>Publication is fire-and-forget. When Redis rejects it the instance keeps serving its own
 * connections and logs once per outage; it recovers on the next successful publish.</p>
 */
@Slf4j
@Component
public class RedisBackplane {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ChatProperties properties;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public RedisBackplane(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                          ChatProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public void publish(String roomId, OutboundFrame frame, String excludeConnectionId) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new BackplaneEnvelope(properties.instanceId(), roomId,
                    excludeConnectionId, frame.event(), objectMapper.valueToTree(frame.data())));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Backplane envelope not serializable: roomId={}, event={}", roomId, frame.event(), e);
            return;
        }
        redisTemplate.convertAndSend(properties.backplaneChannel(), json)
                .subscribe(receivers -> {
                    if (degraded.compareAndSet(true, false)) {
                        log.info("Backplane publish recovered, cross-instance delivery restored");
                    }
                }, error -> {
                    if (degraded.compareAndSet(false, true)) {
                        log.warn("Backplane publish failed, delivering to local connections only: {}",
                                error.toString());
                    }
                });
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public String instanceId() {
        return properties.instanceId();
    }
}
