package com.haven.common.saga;

import com.haven.common.event.SagaEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;

/**
 * Sends saga events straight to their topic through {@link StreamBridge}.
 *
 * <p>Used for replies emitted while a delivery is being handled; the initiating
 * {@code user.deleted} goes through the transactional outbox instead.
 * The user id is the message key, so all events of one saga land on the same partition.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SagaEventPublisher {

    private final StreamBridge streamBridge;
    private final SagaEventCodec codec;

    public void publish(SagaEvent<?> event) {
        String destination = event.eventType().getTopic();
        Message<String> message = MessageBuilder
                .withPayload(codec.encode(event))
                .setHeader("kafka_messageKey", event.userId())
                .setHeader("eventType", destination)
                .build();

        boolean sent = streamBridge.send(destination, message);
        if (!sent) {
            throw new SagaPublishException("StreamBridge refused saga event: destination="
                    + destination + ", eventId=" + event.eventId());
        }
        log.info("Saga event published: type={}, eventId={}, userId={}, correlationId={}",
                destination, event.eventId(), event.userId(), event.correlationId());
    }
}
