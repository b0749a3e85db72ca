package com.haven.common.saga;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.Message;

import java.util.function.Consumer;

/**
 * Broker-facing end of the saga subscriber, registered as the {@code sagaEvents} function.
 *
 * <p>The Kafka binder runs with {@code ackMode: MANUAL}; the dispatcher's outcome is mapped onto
 * the record's {@link Acknowledgment}. A nack re-seeks the partition so the record is redelivered
 * after {@code haven.saga.nack-backoff}. Without a manual-ack header the requeue is signalled by
 * throwing, which makes the binder's error handling redeliver.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SagaEventListener implements Consumer<Message<String>> {

    private final SagaEventDispatcher dispatcher;
    private final SagaProperties properties;

    @Override
    public void accept(Message<String> message) {
        SagaOutcome outcome = dispatcher.dispatch(message.getPayload());
        Acknowledgment acknowledgment =
                message.getHeaders().get(KafkaHeaders.ACKNOWLEDGMENT, Acknowledgment.class);

        if (outcome == SagaOutcome.ACK) {
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
            return;
        }

        if (acknowledgment != null) {
            log.warn("Saga message nacked for redelivery: backoff={}", properties.nackBackoff());
            acknowledgment.nack(properties.nackBackoff());
            return;
        }
        throw new SagaRedeliveryException("Saga message requeued for redelivery");
    }

    static class SagaRedeliveryException extends RuntimeException {

        SagaRedeliveryException(String message) {
            super(message);
        }
    }
}
