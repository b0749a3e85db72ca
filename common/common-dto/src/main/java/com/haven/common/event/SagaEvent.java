package com.haven.common.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope of every account-deletion saga message.
 *
 * <h3>Idempotency</h3>
 * {@code eventId} is a random UUID assigned once at creation and never changed on
 * re-publication. Subscribers use it as their idempotency key, so redelivery of the same
 * envelope is applied at most once per subscriber.
 *
 * <h3>Correlation</h3>
 * {@link #create} starts a new saga run (fresh correlation id unless one is supplied);
 * {@link #followUp} derives a reply that keeps the originating correlation id.
 *
 * @param <P> payload record bound to {@link #eventType()}
 */
public record SagaEvent<P extends UserScopedPayload>(
        String eventId,
        SagaEventType eventType,
        P payload,
        SagaMetadata metadata,
        Instant emittedAt
) {

    public SagaEvent {
        if (eventType != null && payload != null && !eventType.getPayloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not match event type " + eventType);
        }
    }

    public static <P extends UserScopedPayload> SagaEvent<P> create(
            SagaEventType eventType, P payload, String sourceService, String correlationId) {
        String correlation = correlationId != null ? correlationId : UUID.randomUUID().toString();
        return new SagaEvent<>(
                UUID.randomUUID().toString(),
                eventType,
                payload,
                SagaMetadata.of(correlation, sourceService),
                Instant.now());
    }

    public <R extends UserScopedPayload> SagaEvent<R> followUp(
            SagaEventType replyType, R replyPayload, String sourceService) {
        return create(replyType, replyPayload, sourceService, correlationId());
    }

    public String correlationId() {
        return metadata != null ? metadata.correlationId() : null;
    }

    public String userId() {
        return payload != null ? payload.userId() : null;
    }
}
