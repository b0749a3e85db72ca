package com.haven.common.saga;

import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.UserScopedPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes decoded saga events to their registered {@link SagaEventHandler} and decides ack/nack.
 *
 * <h3>Per delivery</h3>
 * <pre>
 * 1. decode            malformed / unknown type        → ACK (poison message, logged)
 * 2. handler lookup    none registered / not accepted  → ACK
 * 3. tryAcquire(key)   already processed               → ACK, no side effect
 *                      store unreachable               → NACK_REQUEUE
 * 4. handler.handle    success → publish reply         → ACK
 * 5. failure           publish failure reply, release key
 *                      → NACK_REQUEUE (ACK if NonRetryableSagaException)
 * </pre>
 *
 * A failed reply publication after a successful step releases the key and requeues
 * without announcing a failure, since the local step itself did succeed and is safe to repeat.
 */
@Slf4j
public class SagaEventDispatcher {

    private final Map<SagaEventType, SagaEventHandler<?>> handlers = new EnumMap<>(SagaEventType.class);
    private final IdempotencyStore idempotencyStore;
    private final SagaEventPublisher publisher;
    private final SagaEventCodec codec;

    public SagaEventDispatcher(List<SagaEventHandler<?>> registeredHandlers, IdempotencyStore idempotencyStore,
                               SagaEventPublisher publisher, SagaEventCodec codec) {
        this.idempotencyStore = idempotencyStore;
        this.publisher = publisher;
        this.codec = codec;
        for (SagaEventHandler<?> handler : registeredHandlers) {
            SagaEventHandler<?> previous = handlers.putIfAbsent(handler.eventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two saga handlers registered for " + handler.eventType()
                        + ": " + previous.getClass().getName() + ", " + handler.getClass().getName());
            }
        }
        log.info("Saga handlers registered: {}", handlers.keySet());
    }

    public Set<SagaEventType> registeredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public SagaOutcome dispatch(String json) {
        SagaEvent<UserScopedPayload> event;
        try {
            event = codec.decode(json);
        } catch (NonRetryableSagaException e) {
            log.error("Discarding unreadable saga message: {}", e.getMessage());
            return SagaOutcome.ACK;
        }
        return dispatch(event);
    }

    @SuppressWarnings("unchecked")
    public SagaOutcome dispatch(SagaEvent<? extends UserScopedPayload> incoming) {
        SagaEventHandler<UserScopedPayload> handler =
                (SagaEventHandler<UserScopedPayload>) handlers.get(incoming.eventType());
        if (handler == null) {
            log.debug("No saga handler, ignoring: type={}, eventId={}", incoming.eventType(), incoming.eventId());
            return SagaOutcome.ACK;
        }
        SagaEvent<UserScopedPayload> event = (SagaEvent<UserScopedPayload>) incoming;
        if (!handler.accepts(event)) {
            log.debug("Saga event not relevant here: type={}, eventId={}", event.eventType(), event.eventId());
            return SagaOutcome.ACK;
        }

        String key = event.eventType().name().toLowerCase() + ":" + handler.idempotencyKey(event);
        try {
            if (!idempotencyStore.tryAcquire(key)) {
                log.info("Duplicate event skipped: type={}, eventId={}", event.eventType(), event.eventId());
                return SagaOutcome.ACK;
            }
        } catch (RuntimeException e) {
            log.error("Idempotency store unavailable, requeueing: eventId={}", event.eventId(), e);
            return SagaOutcome.NACK_REQUEUE;
        }

        log.info("Processing {}: eventId={}, userId={}, correlationId={}",
                event.eventType(), event.eventId(), event.userId(), event.correlationId());

        Optional<SagaEvent<?>> reply;
        try {
            reply = handler.handle(event);
        } catch (Exception e) {
            return onStepFailure(handler, event, key, e);
        }

        try {
            reply.ifPresent(publisher::publish);
        } catch (RuntimeException e) {
            log.error("Saga reply could not be published, requeueing: eventId={}", event.eventId(), e);
            releaseQuietly(key, event);
            return SagaOutcome.NACK_REQUEUE;
        }
        return SagaOutcome.ACK;
    }

    private SagaOutcome onStepFailure(SagaEventHandler<UserScopedPayload> handler,
                                      SagaEvent<UserScopedPayload> event, String key, Exception cause) {
        log.error("Saga step failed: type={}, eventId={}, userId={}",
                event.eventType(), event.eventId(), event.userId(), cause);
        try {
            handler.onFailure(event, cause).ifPresent(publisher::publish);
        } catch (RuntimeException e) {
            log.error("Saga failure event could not be published: eventId={}", event.eventId(), e);
        }
        releaseQuietly(key, event);

        if (cause instanceof NonRetryableSagaException) {
            log.warn("Non-retryable saga failure acknowledged, manual intervention required: eventId={}, reason={}",
                    event.eventId(), cause.getMessage());
            return SagaOutcome.ACK;
        }
        return SagaOutcome.NACK_REQUEUE;
    }

    private void releaseQuietly(String key, SagaEvent<?> event) {
        try {
            idempotencyStore.release(key);
        } catch (RuntimeException e) {
            log.error("Idempotency mark could not be removed, retry will be skipped until it expires: eventId={}",
                    event.eventId(), e);
        }
    }
}
