package com.haven.common.saga;

import com.haven.common.event.SagaEvent;
import com.haven.common.event.SagaEventType;
import com.haven.common.event.UserScopedPayload;

import java.util.Optional;

/**
 * One local step of the saga, bound to exactly one {@link SagaEventType}.
 *
 * <p>Implementations only describe the step. Idempotency, reply publication and
 * ack/nack decisions are made by {@link SagaEventDispatcher}.</p>
 *
 * @param <P> payload record of {@link #eventType()}
 */
public interface SagaEventHandler<P extends UserScopedPayload> {

    SagaEventType eventType();

    /**
     * Filters events of the right type that this participant does not care about,
     * e.g. a compensation that only reacts to another service's failure.
     */
    default boolean accepts(SagaEvent<P> event) {
        return true;
    }

    /**
     * Per-event part of the idempotency key. Defaults to the event id.
     */
    default String idempotencyKey(SagaEvent<P> event) {
        return event.eventId();
    }

    /**
     * Applies the local step. Throwing means the step failed.
     *
     * @return reply announcing success, if this step has one
     */
    Optional<SagaEvent<?>> handle(SagaEvent<P> event);

    /**
     * Reply announcing that the step failed, so peers can compensate.
     */
    default Optional<SagaEvent<?>> onFailure(SagaEvent<P> event, Exception cause) {
        return Optional.empty();
    }
}
