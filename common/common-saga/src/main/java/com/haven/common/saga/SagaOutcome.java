package com.haven.common.saga;

/**
 * What the broker should do with a delivered saga message.
 */
public enum SagaOutcome {
    ACK,
    NACK_REQUEUE
}
