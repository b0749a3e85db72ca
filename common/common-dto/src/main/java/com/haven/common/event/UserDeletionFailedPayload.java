package com.haven.common.event;

/**
 * A participant could not apply its local step.
 * Peers that already applied theirs compensate based on {@link #failedStep()}.
 */
public record UserDeletionFailedPayload(
        String userId,
        SagaStep failedStep,
        String reason,
        String originalEventId
) implements UserScopedPayload {
}
