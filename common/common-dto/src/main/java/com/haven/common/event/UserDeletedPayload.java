package com.haven.common.event;

import java.time.Instant;

/**
 * Saga start: the account was marked deleted by auth-service.
 */
public record UserDeletedPayload(
        String userId,
        String email,
        Instant deletedAt,
        String reason
) implements UserScopedPayload {
}
