package com.haven.common.event;

import java.time.Instant;

/**
 * auth-service reverted the account deletion after a participant failed.
 */
public record UserRestoredPayload(
        String userId,
        Instant restoredAt
) implements UserScopedPayload {
}
