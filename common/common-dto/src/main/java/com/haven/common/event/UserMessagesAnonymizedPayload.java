package com.haven.common.event;

import java.time.Instant;

/**
 * chat-service finished anonymizing the user's messages.
 */
public record UserMessagesAnonymizedPayload(
        String userId,
        long messageCount,
        Instant anonymizedAt
) implements UserScopedPayload {
}
