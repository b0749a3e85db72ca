package com.haven.chat.protocol;

import java.time.Instant;

/**
 * Body of {@code user_joined} and {@code user_left}.
 */
public record PresencePayload(String userId, String username, String message, Instant timestamp) {
}
