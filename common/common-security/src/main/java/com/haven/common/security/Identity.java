package com.haven.common.security;

import java.time.Instant;

/**
 * Normalized caller identity derived from a validated bearer token.
 * Built fresh per request or connection and never persisted.
 */
public record Identity(
        String subjectId,
        String email,
        String role,
        String displayName,
        String avatarUrl,
        Instant issuedAt,
        Instant expiresAt
) {

    public static final String DEFAULT_ROLE = "user";

    /**
     * Name shown to other users: display name, then email, then {@code fallback}.
     */
    public String preferredName(String fallback) {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        if (email != null && !email.isBlank()) {
            return email;
        }
        return fallback;
    }
}
