package com.haven.common.event;

import java.time.Instant;

/**
 * community-service soft-deleted the user's posts.
 */
public record UserPostsDeletedPayload(
        String userId,
        long postCount,
        Instant deletedAt
) implements UserScopedPayload {
}
