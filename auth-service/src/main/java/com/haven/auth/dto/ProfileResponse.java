package com.haven.auth.dto;

import com.haven.auth.entity.Profile;

import java.time.Instant;

public record ProfileResponse(
        String id,
        String email,
        String displayName,
        String avatarUrl,
        String bio,
        Instant createdAt
) {

    public static ProfileResponse from(Profile profile) {
        return new ProfileResponse(profile.getId(), profile.getEmail(), profile.getDisplayName(),
                profile.getAvatarUrl(), profile.getBio(), profile.getCreatedAt());
    }
}
