package com.haven.auth.dto;

import jakarta.validation.constraints.Size;
import org.hibernate.validator.constraints.URL;

public record UpdateProfileRequest(
        @Size(max = 100) String displayName,
        @URL @Size(max = 500) String avatarUrl,
        @Size(max = 500) String bio
) {
}
