package com.haven.auth.controller;

import com.haven.auth.dto.ProfileResponse;
import com.haven.auth.dto.UpdateProfileRequest;
import com.haven.auth.service.ProfileService;
import com.haven.common.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Profile reads and edits. Callers are identified by the {@code X-User-*} headers
 * set by the gateway after token validation.
 */
@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @GetMapping("/me")
    public ApiResponse<ProfileResponse> me(@RequestHeader("X-User-Id") String userId,
                                           @RequestHeader(value = "X-User-Email", required = false) String email) {
        if (email != null) {
            profileService.ensureProfile(userId, email);
        }
        return ApiResponse.ok(ProfileResponse.from(profileService.getProfile(userId)));
    }

    @PutMapping("/me")
    public ApiResponse<ProfileResponse> updateMe(@RequestHeader("X-User-Id") String userId,
                                                 @Valid @RequestBody UpdateProfileRequest request) {
        return ApiResponse.ok(ProfileResponse.from(profileService.updateProfile(userId, request)));
    }

    @GetMapping("/{userId}")
    public ApiResponse<ProfileResponse> getProfile(@PathVariable String userId) {
        return ApiResponse.ok(ProfileResponse.from(profileService.getProfile(userId)));
    }
}
