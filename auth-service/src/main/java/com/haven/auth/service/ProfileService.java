package com.haven.auth.service;

import com.haven.auth.dto.UpdateProfileRequest;
import com.haven.auth.entity.Profile;
import com.haven.auth.repository.ProfileRepository;
import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProfileService {

    private final ProfileRepository profileRepository;

    public Profile getProfile(String userId) {
        return profileRepository.findByIdAndDeletedAtIsNull(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PROFILE_NOT_FOUND));
    }

    /**
     * Creates the profile on first sign-in; an existing one is returned unchanged.
     */
    @Transactional
    public Profile ensureProfile(String userId, String email) {
        return profileRepository.findById(userId).orElseGet(() -> {
            Profile created = profileRepository.save(Profile.builder().id(userId).email(email).build());
            log.info("Profile created: userId={}", userId);
            return created;
        });
    }

    @Transactional
    public Profile updateProfile(String userId, UpdateProfileRequest request) {
        Profile profile = getProfile(userId);
        profile.update(request.displayName(), request.avatarUrl(), request.bio());
        log.info("Profile updated: userId={}", userId);
        return profile;
    }

    /**
     * Clears the soft delete left by an aborted account deletion.
     *
     * @return the restored profile, or empty if it was not deleted
     */
    @Transactional
    public Optional<Profile> restoreProfile(String userId) {
        Profile profile = profileRepository.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PROFILE_NOT_FOUND,
                        "Profile not found for restore: " + userId));
        if (!profile.isDeleted()) {
            log.info("Profile already active, nothing to restore: userId={}", userId);
            return Optional.empty();
        }
        profile.restore();
        log.info("Profile restored: userId={}", userId);
        return Optional.of(profile);
    }
}
