package com.haven.auth.repository;

import com.haven.auth.entity.Profile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProfileRepository extends JpaRepository<Profile, String> {

    Optional<Profile> findByIdAndDeletedAtIsNull(String id);
}
