package com.haven.auth.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * User profile keyed by the identity provider's subject id.
 * Account deletion is a soft delete so the saga can compensate by clearing {@code deletedAt}.
 */
@Entity
@Table(name = "profiles", indexes = {
        @Index(name = "idx_profile_deleted_at", columnList = "deletedAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Profile {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    private String email;

    private String displayName;

    private String avatarUrl;

    @Column(length = 500)
    private String bio;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;

    @Builder
    public Profile(String id, String email, String displayName, String avatarUrl, String bio) {
        this.id = id;
        this.email = email;
        this.displayName = displayName;
        this.avatarUrl = avatarUrl;
        this.bio = bio;
    }

    public void update(String displayName, String avatarUrl, String bio) {
        if (displayName != null) this.displayName = displayName;
        if (avatarUrl != null) this.avatarUrl = avatarUrl;
        if (bio != null) this.bio = bio;
    }

    public void markDeleted(Instant at) {
        this.deletedAt = at;
    }

    public void restore() {
        this.deletedAt = null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Profile that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
