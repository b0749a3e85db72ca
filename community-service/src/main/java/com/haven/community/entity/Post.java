package com.haven.community.entity;

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
 * Community post.
 *
 * <h3>Soft delete</h3>
 * <p>Posts are never removed physically. {@code deletedAt} hides them from every read;
 * when the account-deletion saga hides them it also records its correlation id, so a
 * compensation restores exactly the posts that run removed and leaves earlier
 * deletions alone.</p>
 */
@Entity
@Table(name = "posts", indexes = {
        @Index(name = "idx_post_author_created", columnList = "authorId, createdAt"),
        @Index(name = "idx_post_deletion_correlation", columnList = "deletionCorrelationId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "post_seq")
    @SequenceGenerator(name = "post_seq", sequenceName = "post_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, length = 64)
    private String authorId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(length = 50)
    private String category;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    private Instant deletedAt;

    @Column(length = 64)
    private String deletionCorrelationId;

    @Builder
    public Post(String authorId, String title, String content, String category) {
        this.authorId = authorId;
        this.title = title;
        this.content = content;
        this.category = category;
    }

    public void markDeleted(Instant at, String correlationId) {
        this.deletedAt = at;
        this.deletionCorrelationId = correlationId;
    }

    public void restore() {
        this.deletedAt = null;
        this.deletionCorrelationId = null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
