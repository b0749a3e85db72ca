package com.haven.community.repository;

import com.haven.community.entity.Post;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PostRepository extends JpaRepository<Post, Long> {

    Optional<Post> findByIdAndDeletedAtIsNull(Long id);

    List<Post> findByDeletedAtIsNullOrderByCreatedAtDesc(Pageable pageable);

    List<Post> findByAuthorIdAndDeletedAtIsNullOrderByCreatedAtDesc(String authorId, Pageable pageable);

    /**
     * Bulk soft delete. Already-deleted posts keep their original timestamp and marker.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Post p SET p.deletedAt = :deletedAt, p.deletionCorrelationId = :correlationId " +
            "WHERE p.authorId = :authorId AND p.deletedAt IS NULL")
    int softDeleteByAuthor(@Param("authorId") String authorId,
                           @Param("deletedAt") Instant deletedAt,
                           @Param("correlationId") String correlationId);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Post p SET p.deletedAt = NULL, p.deletionCorrelationId = NULL " +
            "WHERE p.authorId = :authorId AND p.deletionCorrelationId = :correlationId")
    int restoreByAuthor(@Param("authorId") String authorId,
                        @Param("correlationId") String correlationId);
}
