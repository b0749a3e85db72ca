package com.haven.chat.repository;

import com.haven.chat.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    List<ChatMessage> findByRoomIdAndDeletedAtIsNullOrderByCreatedAtDesc(String roomId, Pageable pageable);

    /**
     * Only rows not yet anonymized are touched, so a repeated call changes nothing.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ChatMessage m SET m.originalUserId = m.userId, m.originalUsername = m.username, " +
            "m.username = :anonymizedName, m.anonymizedAt = :anonymizedAt " +
            "WHERE m.userId = :userId AND m.anonymizedAt IS NULL")
    int anonymizeByUserId(@Param("userId") String userId,
                          @Param("anonymizedName") String anonymizedName,
                          @Param("anonymizedAt") Instant anonymizedAt);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ChatMessage m SET m.username = m.originalUsername, m.anonymizedAt = NULL, " +
            "m.originalUserId = NULL, m.originalUsername = NULL " +
            "WHERE m.originalUserId = :userId AND m.anonymizedAt IS NOT NULL")
    int restoreByUserId(@Param("userId") String userId);
}
