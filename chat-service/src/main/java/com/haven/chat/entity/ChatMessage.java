package com.haven.chat.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted chat message. Rows are appended by the gateway and never removed:
 * moderation sets {@code deletedAt}, account deletion anonymizes in place.
 *
 * <pre>
 * anonymized:  username = "Deleted user", anonymizedAt = t,
 *              originalUserId / originalUsername keep what was there
 * restored:    username = originalUsername, the three markers cleared
 * </pre>
 */
@Entity
@Table(name = "chat_messages", indexes = {
        @Index(name = "idx_chat_room_created", columnList = "roomId, createdAt"),
        @Index(name = "idx_chat_user", columnList = "userId"),
        @Index(name = "idx_chat_original_user", columnList = "originalUserId")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ChatMessage {

    public static final String ANONYMIZED_USERNAME = "Deleted user";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "chat_message_seq")
    @SequenceGenerator(name = "chat_message_seq", sequenceName = "chat_message_seq", allocationSize = 50)
    private Long id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Column(length = 100)
    private String username;

    @Column(nullable = false, length = 100)
    private String roomId;

    @Column(nullable = false, length = 5000)
    private String content;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(length = 100)
    private String clientMessageId;

    private Instant deletedAt;

    private Instant anonymizedAt;

    @Column(length = 64)
    private String originalUserId;

    @Column(length = 100)
    private String originalUsername;

    @Builder
    public ChatMessage(String userId, String username, String roomId, String content,
                       Instant createdAt, String clientMessageId) {
        this.userId = userId;
        this.username = username;
        this.roomId = roomId;
        this.content = content;
        this.createdAt = createdAt;
        this.clientMessageId = clientMessageId;
    }

    public void markDeleted(Instant at) {
        this.deletedAt = at;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isAnonymized() {
        return anonymizedAt != null;
    }
}
