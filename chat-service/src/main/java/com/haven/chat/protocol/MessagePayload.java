package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.haven.chat.entity.ChatMessage;

import java.time.Instant;

/**
 * A chat message as clients see it, live ({@code receive_message}) or replayed ({@code chat_history}).
 * {@code connectionId} is only set on live messages.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessagePayload(
        String id,
        String userId,
        String username,
        String message,
        String roomId,
        Instant timestamp,
        String connectionId,
        String clientMessageId
) {

    public static MessagePayload from(ChatMessage message) {
        return new MessagePayload(String.valueOf(message.getId()), message.getUserId(), message.getUsername(),
                message.getContent(), message.getRoomId(), message.getCreatedAt(), null,
                message.getClientMessageId());
    }
}
