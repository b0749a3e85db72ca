package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageSentPayload(boolean success, String messageId, String clientMessageId) {
}
