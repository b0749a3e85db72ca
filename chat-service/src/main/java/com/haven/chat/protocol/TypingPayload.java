package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TypingPayload(String userId, String username, @JsonProperty("isTyping") boolean typing) {
}
