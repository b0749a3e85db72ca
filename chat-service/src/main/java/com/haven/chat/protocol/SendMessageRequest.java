package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendMessageRequest(String roomId, String message, String clientMessageId) {
}
