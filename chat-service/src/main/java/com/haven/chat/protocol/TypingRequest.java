package com.haven.chat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TypingRequest(String roomId, @JsonProperty("isTyping") boolean typing) {
}
