package com.haven.chat.protocol;

public record ConnectedPayload(String userId, String username, String message) {
}
