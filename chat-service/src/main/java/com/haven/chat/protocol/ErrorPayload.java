package com.haven.chat.protocol;

public record ErrorPayload(String code, String message) {
}
