package com.haven.chat.protocol;

/**
 * Server frame, serialized as {@code {"event": "...", "data": {...}}}.
 */
public record OutboundFrame(String event, Object data) {

    public static OutboundFrame of(ServerEvent event, Object data) {
        return new OutboundFrame(event.wireName(), data);
    }

    public static OutboundFrame error(String code, String message) {
        return of(ServerEvent.ERROR, new ErrorPayload(code, message));
    }
}
