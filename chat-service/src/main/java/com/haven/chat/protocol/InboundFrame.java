package com.haven.chat.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client frame: {@code {"event": "...", "data": {...}}}.
 */
public record InboundFrame(String event, JsonNode data) {
}
