package com.haven.auth.dto;

/**
 * @param correlationId shared by every event of the started saga, for tracing
 */
public record AccountDeletionResponse(String userId, String message, String correlationId) {
}
