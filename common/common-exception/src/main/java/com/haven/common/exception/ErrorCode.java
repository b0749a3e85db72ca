package com.haven.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error catalogue shared by all services.
 *
 * <p>Authentication failures deliberately collapse into {@link #INVALID_TOKEN} with a
 * generic message; the concrete reason (bad signature, expired, unknown key id) is only
 * ever logged.</p>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // ── Authentication / authorization ──
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid token"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "Access denied"),

    // ── Resilience ──
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open"),
    REQUEST_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Request timed out"),

    // ── Profile / account ──
    PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND, "Profile not found"),
    ACCOUNT_ALREADY_DELETED(HttpStatus.CONFLICT, "Account deletion already in progress"),

    // ── Community ──
    POST_NOT_FOUND(HttpStatus.NOT_FOUND, "Post not found"),

    // ── Chat ──
    MESSAGE_NOT_FOUND(HttpStatus.NOT_FOUND, "Message not found");

    private final HttpStatus status;
    private final String message;
}
