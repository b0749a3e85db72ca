package com.haven.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform JSON envelope for REST responses.
 *
 * <pre>
 * success: { "success": true,  "data": {...} }
 * accepted: { "success": true,  "data": {...}, "message": "Account deletion initiated" }
 * failure: { "success": false, "message": "..." }
 * </pre>
 *
 * Errors raised as {@code BusinessException} are rendered as RFC 7807 ProblemDetail instead,
 * so this envelope's failure form is only used by hand-written responses such as the
 * gateway's 401 and fallback bodies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    /** Success carrying a human-readable note, e.g. for asynchronous operations that were only started. */
    public static <T> ApiResponse<T> accepted(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
