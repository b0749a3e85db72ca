package com.haven.common.exception;

import lombok.Getter;

/**
 * Unchecked domain failure carrying an {@link ErrorCode}.
 * Rendered by {@link GlobalExceptionHandler} as a ProblemDetail with the code's status.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }
}
