package com.haven.common.security;

import com.haven.common.exception.BusinessException;
import com.haven.common.exception.ErrorCode;
import lombok.Getter;

/**
 * Uniform token rejection.
 *
 * <p>The client-facing message is always {@link ErrorCode#INVALID_TOKEN}'s generic text.
 * {@link #getReason()} keeps the concrete cause for logs only.</p>
 */
@Getter
public class InvalidTokenException extends BusinessException {

    private final String reason;

    public InvalidTokenException(String reason) {
        super(ErrorCode.INVALID_TOKEN);
        this.reason = reason;
    }

    public InvalidTokenException(String reason, Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, cause);
        this.reason = reason;
    }
}
