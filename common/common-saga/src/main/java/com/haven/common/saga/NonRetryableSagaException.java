package com.haven.common.saga;

/**
 * Failure that redelivery cannot fix (malformed message, compensation needing an operator).
 * The message is acknowledged instead of requeued.
 */
public class NonRetryableSagaException extends RuntimeException {

    public NonRetryableSagaException(String message) {
        super(message);
    }

    public NonRetryableSagaException(String message, Throwable cause) {
        super(message, cause);
    }
}
