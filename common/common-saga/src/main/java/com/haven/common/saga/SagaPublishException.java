package com.haven.common.saga;

public class SagaPublishException extends RuntimeException {

    public SagaPublishException(String message) {
        super(message);
    }

    public SagaPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
