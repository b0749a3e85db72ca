package com.haven.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("business exception keeps its code status and detail")
    void businessException() {
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.ACCOUNT_ALREADY_DELETED));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getDetail()).isEqualTo(ErrorCode.ACCOUNT_ALREADY_DELETED.getMessage());
        assertThat(response.getBody().getType())
                .isEqualTo(URI.create("https://haven.dev/errors/account_already_deleted"));
        assertThat(response.getBody().getProperties()).containsEntry("code", "ACCOUNT_ALREADY_DELETED");
    }

    @Test
    @DisplayName("timeout maps to 504")
    void timeout() {
        ResponseEntity<ProblemDetail> response = handler.handleTimeout(new TimeoutException("slow"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(response.getBody().getProperties()).containsEntry("code", "REQUEST_TIMEOUT");
    }
}
