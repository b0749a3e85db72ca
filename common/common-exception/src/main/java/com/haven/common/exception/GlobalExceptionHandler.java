package com.haven.common.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Only annotation-based Spring APIs are used, so the same advice serves the servlet
 * services (auth, community) and the reactive ones (gateway, chat).</p>
 *
 * <pre>
 * BusinessException          → errorCode.status
 * CallNotPermittedException  → 503 (circuit open, no fallback registered)
 * TimeoutException           → 504
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String ERROR_TYPE_BASE = "https://haven.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Business exception: code={}, message={}", errorCode, e.getMessage(), e);
        } else {
            log.debug("Business exception: code={}, message={}", errorCode, e.getMessage());
        }
        return problem(errorCode.getStatus(), e.getMessage(), errorCode.name());
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE,
                ErrorCode.CIRCUIT_BREAKER_OPEN.getMessage(), ErrorCode.CIRCUIT_BREAKER_OPEN.name());
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TimeoutException e) {
        log.warn("Request timeout: {}", e.getMessage());
        return problem(HttpStatus.GATEWAY_TIMEOUT,
                ErrorCode.REQUEST_TIMEOUT.getMessage(), ErrorCode.REQUEST_TIMEOUT.name());
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String detail, String code) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + code.toLowerCase()));
        problem.setProperty("code", code);
        return ResponseEntity.status(status).body(problem);
    }
}
