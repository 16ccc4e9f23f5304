package tech.footprint.scan_api.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous rejections. The content type is pinned to JSON because scan requests
 * accept {@code text/event-stream}.
 */
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(ServerWebInputException ex) {
        String message = "Input is required";
        if (ex instanceof WebExchangeBindException bind) {
            FieldError fieldError = bind.getFieldError();
            if (fieldError != null && fieldError.getDefaultMessage() != null) {
                message = fieldError.getDefaultMessage();
            }
        }
        return json(HttpStatus.BAD_REQUEST, Map.of(
                "code", "INVALID_INPUT",
                "error", message
        ));
    }

    @ExceptionHandler(ScanRateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(ScanRateLimitedException ex) {
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfterMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                        "code", "RATE_LIMITED",
                        "error", ex.getMessage(),
                        "retry_after_ms", ex.getRetryAfterMillis()
                ));
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(TimeoutException ex) {
        return json(HttpStatus.GATEWAY_TIMEOUT, Map.of(
                "code", "UPSTREAM_TIMEOUT",
                "error", "An upstream service timed out",
                "retry_after_ms", 200
        ));
    }

    private static ResponseEntity<Map<String, Object>> json(HttpStatus status, Map<String, Object> body) {
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
