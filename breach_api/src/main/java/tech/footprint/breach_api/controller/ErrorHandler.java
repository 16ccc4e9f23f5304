package tech.footprint.breach_api.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.ResourceAccessException;
import tech.footprint.breach_api.service.BreachNotFoundException;

import java.util.Map;

/**
 * JSON error bodies with {@code code} and {@code error}. The content type is pinned because the
 * range endpoint produces plain text.
 */
@RestControllerAdvice
public class ErrorHandler {

    private static final Logger logger = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null && fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : "Invalid request";
        return json(HttpStatus.BAD_REQUEST, "INVALID_INPUT", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return json(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return json(HttpStatus.BAD_REQUEST, "INVALID_INPUT", ex.getMessage());
    }

    @ExceptionHandler(BreachNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(BreachNotFoundException ex) {
        return json(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(ResourceAccessException.class)
    public ResponseEntity<Map<String, Object>> handleUpstreamTimeout(ResourceAccessException ex) {
        logger.warn("Upstream password range service unreachable: {}", ex.getMessage());
        return json(HttpStatus.GATEWAY_TIMEOUT, "UPSTREAM_TIMEOUT", "The password range service timed out");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
        logger.error("Breach cache unavailable: {}", ex.getMessage(), ex);
        return json(HttpStatus.SERVICE_UNAVAILABLE, "SOURCE_UNAVAILABLE", "The breach cache is unavailable");
    }

    private static ResponseEntity<Map<String, Object>> json(HttpStatus status, String code, String error) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("code", code, "error", error));
    }
}
