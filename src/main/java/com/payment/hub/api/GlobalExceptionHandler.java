package com.payment.hub.api;

import com.payment.hub.exception.DriverNotFoundException;
import com.payment.hub.exception.InvalidConfigurationException;
import com.payment.hub.exception.ProviderAggregateException;
import com.payment.hub.exception.WebhookAuthException;
import com.payment.hub.exception.WebhookQueueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the payment API. Returns consistent JSON
 * and appropriate status codes for validation, provider and runtime errors.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", getMessageOrCause(ex)));
    }

    @ExceptionHandler(DriverNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleDriverNotFound(DriverNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "PROVIDER_NOT_FOUND", "message", ex.getMessage()));
    }

    @ExceptionHandler(WebhookAuthException.class)
    public ResponseEntity<Map<String, String>> handleWebhookAuth(WebhookAuthException ex) {
        return ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("error", "INVALID_SIGNATURE", "message", ex.getMessage()));
    }

    @ExceptionHandler(WebhookQueueException.class)
    public ResponseEntity<Map<String, String>> handleWebhookQueue(WebhookQueueException ex) {
        log.error("Webhook could not be queued", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "WEBHOOK_QUEUE_FAILED",
                        "message", "Webhook received but queuing failed internally"));
    }

    @ExceptionHandler(ProviderAggregateException.class)
    public ResponseEntity<Map<String, Object>> handleAggregate(ProviderAggregateException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "ALL_PROVIDERS_FAILED", "message", ex.getMessage(), "errors", ex.getErrors()));
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(InvalidConfigurationException ex) {
        log.error("Provider misconfigured", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "CONFIGURATION_ERROR", "message", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        String message = getMessageOrCause(ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", message));
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
