package com.tenantbill.backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 * Every error body has the shape {error, message, timestamp}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle domain exceptions - the exception carries its own status and code
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(ApiException ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("API error {}: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.debug("API error {}: {}", ex.getErrorCode(), ex.getMessage());
        }

        Map<String, Object> response = body(ex.getErrorCode(), ex.getMessage());
        if (ex instanceof FeatureNotEntitledException) {
            FeatureNotEntitledException denied = (FeatureNotEntitledException) ex;
            response.put("feature", denied.getFeature().getKey());
            response.put("required_plan", denied.getRequiredPlan().getCode());
        }

        return ResponseEntity
                .status(ex.getStatus())
                .body(response);
    }

    /**
     * Handle bean validation failures on request bodies - 422 with per-field messages
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }

        Map<String, Object> response = body("VALIDATION_ERROR", "Request validation failed.");
        response.put("fields", fieldErrors);

        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(response);
    }

    /**
     * Handle unreadable request bodies (bad JSON, enum values outside the catalog)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());

        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(body("VALIDATION_ERROR", "Request body is invalid."));
    }

    /**
     * Unique constraint hit that was not caught closer to the write
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(body("CONFLICT", "Request conflicts with existing data."));
    }

    /**
     * Handle generic exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // Framework errors (unknown route, wrong method, missing header) keep their own status
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            return ResponseEntity
                    .status(status)
                    .body(body("REQUEST_ERROR", ex.getMessage()));
        }

        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
        return response;
    }
}
