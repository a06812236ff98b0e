package com.tenantbill.backend.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a write collides with an existing unique record
 * (organization slug, user email within an organization).
 */
public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, "CONFLICT", message);
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "CONFLICT", message, cause);
    }
}
