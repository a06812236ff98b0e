package com.tenantbill.backend.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Request passed bean validation but failed a semantic check (e.g. email format).
 */
public class InvalidRequestException extends ApiException {

    public InvalidRequestException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR", message);
    }
}
