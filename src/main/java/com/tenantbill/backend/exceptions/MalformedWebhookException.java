package com.tenantbill.backend.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Webhook body could not be decoded or carries no idempotency key.
 */
public class MalformedWebhookException extends ApiException {

    public MalformedWebhookException(String message) {
        super(HttpStatus.BAD_REQUEST, "MALFORMED_WEBHOOK", message);
    }

    public MalformedWebhookException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "MALFORMED_WEBHOOK", message, cause);
    }
}
