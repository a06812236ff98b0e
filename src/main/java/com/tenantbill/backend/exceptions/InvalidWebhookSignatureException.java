package com.tenantbill.backend.exceptions;

import org.springframework.http.HttpStatus;

/**
 * Webhook rejected before parsing: the signature is missing or does not match the shared secret.
 */
public class InvalidWebhookSignatureException extends ApiException {

    public InvalidWebhookSignatureException() {
        super(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", "Invalid webhook signature.");
    }
}
