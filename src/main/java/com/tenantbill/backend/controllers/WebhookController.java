package com.tenantbill.backend.controllers;

import com.tenantbill.backend.dto.WebhookResponse;
import com.tenantbill.backend.services.billing.StripeWebhookService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Stripe subscription webhooks.
 *
 * IMPORTANT: This endpoint is excluded from bearer authentication in the security config;
 * deliveries authenticate by HMAC signature over the raw body.
 */
@RestController
@RequestMapping("/billing/webhooks")
@Slf4j
public class WebhookController {

    private final StripeWebhookService stripeWebhookService;

    public WebhookController(StripeWebhookService stripeWebhookService) {
        this.stripeWebhookService = stripeWebhookService;
    }

    @PostMapping("/stripe")
    public ResponseEntity<WebhookResponse> handleStripeWebhook(
            @RequestBody(required = false) byte[] payload,
            @RequestHeader(value = "X-Stripe-Signature", required = false) String signature,
            @RequestHeader(value = "X-Stripe-Event-Id", required = false) String eventId) {

        log.debug("Received Stripe webhook, payload size: {} bytes", payload != null ? payload.length : 0);
        return ResponseEntity.ok(stripeWebhookService.handle(payload, signature, eventId));
    }
}
