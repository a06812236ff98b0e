package com.tenantbill.backend.services.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantbill.backend.dto.WebhookResponse;
import com.tenantbill.backend.exceptions.InvalidWebhookSignatureException;
import com.tenantbill.backend.exceptions.MalformedWebhookException;
import com.tenantbill.backend.models.BillingEvent;
import com.tenantbill.backend.repositories.BillingEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Entry point for Stripe subscription webhooks.
 *
 * Order of checks: signature, JSON decode, idempotency key, ledger lookup. Only a key never seen
 * before reaches the reconciler. Not transactional: the write happens in {@link BillingEventRecorder}
 * and a unique-key race surfaces here after that transaction has rolled back.
 */
@Service
@Slf4j
public class StripeWebhookService {

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 200;
    static final int MAX_EVENT_TYPE_LENGTH = 120;
    static final String UNKNOWN_EVENT_TYPE = "unknown";

    private final WebhookSignatureVerifier signatureVerifier;
    private final BillingEventRecorder recorder;
    private final BillingEventRepository billingEventRepository;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public StripeWebhookService(WebhookSignatureVerifier signatureVerifier,
                                BillingEventRecorder recorder,
                                BillingEventRepository billingEventRepository,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry) {
        this.signatureVerifier = signatureVerifier;
        this.recorder = recorder;
        this.billingEventRepository = billingEventRepository;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    public WebhookResponse handle(byte[] rawBody, String signatureHeader, String eventIdHeader) {
        byte[] body = rawBody != null ? rawBody : new byte[0];

        if (!signatureVerifier.verify(body, signatureHeader)) {
            log.warn("Rejected webhook with invalid signature ({} bytes)", body.length);
            count("rejected");
            throw new InvalidWebhookSignatureException();
        }

        JsonNode event = parse(body);
        String idempotencyKey = resolveIdempotencyKey(eventIdHeader, event);
        String eventType = resolveEventType(event);

        Optional<BillingEvent> existing = billingEventRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            log.info("Event {} already processed, skipping", idempotencyKey);
            count("duplicate");
            return WebhookResponse.duplicate(idempotencyKey, existing.get().getEventType());
        }

        ReconcileResult result;
        try {
            result = recorder.applyAndRecord(idempotencyKey, eventType, event,
                    new String(body, StandardCharsets.UTF_8));
        } catch (DataIntegrityViolationException e) {
            // A concurrent delivery of the same key committed first
            Optional<BillingEvent> winner = billingEventRepository.findByIdempotencyKey(idempotencyKey);
            if (winner.isEmpty()) {
                throw e;
            }
            log.info("Event {} committed concurrently, answering duplicate", idempotencyKey);
            count("duplicate");
            return WebhookResponse.duplicate(idempotencyKey, winner.get().getEventType());
        }

        log.info("Processed webhook event {} ({}), subscription updated: {}",
                idempotencyKey, eventType, result.isUpdated());
        count("processed");
        return WebhookResponse.processed(idempotencyKey, result.isUpdated());
    }

    private JsonNode parse(byte[] body) {
        JsonNode event;
        try {
            event = objectMapper.readTree(body);
        } catch (IOException e) {
            count("rejected");
            throw new MalformedWebhookException("Invalid JSON payload.", e);
        }
        if (event == null || !event.isObject()) {
            count("rejected");
            throw new MalformedWebhookException("Invalid JSON payload.");
        }
        return event;
    }

    /**
     * Header wins over the payload id
     */
    private String resolveIdempotencyKey(String eventIdHeader, JsonNode event) {
        String key = eventIdHeader;
        if (key == null || key.isEmpty()) {
            JsonNode id = event.path("id");
            key = (id.isTextual() || id.isNumber()) ? id.asText() : null;
        }

        if (key == null || key.isEmpty()) {
            log.warn("Rejected webhook without event id");
            count("rejected");
            throw new MalformedWebhookException("Missing event id for idempotency.");
        }
        if (key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            count("rejected");
            throw new MalformedWebhookException("Event id exceeds " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters.");
        }
        return key;
    }

    private String resolveEventType(JsonNode event) {
        JsonNode type = event.path("type");
        if (!type.isTextual() || type.asText().isEmpty()) {
            return UNKNOWN_EVENT_TYPE;
        }
        String value = type.asText();
        return value.length() > MAX_EVENT_TYPE_LENGTH ? value.substring(0, MAX_EVENT_TYPE_LENGTH) : value;
    }

    private void count(String outcome) {
        Counter.builder("billing.webhooks")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
