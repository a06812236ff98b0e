package com.tenantbill.backend.services.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenantbill.backend.models.Organization;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.repositories.OrganizationRepository;
import com.tenantbill.backend.services.SubscriptionService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

/**
 * Applies provider subscription lifecycle events to the local subscription record.
 *
 * Events are resolved to an organization through {@code data.object.metadata.organization_slug}.
 * Only fields present and normalizable in the event are written; everything else is left as stored.
 */
@Service
@Slf4j
public class SubscriptionReconciler {

    static final Set<String> SUBSCRIPTION_EVENT_TYPES = Set.of(
            "customer.subscription.created",
            "customer.subscription.updated",
            "customer.subscription.deleted"
    );

    private final OrganizationRepository organizationRepository;
    private final SubscriptionService subscriptionService;
    private final MeterRegistry meterRegistry;

    public SubscriptionReconciler(OrganizationRepository organizationRepository,
                                  SubscriptionService subscriptionService,
                                  MeterRegistry meterRegistry) {
        this.organizationRepository = organizationRepository;
        this.subscriptionService = subscriptionService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Reconcile one decoded event. Runs inside the caller's transaction.
     */
    @Transactional
    public ReconcileResult reconcile(JsonNode event) {
        String eventType = textOrNull(event.path("type"));
        if (eventType == null || !SUBSCRIPTION_EVENT_TYPES.contains(eventType)) {
            log.debug("Ignoring event type {}", eventType);
            return ReconcileResult.ignored();
        }

        JsonNode eventObject = event.path("data").path("object");
        JsonNode metadata = eventObject.path("metadata");

        JsonNode slugNode = metadata.path("organization_slug");
        if (!slugNode.isTextual() || slugNode.asText().isEmpty()) {
            log.debug("Event {} carries no organization_slug", eventType);
            return ReconcileResult.ignored();
        }

        Optional<Organization> organization = organizationRepository.findBySlug(slugNode.asText());
        if (organization.isEmpty()) {
            log.warn("Event {} references unknown organization '{}'", eventType, slugNode.asText());
            return ReconcileResult.ignored();
        }

        Long organizationId = organization.get().getId();
        Subscription subscription = subscriptionService.getOrCreateSubscription(organizationId);

        SubscriptionUpdate update = extractUpdate(eventObject, metadata);
        boolean changed = update.applyTo(subscription);

        log.info("Reconciled {} for organization {} (plan={}, status={}, changed={})",
                eventType, organizationId, subscription.getPlan().getCode(),
                subscription.getStatus().getCode(), changed);

        Counter.builder("billing.subscription.reconciled")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();

        return ReconcileResult.updated(organizationId);
    }

    SubscriptionUpdate extractUpdate(JsonNode eventObject, JsonNode metadata) {
        String rawPlan = firstNonBlank(
                textOrNull(eventObject.path("plan").path("nickname")),
                textOrNull(metadata.path("plan")),
                textOrNull(eventObject.path("plan_name")));

        SubscriptionUpdate.SubscriptionUpdateBuilder builder = SubscriptionUpdate.builder()
                .plan(EventNormalizer.normalizePlan(rawPlan).orElse(null))
                .status(EventNormalizer.normalizeStatus(textOrNull(eventObject.path("status"))).orElse(null))
                .stripeCustomerId(textOrNull(eventObject.path("customer")))
                .stripeSubscriptionId(textOrNull(eventObject.path("id")));

        JsonNode periodEnd = eventObject.path("current_period_end");
        if (periodEnd.isIntegralNumber() && periodEnd.canConvertToLong()) {
            try {
                builder.currentPeriodEnd(OffsetDateTime.ofInstant(
                        Instant.ofEpochSecond(periodEnd.asLong()), ZoneOffset.UTC));
            } catch (DateTimeException e) {
                log.warn("Ignoring out-of-range current_period_end {}", periodEnd.asLong());
            }
        }

        return builder.build();
    }

    /**
     * Scalar value as text; null for missing, null, empty, object and array nodes
     */
    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
