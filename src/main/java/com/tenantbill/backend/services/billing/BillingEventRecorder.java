package com.tenantbill.backend.services.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenantbill.backend.models.BillingEvent;
import com.tenantbill.backend.repositories.BillingEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Applies a fresh event and appends it to the ledger in a single transaction.
 *
 * The ledger insert is flushed before commit, so a concurrent delivery of the same key
 * fails here with a DataIntegrityViolationException and the reconciliation is rolled back with it.
 */
@Service
@Slf4j
public class BillingEventRecorder {

    private final SubscriptionReconciler reconciler;
    private final BillingEventRepository billingEventRepository;
    private final Clock clock;

    public BillingEventRecorder(SubscriptionReconciler reconciler,
                                BillingEventRepository billingEventRepository,
                                Clock clock) {
        this.reconciler = reconciler;
        this.billingEventRepository = billingEventRepository;
        this.clock = clock;
    }

    @Transactional
    public ReconcileResult applyAndRecord(String idempotencyKey, String eventType, JsonNode event, String rawPayload) {
        ReconcileResult result = reconciler.reconcile(event);

        BillingEvent ledgerEntry = BillingEvent.builder()
                .idempotencyKey(idempotencyKey)
                .eventType(eventType)
                .organizationId(result.getOrganizationId())
                .payload(rawPayload)
                .receivedAt(OffsetDateTime.now(clock))
                .build();
        billingEventRepository.saveAndFlush(ledgerEntry);

        log.debug("Recorded billing event {} ({}) for organization {}",
                idempotencyKey, eventType, result.getOrganizationId());
        return result;
    }
}
