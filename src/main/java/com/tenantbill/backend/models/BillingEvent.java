package com.tenantbill.backend.models;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Append-only ledger of received billing webhooks.
 * A row with a given idempotency key means that delivery has already been applied.
 */
@Entity
@Table(name = "billing_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_billing_event_idempotency_key", columnNames = "idempotency_key"),
        indexes = {
                @Index(name = "ix_billing_events_organization_id", columnList = "organization_id"),
                @Index(name = "ix_billing_events_event_type", columnList = "event_type")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class BillingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 200)
    private String idempotencyKey;

    @Column(name = "event_type", nullable = false, updatable = false, length = 120)
    private String eventType;

    // Null when the event did not resolve to a known organization
    @Column(name = "organization_id", updatable = false)
    private Long organizationId;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "received_at", nullable = false, updatable = false)
    private OffsetDateTime receivedAt;
}
