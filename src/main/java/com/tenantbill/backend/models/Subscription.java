package com.tenantbill.backend.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Subscription entity - exactly one per organization.
 * Written by the webhook reconciler and by the administrative plan override.
 */
@Entity
@Table(name = "subscriptions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"organization"})
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id", nullable = false, unique = true)
    private Organization organization;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private PlanType plan = PlanType.STARTER;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.TRIALING;

    // Stripe references
    @Column(name = "stripe_customer_id")
    private String stripeCustomerId;

    @Column(name = "stripe_subscription_id")
    private String stripeSubscriptionId;

    @Column(name = "current_period_end")
    private OffsetDateTime currentPeriodEnd;

    // Audit fields
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public enum PlanType {
        STARTER("starter", 1),
        GROWTH("growth", 2),
        ENTERPRISE("enterprise", 3);

        private final String code;
        private final int rank;

        PlanType(String code, int rank) {
            this.code = code;
            this.rank = rank;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        public int getRank() {
            return rank;
        }

        /**
         * Exact lookup by wire code. Unknown or blank codes yield empty.
         */
        public static Optional<PlanType> fromCode(String code) {
            if (code == null) {
                return Optional.empty();
            }
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(plan -> plan.code.equals(normalized))
                    .findFirst();
        }

        // Jackson entry point for request bodies; unknown values fail binding
        @JsonCreator
        public static PlanType fromJson(String code) {
            return fromCode(code).orElseThrow(() ->
                    new IllegalArgumentException("Unknown plan: " + code));
        }
    }

    public enum SubscriptionStatus {
        TRIALING("trialing"),
        ACTIVE("active"),
        CANCELED("canceled");

        private final String code;

        SubscriptionStatus(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        public static Optional<SubscriptionStatus> fromCode(String code) {
            if (code == null) {
                return Optional.empty();
            }
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            return Arrays.stream(values())
                    .filter(status -> status.code.equals(normalized))
                    .findFirst();
        }

        @JsonCreator
        public static SubscriptionStatus fromJson(String code) {
            return fromCode(code).orElseThrow(() ->
                    new IllegalArgumentException("Unknown subscription status: " + code));
        }

        public boolean isActive() {
            return this == ACTIVE || this == TRIALING;
        }
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public Long getOrganizationId() {
        return organization != null ? organization.getId() : null;
    }
}
