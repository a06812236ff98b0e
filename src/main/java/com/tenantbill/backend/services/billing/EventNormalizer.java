package com.tenantbill.backend.services.billing;

import com.tenantbill.backend.models.Subscription.PlanType;
import com.tenantbill.backend.models.Subscription.SubscriptionStatus;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Maps free-form plan names and provider statuses onto the canonical enums.
 * Empty means "cannot normalize": callers leave the corresponding field untouched.
 */
public final class EventNormalizer {

    // Provider statuses that mean the customer has lost entitlement
    private static final Set<String> CANCELED_ALIASES =
            Set.of("unpaid", "past_due", "incomplete", "incomplete_expired");

    private EventNormalizer() {
    }

    /**
     * Substring matches are checked in priority order before exact catalog membership,
     * so "Enterprise Annual" and "pro-monthly" both resolve.
     */
    public static Optional<PlanType> normalizePlan(String raw) {
        String value = clean(raw);
        if (value == null) {
            return Optional.empty();
        }

        if (value.contains("enterprise")) {
            return Optional.of(PlanType.ENTERPRISE);
        }
        if (value.contains("growth") || value.contains("pro")) {
            return Optional.of(PlanType.GROWTH);
        }
        if (value.contains("starter") || value.contains("basic")) {
            return Optional.of(PlanType.STARTER);
        }
        return PlanType.fromCode(value);
    }

    public static Optional<SubscriptionStatus> normalizeStatus(String raw) {
        String value = clean(raw);
        if (value == null) {
            return Optional.empty();
        }

        Optional<SubscriptionStatus> direct = SubscriptionStatus.fromCode(value);
        if (direct.isPresent()) {
            return direct;
        }
        if (CANCELED_ALIASES.contains(value)) {
            return Optional.of(SubscriptionStatus.CANCELED);
        }
        return Optional.empty();
    }

    private static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }
}
