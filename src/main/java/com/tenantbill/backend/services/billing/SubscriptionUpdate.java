package com.tenantbill.backend.services.billing;

import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.models.Subscription.PlanType;
import com.tenantbill.backend.models.Subscription.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Sparse set of subscription changes extracted from a provider event.
 * A null field means "not present in the event" and never overwrites stored state.
 */
@Value
@Builder
public class SubscriptionUpdate {

    PlanType plan;
    SubscriptionStatus status;
    String stripeCustomerId;
    String stripeSubscriptionId;
    OffsetDateTime currentPeriodEnd;

    /**
     * Merge present fields into the subscription.
     *
     * @return true if any stored value changed
     */
    public boolean applyTo(Subscription subscription) {
        boolean changed = false;

        if (plan != null && plan != subscription.getPlan()) {
            subscription.setPlan(plan);
            changed = true;
        }
        if (status != null && status != subscription.getStatus()) {
            subscription.setStatus(status);
            changed = true;
        }
        if (stripeCustomerId != null && !stripeCustomerId.equals(subscription.getStripeCustomerId())) {
            subscription.setStripeCustomerId(stripeCustomerId);
            changed = true;
        }
        if (stripeSubscriptionId != null && !stripeSubscriptionId.equals(subscription.getStripeSubscriptionId())) {
            subscription.setStripeSubscriptionId(stripeSubscriptionId);
            changed = true;
        }
        if (currentPeriodEnd != null && !samePeriodEnd(subscription.getCurrentPeriodEnd())) {
            subscription.setCurrentPeriodEnd(currentPeriodEnd);
            changed = true;
        }
        return changed;
    }

    private boolean samePeriodEnd(OffsetDateTime stored) {
        return stored != null && Objects.equals(stored.toInstant(), currentPeriodEnd.toInstant());
    }
}
