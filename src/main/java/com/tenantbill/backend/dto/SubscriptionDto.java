package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tenantbill.backend.models.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Subscription wire form. Plan and status serialize as their lowercase codes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionDto {

    private Subscription.PlanType plan;
    private Subscription.SubscriptionStatus status;

    @JsonProperty("stripe_customer_id")
    private String stripeCustomerId;

    @JsonProperty("stripe_subscription_id")
    private String stripeSubscriptionId;

    @JsonProperty("current_period_end")
    private OffsetDateTime currentPeriodEnd;

    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;
}
