package com.tenantbill.backend.dto;

import com.tenantbill.backend.models.Subscription;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Administrative plan override. Values outside the plan and status enums fail binding (422).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPatchRequest {

    @NotNull(message = "Plan is required")
    private Subscription.PlanType plan;

    // Omitted status means active
    @NotNull(message = "Status must not be null")
    private Subscription.SubscriptionStatus status = Subscription.SubscriptionStatus.ACTIVE;
}
