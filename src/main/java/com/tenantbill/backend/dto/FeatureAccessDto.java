package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureAccessDto {
    private Feature feature;
    private Subscription.PlanType plan;

    @JsonProperty("required_plan")
    private Subscription.PlanType requiredPlan;

    private boolean allowed;
}
