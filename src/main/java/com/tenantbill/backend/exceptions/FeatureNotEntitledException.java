package com.tenantbill.backend.exceptions;

import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import org.springframework.http.HttpStatus;

/**
 * The organization's plan does not unlock the requested feature.
 */
public class FeatureNotEntitledException extends ApiException {

    private final Feature feature;
    private final Subscription.PlanType requiredPlan;

    public FeatureNotEntitledException(Feature feature) {
        super(HttpStatus.PAYMENT_REQUIRED, "PLAN_UPGRADE_REQUIRED",
                String.format("%s requires %s plan or higher.",
                        feature.getKey(), capitalize(feature.getMinimumPlan().getCode())));
        this.feature = feature;
        this.requiredPlan = feature.getMinimumPlan();
    }

    public Feature getFeature() {
        return feature;
    }

    public Subscription.PlanType getRequiredPlan() {
        return requiredPlan;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
