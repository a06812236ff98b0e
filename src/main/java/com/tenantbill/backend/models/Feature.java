package com.tenantbill.backend.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Gated capabilities and the lowest plan that unlocks each of them.
 */
public enum Feature {
    TEAM_MANAGEMENT("team_management", Subscription.PlanType.STARTER),
    BASIC_ANALYTICS("basic_analytics", Subscription.PlanType.STARTER),
    PRIORITY_SUPPORT("priority_support", Subscription.PlanType.GROWTH),
    ADVANCED_ANALYTICS("advanced_analytics", Subscription.PlanType.GROWTH),
    API_ACCESS("api_access", Subscription.PlanType.ENTERPRISE),
    SSO("sso", Subscription.PlanType.ENTERPRISE);

    private final String key;
    private final Subscription.PlanType minimumPlan;

    Feature(String key, Subscription.PlanType minimumPlan) {
        this.key = key;
        this.minimumPlan = minimumPlan;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public Subscription.PlanType getMinimumPlan() {
        return minimumPlan;
    }

    /**
     * Exact, case-sensitive lookup by feature key as it appears in URLs.
     */
    public static Optional<Feature> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(feature -> feature.key.equals(key))
                .findFirst();
    }
}
