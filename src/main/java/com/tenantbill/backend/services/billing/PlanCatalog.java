package com.tenantbill.backend.services.billing;

import com.tenantbill.backend.config.PlanPolicy;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription.PlanType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only view over plans, their ranks, limits and the features each plan unlocks.
 */
@Component
public class PlanCatalog {

    private final PlanPolicy planPolicy;

    public PlanCatalog(PlanPolicy planPolicy) {
        this.planPolicy = planPolicy;
    }

    public int rank(PlanType plan) {
        return plan.getRank();
    }

    public PlanPolicy.PlanLimits limits(PlanType plan) {
        return planPolicy.getLimits(plan);
    }

    public PlanType minPlanFor(Feature feature) {
        return feature.getMinimumPlan();
    }

    /**
     * Feature keys unlocked by the plan, sorted alphabetically
     */
    public List<String> featuresFor(PlanType plan) {
        return Arrays.stream(Feature.values())
                .filter(feature -> rank(plan) >= rank(minPlanFor(feature)))
                .map(Feature::getKey)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * All plans in ascending rank order
     */
    public List<PlanType> plans() {
        List<PlanType> plans = new ArrayList<>(Arrays.asList(PlanType.values()));
        plans.sort(Comparator.comparingInt(PlanType::getRank));
        return plans;
    }

    public boolean isValidPlan(String planCode) {
        return PlanType.fromCode(planCode).isPresent();
    }

    public boolean isValidFeature(String featureKey) {
        return Feature.fromKey(featureKey).isPresent();
    }

    public Map<String, Integer> limitsAsMap(PlanType plan) {
        PlanPolicy.PlanLimits planLimits = limits(plan);
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("max_users", planLimits.getMaxUsers());
        map.put("max_projects", planLimits.getMaxProjects());
        return map;
    }
}
