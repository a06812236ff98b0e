package com.tenantbill.backend.controllers;

import com.tenantbill.backend.auth.AuthenticatedUser;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.services.PlanEnforcer;
import com.tenantbill.backend.services.SubscriptionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/reports")
public class ReportController {

    private final SubscriptionService subscriptionService;
    private final PlanEnforcer planEnforcer;

    public ReportController(SubscriptionService subscriptionService, PlanEnforcer planEnforcer) {
        this.subscriptionService = subscriptionService;
        this.planEnforcer = planEnforcer;
    }

    /**
     * Advanced analytics KPIs (static sample figures). Requires Growth or higher, 402 otherwise.
     */
    @GetMapping("/advanced")
    public ResponseEntity<Map<String, Object>> advancedReport(@AuthenticationPrincipal AuthenticatedUser principal) {
        Subscription subscription = subscriptionService.getOrCreateSubscription(principal.getOrganizationId());
        planEnforcer.requireFeature(subscription, Feature.ADVANCED_ANALYTICS);

        Map<String, Object> kpis = new LinkedHashMap<>();
        kpis.put("mrr", 12800);
        kpis.put("churn_rate", 0.032);
        kpis.put("expansion_revenue", 1900);

        return ResponseEntity.ok(Map.of("kpis", kpis));
    }
}
