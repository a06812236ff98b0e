package com.tenantbill.backend.controllers;

import com.tenantbill.backend.auth.AuthenticatedUser;
import com.tenantbill.backend.dto.FeatureAccessDto;
import com.tenantbill.backend.exceptions.ResourceNotFoundException;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.services.PlanEnforcer;
import com.tenantbill.backend.services.SubscriptionService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/features")
public class FeatureController {

    private final SubscriptionService subscriptionService;
    private final PlanEnforcer planEnforcer;

    public FeatureController(SubscriptionService subscriptionService, PlanEnforcer planEnforcer) {
        this.subscriptionService = subscriptionService;
        this.planEnforcer = planEnforcer;
    }

    /**
     * Whether the caller's current plan unlocks the feature. Unknown keys are 404.
     */
    @GetMapping("/{featureKey}")
    public ResponseEntity<FeatureAccessDto> checkFeatureAccess(@AuthenticationPrincipal AuthenticatedUser principal,
                                                               @PathVariable String featureKey) {
        Feature feature = Feature.fromKey(featureKey)
                .orElseThrow(() -> new ResourceNotFoundException("Unknown feature."));

        Subscription subscription = subscriptionService.getOrCreateSubscription(principal.getOrganizationId());

        return ResponseEntity.ok(FeatureAccessDto.builder()
                .feature(feature)
                .plan(subscription.getPlan())
                .requiredPlan(feature.getMinimumPlan())
                .allowed(planEnforcer.allows(subscription.getPlan(), feature))
                .build());
    }
}
