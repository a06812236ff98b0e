package com.tenantbill.backend.controllers;

import com.tenantbill.backend.auth.AuthenticatedUser;
import com.tenantbill.backend.dto.PlanCatalogDto;
import com.tenantbill.backend.dto.SubscriptionDto;
import com.tenantbill.backend.dto.SubscriptionPatchRequest;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.services.SubscriptionService;
import com.tenantbill.backend.services.billing.PlanCatalog;
import com.tenantbill.backend.util.TenantMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/billing")
@Slf4j
public class BillingController {

    private final PlanCatalog planCatalog;
    private final SubscriptionService subscriptionService;

    public BillingController(PlanCatalog planCatalog, SubscriptionService subscriptionService) {
        this.planCatalog = planCatalog;
        this.subscriptionService = subscriptionService;
    }

    /**
     * Public plan catalog with limits and unlocked features
     */
    @GetMapping("/plans")
    public ResponseEntity<PlanCatalogDto> getPlans() {
        List<PlanCatalogDto.PlanDto> plans = planCatalog.plans().stream()
                .map(plan -> PlanCatalogDto.PlanDto.builder()
                        .name(plan.getCode())
                        .rank(planCatalog.rank(plan))
                        .limits(planCatalog.limitsAsMap(plan))
                        .features(planCatalog.featuresFor(plan))
                        .build())
                .collect(Collectors.toList());

        return ResponseEntity.ok(new PlanCatalogDto(plans));
    }

    /**
     * Set plan and status directly, without provider-value normalization
     */
    @PatchMapping("/subscription")
    public ResponseEntity<SubscriptionDto> updateSubscription(@AuthenticationPrincipal AuthenticatedUser principal,
                                                              @Valid @RequestBody SubscriptionPatchRequest request) {
        Subscription updated = subscriptionService.adminUpdate(
                principal.getOrganizationId(), request.getPlan(), request.getStatus());
        return ResponseEntity.ok(TenantMapper.toDto(updated));
    }
}
