package com.tenantbill.backend.services;

import com.tenantbill.backend.exceptions.ResourceNotFoundException;
import com.tenantbill.backend.models.Organization;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.repositories.OrganizationRepository;
import com.tenantbill.backend.repositories.SubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the one-subscription-per-organization record.
 */
@Service
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final OrganizationRepository organizationRepository;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               OrganizationRepository organizationRepository) {
        this.subscriptionRepository = subscriptionRepository;
        this.organizationRepository = organizationRepository;
    }

    /**
     * Return the organization's subscription, creating a starter/trialing one on first access.
     * Calling it twice yields the same row.
     */
    @Transactional
    public Subscription getOrCreateSubscription(Long organizationId) {
        return subscriptionRepository.findByOrganization_Id(organizationId)
                .orElseGet(() -> createDefault(organizationId));
    }

    /**
     * Administrative override: sets plan and status directly, bypassing normalization
     */
    @Transactional
    public Subscription adminUpdate(Long organizationId,
                                    Subscription.PlanType plan,
                                    Subscription.SubscriptionStatus status) {
        Subscription subscription = getOrCreateSubscription(organizationId);

        Subscription.PlanType previousPlan = subscription.getPlan();
        subscription.setPlan(plan);
        subscription.setStatus(status);
        Subscription saved = subscriptionRepository.saveAndFlush(subscription);

        log.info("Organization {} subscription set to {}/{} (was {})",
                organizationId, plan.getCode(), status.getCode(), previousPlan.getCode());
        return saved;
    }

    private Subscription createDefault(Long organizationId) {
        Organization organization = organizationRepository.findById(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Organization not found: " + organizationId));

        Subscription subscription = Subscription.builder()
                .organization(organization)
                .plan(Subscription.PlanType.STARTER)
                .status(Subscription.SubscriptionStatus.TRIALING)
                .build();
        organization.setSubscription(subscription);

        log.info("Created default subscription for organization {}", organizationId);
        return subscriptionRepository.saveAndFlush(subscription);
    }
}
