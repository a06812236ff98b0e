package com.tenantbill.backend.services;

import com.tenantbill.backend.config.PlanPolicy;
import com.tenantbill.backend.exceptions.FeatureNotEntitledException;
import com.tenantbill.backend.exceptions.PlanLimitExceededException;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.repositories.UserRepository;
import com.tenantbill.backend.services.billing.PlanCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Service for enforcing plan limits and feature entitlements.
 * Access is decided by plan rank alone; subscription status does not gate features.
 */
@Service
@Slf4j
public class PlanEnforcer {

    private final PlanCatalog planCatalog;
    private final UserRepository userRepository;

    public PlanEnforcer(PlanCatalog planCatalog, UserRepository userRepository) {
        this.planCatalog = planCatalog;
        this.userRepository = userRepository;
    }

    /**
     * True when the plan's rank reaches the feature's minimum plan rank
     */
    public boolean allows(Subscription.PlanType plan, Feature feature) {
        if (plan == null || feature == null) {
            return false;
        }
        return planCatalog.rank(plan) >= planCatalog.rank(planCatalog.minPlanFor(feature));
    }

    /**
     * Raw-key variant. Unknown plan or feature keys are denied rather than rejected.
     */
    public boolean allows(String planCode, String featureKey) {
        Optional<Subscription.PlanType> plan = Subscription.PlanType.fromCode(planCode);
        Optional<Feature> feature = Feature.fromKey(featureKey);
        if (plan.isEmpty() || feature.isEmpty()) {
            return false;
        }
        return allows(plan.get(), feature.get());
    }

    /**
     * Throw the payment-required error when the subscription's plan does not unlock the feature
     */
    public void requireFeature(Subscription subscription, Feature feature) {
        if (!allows(subscription.getPlan(), feature)) {
            log.debug("Organization {} on {} denied {}",
                    subscription.getOrganizationId(), subscription.getPlan().getCode(), feature.getKey());
            throw new FeatureNotEntitledException(feature);
        }
    }

    /**
     * Reject adding a user once the organization is at its plan's user limit.
     * Read-then-write: two concurrent additions can both pass the check.
     */
    public void assertUserCapacity(Long organizationId, Subscription.PlanType plan) {
        PlanPolicy.PlanLimits limits = planCatalog.limits(plan);
        long currentUsers = userRepository.countByOrganizationId(organizationId);

        if (!limits.allowsAnotherUser(currentUsers)) {
            log.info("Organization {} at user limit ({}/{}) on {}",
                    organizationId, currentUsers, limits.getMaxUsers(), plan.getCode());
            throw new PlanLimitExceededException(String.format(
                    "Plan user limit reached (%d). Upgrade plan to add more users.", limits.getMaxUsers()));
        }
    }
}
