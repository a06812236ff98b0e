package com.tenantbill.backend.config;

import com.tenantbill.backend.models.Subscription;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-plan resource limits. Defaults apply to any plan not configured under app.plans.limits,
 * e.g. app.plans.limits.growth.max-users=75 (or APP_PLANS_LIMITS_GROWTH_MAXUSERS=75).
 */
@Component
@ConfigurationProperties(prefix = "app.plans")
@Data
@Slf4j
public class PlanPolicy {

    private Map<String, PlanLimits> limits = new HashMap<>();

    @lombok.Getter(lombok.AccessLevel.NONE)
    private final Map<Subscription.PlanType, PlanLimits> resolved = new EnumMap<>(Subscription.PlanType.class);

    @PostConstruct
    public void init() {
        resolved.put(Subscription.PlanType.STARTER, configuredOr("starter", 5, 10));
        resolved.put(Subscription.PlanType.GROWTH, configuredOr("growth", 50, 100));
        resolved.put(Subscription.PlanType.ENTERPRISE, configuredOr("enterprise", 500, 1000));

        resolved.forEach((plan, planLimits) ->
                log.info("Plan {}: {} users, {} projects",
                        plan.getCode(), planLimits.getMaxUsers(), planLimits.getMaxProjects()));
    }

    public PlanLimits getLimits(Subscription.PlanType plan) {
        return resolved.get(plan);
    }

    private PlanLimits configuredOr(String planCode, int defaultMaxUsers, int defaultMaxProjects) {
        PlanLimits configured = limits.get(planCode);
        if (configured != null) {
            return configured;
        }
        return PlanLimits.builder()
                .maxUsers(defaultMaxUsers)
                .maxProjects(defaultMaxProjects)
                .build();
    }

    @Data
    @lombok.Builder
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class PlanLimits {
        private int maxUsers;
        private int maxProjects;

        public boolean allowsAnotherUser(long currentUsers) {
            return currentUsers < maxUsers;
        }
    }
}
