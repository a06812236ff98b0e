package com.tenantbill.backend.services.billing;

import com.tenantbill.backend.config.PlanPolicy;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription.PlanType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PlanCatalogTest {

    private PlanCatalog planCatalog;

    @BeforeEach
    void setUp() {
        PlanPolicy planPolicy = new PlanPolicy();
        planPolicy.init();
        planCatalog = new PlanCatalog(planPolicy);
    }

    @Test
    void plans_ShouldBeOrderedByRank() {
        assertThat(planCatalog.plans())
                .containsExactly(PlanType.STARTER, PlanType.GROWTH, PlanType.ENTERPRISE);
        assertThat(planCatalog.rank(PlanType.STARTER)).isLessThan(planCatalog.rank(PlanType.GROWTH));
        assertThat(planCatalog.rank(PlanType.GROWTH)).isLessThan(planCatalog.rank(PlanType.ENTERPRISE));
    }

    @Test
    void limits_ShouldUseDefaultsWhenNotConfigured() {
        assertThat(planCatalog.limitsAsMap(PlanType.STARTER))
                .containsExactlyEntriesOf(Map.of("max_users", 5, "max_projects", 10));
        assertThat(planCatalog.limits(PlanType.GROWTH).getMaxUsers()).isEqualTo(50);
        assertThat(planCatalog.limits(PlanType.ENTERPRISE).getMaxProjects()).isEqualTo(1000);
    }

    @Test
    void limits_ShouldHonourConfiguredOverride() {
        PlanPolicy planPolicy = new PlanPolicy();
        planPolicy.getLimits().put("growth", new PlanPolicy.PlanLimits(75, 150));
        planPolicy.init();

        PlanCatalog catalog = new PlanCatalog(planPolicy);

        assertThat(catalog.limits(PlanType.GROWTH).getMaxUsers()).isEqualTo(75);
        assertThat(catalog.limits(PlanType.STARTER).getMaxUsers()).isEqualTo(5);
    }

    @Test
    void featuresFor_ShouldReturnSortedUnlockedFeatures() {
        assertThat(planCatalog.featuresFor(PlanType.STARTER))
                .containsExactly("basic_analytics", "team_management");
        assertThat(planCatalog.featuresFor(PlanType.GROWTH))
                .containsExactly("advanced_analytics", "basic_analytics", "priority_support", "team_management");
        assertThat(planCatalog.featuresFor(PlanType.ENTERPRISE)).hasSize(Feature.values().length).isSorted();
    }

    @Test
    void minPlanFor_ShouldFollowFeatureTable() {
        assertThat(planCatalog.minPlanFor(Feature.TEAM_MANAGEMENT)).isEqualTo(PlanType.STARTER);
        assertThat(planCatalog.minPlanFor(Feature.ADVANCED_ANALYTICS)).isEqualTo(PlanType.GROWTH);
        assertThat(planCatalog.minPlanFor(Feature.SSO)).isEqualTo(PlanType.ENTERPRISE);
    }

    @Test
    void stringLookups_ShouldNotThrowForUnknownKeys() {
        assertThat(planCatalog.isValidPlan("growth")).isTrue();
        assertThat(planCatalog.isValidPlan("platinum")).isFalse();
        assertThat(planCatalog.isValidPlan(null)).isFalse();
        assertThat(planCatalog.isValidFeature("sso")).isTrue();
        assertThat(planCatalog.isValidFeature("SSO")).isFalse();
        assertThat(planCatalog.isValidFeature("teleport")).isFalse();
    }
}
