package com.tenantbill.backend.services;

import com.tenantbill.backend.config.PlanPolicy;
import com.tenantbill.backend.exceptions.FeatureNotEntitledException;
import com.tenantbill.backend.exceptions.PlanLimitExceededException;
import com.tenantbill.backend.models.Feature;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.models.Subscription.PlanType;
import com.tenantbill.backend.repositories.UserRepository;
import com.tenantbill.backend.services.billing.PlanCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlanEnforcerTest {

    @Mock
    private UserRepository userRepository;

    private PlanEnforcer planEnforcer;

    @BeforeEach
    void setUp() {
        PlanPolicy planPolicy = new PlanPolicy();
        planPolicy.init();
        planEnforcer = new PlanEnforcer(new PlanCatalog(planPolicy), userRepository);
    }

    @Test
    void allows_ShouldBeMonotonicInPlanRank() {
        for (Feature feature : Feature.values()) {
            for (PlanType lower : PlanType.values()) {
                for (PlanType higher : PlanType.values()) {
                    if (lower.getRank() <= higher.getRank() && planEnforcer.allows(lower, feature)) {
                        assertThat(planEnforcer.allows(higher, feature))
                                .as("%s allowed on %s but not on %s", feature, lower, higher)
                                .isTrue();
                    }
                }
            }
        }
    }

    @Test
    void allows_ShouldGateAdvancedAnalyticsAtGrowth() {
        assertThat(planEnforcer.allows(PlanType.STARTER, Feature.ADVANCED_ANALYTICS)).isFalse();
        assertThat(planEnforcer.allows(PlanType.GROWTH, Feature.ADVANCED_ANALYTICS)).isTrue();
        assertThat(planEnforcer.allows(PlanType.ENTERPRISE, Feature.ADVANCED_ANALYTICS)).isTrue();
        assertThat(planEnforcer.allows(PlanType.GROWTH, Feature.SSO)).isFalse();
    }

    @Test
    void allows_ShouldDenyUnknownKeys() {
        assertThat(planEnforcer.allows("growth", "advanced_analytics")).isTrue();
        assertThat(planEnforcer.allows("platinum", "advanced_analytics")).isFalse();
        assertThat(planEnforcer.allows("enterprise", "teleport")).isFalse();
        assertThat(planEnforcer.allows((String) null, null)).isFalse();
    }

    @Test
    void requireFeature_ShouldThrowPaymentRequiredWhenDenied() {
        // Given
        Subscription subscription = Subscription.builder().plan(PlanType.STARTER).build();

        // When / Then
        assertThatThrownBy(() -> planEnforcer.requireFeature(subscription, Feature.ADVANCED_ANALYTICS))
                .isInstanceOf(FeatureNotEntitledException.class)
                .hasMessage("advanced_analytics requires Growth plan or higher.");
    }

    @Test
    void requireFeature_ShouldPassWhenEntitled() {
        Subscription subscription = Subscription.builder().plan(PlanType.ENTERPRISE).build();

        assertThatCode(() -> planEnforcer.requireFeature(subscription, Feature.SSO)).doesNotThrowAnyException();
    }

    @Test
    void assertUserCapacity_ShouldRejectAtPlanLimit() {
        // Given
        when(userRepository.countByOrganizationId(7L)).thenReturn(5L);

        // When / Then
        assertThatThrownBy(() -> planEnforcer.assertUserCapacity(7L, PlanType.STARTER))
                .isInstanceOf(PlanLimitExceededException.class)
                .hasMessageContaining("(5)");
    }

    @Test
    void assertUserCapacity_ShouldAllowBelowLimit() {
        when(userRepository.countByOrganizationId(7L)).thenReturn(4L);

        assertThatCode(() -> planEnforcer.assertUserCapacity(7L, PlanType.STARTER)).doesNotThrowAnyException();
        verify(userRepository).countByOrganizationId(7L);
    }
}
