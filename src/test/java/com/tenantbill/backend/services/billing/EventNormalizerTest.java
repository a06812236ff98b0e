package com.tenantbill.backend.services.billing;

import com.tenantbill.backend.models.Subscription.PlanType;
import com.tenantbill.backend.models.Subscription.SubscriptionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class EventNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "Enterprise, ENTERPRISE",
            "'  ENTERPRISE annual ', ENTERPRISE",
            "Growth Monthly, GROWTH",
            "pro, GROWTH",
            "Pro-Yearly, GROWTH",
            "starter, STARTER",
            "Basic, STARTER",
            "basic-plus, STARTER"
    })
    void normalizePlan_ShouldMatchBySubstringPriority(String raw, PlanType expected) {
        assertThat(EventNormalizer.normalizePlan(raw)).contains(expected);
    }

    @Test
    void normalizePlan_ShouldPreferEnterpriseOverOtherMatches() {
        // "enterprise pro" contains both "enterprise" and "pro"
        assertThat(EventNormalizer.normalizePlan("enterprise pro")).contains(PlanType.ENTERPRISE);
        assertThat(EventNormalizer.normalizePlan("pro basic")).contains(PlanType.GROWTH);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "platinum", "gold", "free"})
    void normalizePlan_ShouldReturnEmptyForUnknownOrBlank(String raw) {
        assertThat(EventNormalizer.normalizePlan(raw)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(PlanType.class)
    void normalizePlan_ShouldBeIdempotentOnCanonicalCodes(PlanType plan) {
        PlanType once = EventNormalizer.normalizePlan(plan.getCode()).orElseThrow();
        PlanType twice = EventNormalizer.normalizePlan(once.getCode()).orElseThrow();

        assertThat(once).isEqualTo(plan);
        assertThat(twice).isEqualTo(once);
    }

    @ParameterizedTest
    @CsvSource({
            "trialing, TRIALING",
            "ACTIVE, ACTIVE",
            "' canceled ', CANCELED",
            "unpaid, CANCELED",
            "past_due, CANCELED",
            "incomplete, CANCELED",
            "Incomplete_Expired, CANCELED"
    })
    void normalizeStatus_ShouldMapKnownStatuses(String raw, SubscriptionStatus expected) {
        assertThat(EventNormalizer.normalizeStatus(raw)).contains(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "paused", "cancelled", "expired"})
    void normalizeStatus_ShouldReturnEmptyForUnknownOrBlank(String raw) {
        assertThat(EventNormalizer.normalizeStatus(raw)).isEmpty();
    }
}
