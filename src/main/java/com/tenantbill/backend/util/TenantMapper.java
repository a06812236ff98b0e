package com.tenantbill.backend.util;

import com.tenantbill.backend.dto.OrganizationDto;
import com.tenantbill.backend.dto.SubscriptionDto;
import com.tenantbill.backend.dto.UserDto;
import com.tenantbill.backend.models.Organization;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.models.User;

public class TenantMapper {

    public static OrganizationDto toDto(Organization organization) {
        if (organization == null) {
            return null;
        }

        return OrganizationDto.builder()
                .id(organization.getId())
                .name(organization.getName())
                .slug(organization.getSlug())
                .createdAt(organization.getCreatedAt())
                .build();
    }

    public static UserDto toDto(User user) {
        if (user == null) {
            return null;
        }

        return UserDto.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .createdAt(user.getCreatedAt())
                .build();
    }

    public static SubscriptionDto toDto(Subscription subscription) {
        if (subscription == null) {
            return null;
        }

        return SubscriptionDto.builder()
                .plan(subscription.getPlan())
                .status(subscription.getStatus())
                .stripeCustomerId(subscription.getStripeCustomerId())
                .stripeSubscriptionId(subscription.getStripeSubscriptionId())
                .currentPeriodEnd(subscription.getCurrentPeriodEnd())
                .updatedAt(subscription.getUpdatedAt())
                .build();
    }
}
