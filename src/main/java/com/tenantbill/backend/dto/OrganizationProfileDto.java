package com.tenantbill.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationProfileDto {
    private OrganizationDto organization;
    private SubscriptionDto subscription;
}
