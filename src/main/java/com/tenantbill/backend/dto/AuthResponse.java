package com.tenantbill.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token issuance response. Registration fills in the tenant context;
 * rotation returns only the new token.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {

    public static final String TOKEN_TYPE = "bearer";

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    @Builder.Default
    private String tokenType = TOKEN_TYPE;

    private OrganizationDto organization;
    private UserDto user;
    private SubscriptionDto subscription;

    public static AuthResponse tokenOnly(String accessToken) {
        return AuthResponse.builder().accessToken(accessToken).build();
    }
}
