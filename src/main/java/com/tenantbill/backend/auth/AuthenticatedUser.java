package com.tenantbill.backend.auth;

import lombok.Value;

/**
 * Principal placed in the security context once a bearer token has been resolved.
 */
@Value
public class AuthenticatedUser {
    Long userId;
    Long organizationId;
    Long tokenId;
    String email;
}
