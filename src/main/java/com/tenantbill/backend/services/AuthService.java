package com.tenantbill.backend.services;

import com.tenantbill.backend.auth.TokenService;
import com.tenantbill.backend.dto.AuthResponse;
import com.tenantbill.backend.dto.RegisterRequest;
import com.tenantbill.backend.exceptions.ConflictException;
import com.tenantbill.backend.models.Organization;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.models.User;
import com.tenantbill.backend.repositories.OrganizationRepository;
import com.tenantbill.backend.util.EmailNormalizer;
import com.tenantbill.backend.util.TenantMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant signup and token rotation.
 */
@Service
@Slf4j
public class AuthService {

    private final OrganizationRepository organizationRepository;
    private final TokenService tokenService;

    public AuthService(OrganizationRepository organizationRepository, TokenService tokenService) {
        this.organizationRepository = organizationRepository;
        this.tokenService = tokenService;
    }

    /**
     * Create organization, owner user, starter/trialing subscription and the first token.
     * All four rows commit together or not at all.
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = EmailNormalizer.normalize(request.getEmail());
        String slug = request.getOrganizationSlug().trim();

        if (organizationRepository.existsBySlug(slug)) {
            throw new ConflictException("Organization slug already exists.");
        }

        Organization organization = Organization.builder()
                .name(request.getOrganizationName().trim())
                .slug(slug)
                .build();

        User owner = User.builder()
                .organization(organization)
                .email(email)
                .fullName(request.getFullName().trim())
                .build();
        organization.getUsers().add(owner);

        Subscription subscription = Subscription.builder()
                .organization(organization)
                .plan(Subscription.PlanType.STARTER)
                .status(Subscription.SubscriptionStatus.TRIALING)
                .build();
        organization.setSubscription(subscription);

        try {
            organization = organizationRepository.saveAndFlush(organization);
        } catch (DataIntegrityViolationException e) {
            // Slug taken by a concurrent registration
            throw new ConflictException("Unable to register organization with provided data.", e);
        }

        String accessToken = tokenService.issueToken(owner);

        log.info("Registered organization {} ({}) with owner {}", organization.getId(), slug, owner.getId());

        return AuthResponse.builder()
                .accessToken(accessToken)
                .organization(TenantMapper.toDto(organization))
                .user(TenantMapper.toDto(owner))
                .subscription(TenantMapper.toDto(subscription))
                .build();
    }

    @Transactional
    public AuthResponse rotate(Long tokenId) {
        return AuthResponse.tokenOnly(tokenService.rotateToken(tokenId));
    }
}
