package com.tenantbill.backend.services;

import com.tenantbill.backend.dto.OrganizationProfileDto;
import com.tenantbill.backend.dto.UserCreateRequest;
import com.tenantbill.backend.dto.UserDto;
import com.tenantbill.backend.exceptions.ConflictException;
import com.tenantbill.backend.exceptions.ResourceNotFoundException;
import com.tenantbill.backend.models.Organization;
import com.tenantbill.backend.models.Subscription;
import com.tenantbill.backend.models.User;
import com.tenantbill.backend.repositories.OrganizationRepository;
import com.tenantbill.backend.repositories.UserRepository;
import com.tenantbill.backend.util.EmailNormalizer;
import com.tenantbill.backend.util.TenantMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Organization profile and tenant user management.
 */
@Service
@Slf4j
public class OrganizationService {

    private final OrganizationRepository organizationRepository;
    private final UserRepository userRepository;
    private final SubscriptionService subscriptionService;
    private final PlanEnforcer planEnforcer;

    public OrganizationService(OrganizationRepository organizationRepository,
                               UserRepository userRepository,
                               SubscriptionService subscriptionService,
                               PlanEnforcer planEnforcer) {
        this.organizationRepository = organizationRepository;
        this.userRepository = userRepository;
        this.subscriptionService = subscriptionService;
        this.planEnforcer = planEnforcer;
    }

    @Transactional
    public OrganizationProfileDto getProfile(Long organizationId) {
        Organization organization = findOrganization(organizationId);
        Subscription subscription = subscriptionService.getOrCreateSubscription(organizationId);
        return new OrganizationProfileDto(TenantMapper.toDto(organization), TenantMapper.toDto(subscription));
    }

    @Transactional(readOnly = true)
    public List<UserDto> listUsers(Long organizationId) {
        return userRepository.findByOrganizationIdOrderByIdAsc(organizationId).stream()
                .map(TenantMapper::toDto)
                .collect(Collectors.toList());
    }

    /**
     * Add a user to the organization, subject to the plan's user limit
     */
    @Transactional
    public UserDto createUser(Long organizationId, UserCreateRequest request) {
        String email = EmailNormalizer.normalize(request.getEmail());

        Subscription subscription = subscriptionService.getOrCreateSubscription(organizationId);
        planEnforcer.assertUserCapacity(organizationId, subscription.getPlan());

        if (userRepository.existsByOrganizationIdAndEmail(organizationId, email)) {
            throw new ConflictException("User already exists in this organization.");
        }

        User user = User.builder()
                .organization(findOrganization(organizationId))
                .email(email)
                .fullName(request.getFullName().trim())
                .build();

        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("User already exists in this organization.", e);
        }

        log.info("Added user {} to organization {}", user.getId(), organizationId);
        return TenantMapper.toDto(user);
    }

    private Organization findOrganization(Long organizationId) {
        return organizationRepository.findById(organizationId)
                .orElseThrow(() -> new ResourceNotFoundException("Organization not found: " + organizationId));
    }
}
