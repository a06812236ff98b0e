package com.tenantbill.backend.controllers;

import com.tenantbill.backend.auth.AuthenticatedUser;
import com.tenantbill.backend.dto.OrganizationProfileDto;
import com.tenantbill.backend.dto.UserCreateRequest;
import com.tenantbill.backend.dto.UserDto;
import com.tenantbill.backend.services.OrganizationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * The caller's own organization. Tenancy comes from the token, never from the URL.
 */
@RestController
@RequestMapping("/organizations/me")
public class OrganizationController {

    private final OrganizationService organizationService;

    public OrganizationController(OrganizationService organizationService) {
        this.organizationService = organizationService;
    }

    @GetMapping
    public ResponseEntity<OrganizationProfileDto> getMyOrganization(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(organizationService.getProfile(principal.getOrganizationId()));
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserDto>> listUsers(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(organizationService.listUsers(principal.getOrganizationId()));
    }

    @PostMapping("/users")
    public ResponseEntity<UserDto> createUser(@AuthenticationPrincipal AuthenticatedUser principal,
                                              @Valid @RequestBody UserCreateRequest request) {
        UserDto created = organizationService.createUser(principal.getOrganizationId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }
}
