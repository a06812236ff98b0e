package com.tenantbill.backend.controllers;

import com.tenantbill.backend.auth.AuthenticatedUser;
import com.tenantbill.backend.dto.AuthResponse;
import com.tenantbill.backend.dto.RegisterRequest;
import com.tenantbill.backend.services.AuthService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/auth")
@Slf4j
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Revoke the token used for this request and return its replacement
     */
    @PostMapping("/tokens/rotate")
    public ResponseEntity<AuthResponse> rotateToken(@AuthenticationPrincipal AuthenticatedUser principal) {
        log.info("Rotating token for user {}", principal.getUserId());
        return ResponseEntity.ok(authService.rotate(principal.getTokenId()));
    }
}
