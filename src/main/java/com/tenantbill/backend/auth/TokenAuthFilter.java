package com.tenantbill.backend.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Bearer token authentication filter.
 *
 * Requests without a usable token continue unauthenticated; the security chain decides
 * whether the endpoint needs one. Webhook endpoints are never filtered.
 */
@Component
@Slf4j
public class TokenAuthFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "bearer ";

    private final TokenService tokenService;

    public TokenAuthFilter(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("No Bearer token found for: {} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            Optional<AuthenticatedUser> principal = tokenService.authenticate(token);
            if (principal.isPresent()) {
                UsernamePasswordAuthenticationToken authToken =
                        new UsernamePasswordAuthenticationToken(principal.get(), null, Collections.emptyList());
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);

                log.debug("Authenticated user {} (org {}) for: {} {}",
                        principal.get().getUserId(), principal.get().getOrganizationId(),
                        request.getMethod(), request.getRequestURI());
            } else {
                log.warn("Invalid or revoked token on: {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Webhooks authenticate by signature, not by bearer token
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/billing/webhooks/")
                || "OPTIONS".equals(request.getMethod());
    }
}
